package com.leakguard.scanner;

import com.leakguard.config.ScanConfig;
import com.leakguard.rules.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans a list of files and returns their findings in argument order, then line order.
 *
 * <p>A failure while reading or scanning one file is logged and the file contributes no findings;
 * the remaining files are still scanned.</p>
 */
public class SecretScanner {
    private static final Logger logger = LoggerFactory.getLogger(SecretScanner.class);

    private final TargetLoader loader;
    private final ContentScanner contentScanner;
    private final int threads;
    private final long fileTimeoutSeconds;

    public SecretScanner(RuleRegistry registry, ScanConfig config) {
        this.loader = new TargetLoader(config.getMaxFileSize());
        this.contentScanner = new ContentScanner(registry, new CommentFilter(config.getCommentMarkers()));
        this.threads = Math.max(1, config.getThreads());
        this.fileTimeoutSeconds = config.getFileTimeoutSeconds();
    }

    public List<Finding> scan(List<String> paths) {
        logger.debug("Scanning {} file(s) with {} thread(s)", paths.size(), threads);

        List<Finding> findings;
        if (threads == 1 && fileTimeoutSeconds <= 0) {
            findings = new ArrayList<>();
            for (String path : paths) {
                findings.addAll(scanFile(path));
            }
        } else {
            findings = scanConcurrently(paths);
        }

        logger.debug("Secret scan found {} potential secret(s).", findings.size());
        return findings;
    }

    List<Finding> scanFile(String path) {
        try {
            Optional<ScanTarget> target = loader.load(path);
            if (target.isEmpty()) {
                return List.of();
            }
            return contentScanner.scan(target.get());
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not scan file: {}", path, e);
            return List.of();
        }
    }

    /**
     * Runs at most {@code threads} files at once. Each file's budget starts when it is handed to a
     * thread; a file that overruns gives up its slot so the files after it still run. The stuck
     * thread is abandoned to finish on its own.
     */
    private List<Finding> scanConcurrently(List<String> paths) {
        ExecutorService pool = Executors.newCachedThreadPool(new ScanThreadFactory());
        Semaphore slots = new Semaphore(threads);
        try {
            List<CompletableFuture<List<Finding>>> futures = new ArrayList<>();
            for (String path : paths) {
                try {
                    slots.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while scanning " + path, e);
                }
                CompletableFuture<List<Finding>> future = CompletableFuture.supplyAsync(() -> scanFile(path), pool);
                if (fileTimeoutSeconds > 0) {
                    future.orTimeout(fileTimeoutSeconds, TimeUnit.SECONDS);
                }
                future.whenComplete((result, error) -> slots.release());
                futures.add(future);
            }

            // Collect in submission order so the result matches a sequential run
            List<Finding> findings = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    findings.addAll(futures.get(i).get());
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof TimeoutException) {
                        logger.warn("Scan of {} exceeded {}s budget, skipped", paths.get(i), fileTimeoutSeconds);
                    } else {
                        logger.warn("Could not scan file: {}", paths.get(i), e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while scanning " + paths.get(i), e);
                }
            }
            return findings;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Daemon threads: a regex stuck past its budget ignores interruption and must not keep the JVM alive.
     */
    private static final class ScanThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "leakguard-scan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
