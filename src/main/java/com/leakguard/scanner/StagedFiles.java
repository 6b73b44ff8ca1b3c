package com.leakguard.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Lists the files staged in the git index of a working tree.
 *
 * <p>Deleted files are excluded ({@code --diff-filter=ACMR}). git reports staged paths relative
 * to the repository root, so they are resolved against {@code git rev-parse --show-toplevel}
 * and work from any subdirectory.</p>
 */
public class StagedFiles {
    private static final Logger logger = LoggerFactory.getLogger(StagedFiles.class);

    private final File workTree;

    /**
     * @param workTree any directory inside the repository, or null for the current directory
     */
    public StagedFiles(File workTree) {
        this.workTree = workTree;
    }

    /**
     * @return staged paths, relative to the current directory when {@code workTree} is null,
     * absolute otherwise
     * @throws IOException if git cannot be run or exits non-zero (e.g. outside a repository)
     */
    public List<String> list() throws IOException, InterruptedException {
        Path topLevel = Paths.get(git("rev-parse", "--show-toplevel").trim());
        String output = git("diff", "--cached", "--name-only", "--diff-filter=ACMR", "-z");

        // Real path, matching the canonical form git prints
        Path base = workTree == null ? Paths.get("").toRealPath() : null;
        List<String> files = new ArrayList<>();
        for (String name : parse(output)) {
            Path file = topLevel.resolve(name);
            files.add(base != null ? base.relativize(file).toString() : file.toString());
        }
        logger.debug("Staged files under {}: {}", topLevel, files.size());
        return files;
    }

    private String git(String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(Arrays.asList(args));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workTree);
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);

        Process process = pb.start();
        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        int exitCode = process.waitFor();
        if (exitCode != 0) {
            throw new IOException("git " + args[0] + " failed with exit code " + exitCode);
        }
        return output;
    }

    /**
     * Splits NUL-separated {@code git diff -z} output.
     */
    static List<String> parse(String output) {
        List<String> files = new ArrayList<>();
        for (String name : output.split("\0")) {
            if (!name.isEmpty()) {
                files.add(name);
            }
        }
        return files;
    }
}
