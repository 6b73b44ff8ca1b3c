package com.leakguard.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Reads a candidate file into a {@link ScanTarget}.
 *
 * <p>Paths that do not name a regular file, files over the size limit and files that are not
 * UTF-8 text are skipped without an error; the reason is logged at DEBUG.</p>
 */
public class TargetLoader {
    private static final Logger logger = LoggerFactory.getLogger(TargetLoader.class);

    private static final char BOM = '\uFEFF';

    private final long maxFileSize;

    public TargetLoader(long maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    /**
     * @return the decoded file, or empty if it is skipped
     * @throws IOException if the file exists but reading it fails
     */
    public Optional<ScanTarget> load(String path) throws IOException {
        Path file;
        try {
            file = Paths.get(path);
        } catch (InvalidPathException e) {
            logger.debug("Skipping invalid path: {}", path);
            return Optional.empty();
        }

        if (!Files.isRegularFile(file)) {
            logger.debug("Skipping missing or non-regular file: {}", path);
            return Optional.empty();
        }

        long size = Files.size(file);
        if (size > maxFileSize) {
            logger.debug("Skipping large file ({} bytes > limit {}): {}", size, maxFileSize, path);
            return Optional.empty();
        }

        byte[] bytes = Files.readAllBytes(file);
        Optional<String> text = decode(bytes);
        if (text.isEmpty()) {
            logger.debug("Skipping non-text file: {}", path);
            return Optional.empty();
        }
        return Optional.of(new ScanTarget(path, text.get()));
    }

    static Optional<String> decode(byte[] bytes) {
        for (byte b : bytes) {
            if (b == 0) {
                return Optional.empty(); // NUL byte: binary
            }
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String content = decoder.decode(ByteBuffer.wrap(bytes)).toString();
            if (!content.isEmpty() && content.charAt(0) == BOM) {
                content = content.substring(1);
            }
            return Optional.of(content);
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
