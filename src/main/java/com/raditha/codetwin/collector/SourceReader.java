package com.raditha.codetwin.collector;

import com.raditha.codetwin.model.Side;
import com.raditha.codetwin.model.SourceFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source files as UTF-8. Malformed byte sequences are replaced rather
 * than rejected, so binary noise in a source file never aborts a run.
 */
public class SourceReader {

    private final long maxFileBytes;

    public SourceReader(long maxFileBytes) {
        if (maxFileBytes < 1) {
            throw new IllegalArgumentException("maxFileBytes must be >= 1");
        }
        this.maxFileBytes = maxFileBytes;
    }

    /**
     * @param root         collection root
     * @param relativePath '/' separated path below root
     * @param side         owning collection
     * @throws FileTooLargeException if the file is bigger than the limit
     * @throws IOException           if the file cannot be read
     */
    public SourceFile read(Path root, String relativePath, Side side) throws IOException {
        Path file = root.resolve(relativePath);
        long size = Files.size(file);
        if (size > maxFileBytes) {
            throw new FileTooLargeException(relativePath, size, maxFileBytes);
        }
        byte[] bytes = Files.readAllBytes(file);
        return new SourceFile(relativePath, side, new String(bytes, StandardCharsets.UTF_8));
    }
}
