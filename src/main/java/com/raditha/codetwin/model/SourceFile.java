package com.raditha.codetwin.model;

/**
 * A source file handed to the pipeline.
 * The text is only held until the file has been fingerprinted.
 *
 * @param path relative path inside its collection, always '/' separated
 * @param side owning collection
 * @param text decoded file content
 */
public record SourceFile(String path, Side side, String text) {

    public SourceFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be blank");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        if (text == null) {
            text = "";
        }
    }
}
