package com.raditha.codetwin.model;

/**
 * A file that was left out of the comparison, and why.
 */
public record ProcessingWarning(Side side, String path, String message) {

    @Override
    public String toString() {
        return side.qualify(path) + ": " + message;
    }
}
