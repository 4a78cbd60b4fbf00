package com.raditha.codetwin.model;

/**
 * Which of the two compared collections a file belongs to.
 */
public enum Side {
    A,
    B;

    /**
     * Key used for a file in reports, e.g. {@code A:src/Main.java}.
     */
    public String qualify(String relativePath) {
        return name() + ":" + relativePath;
    }
}
