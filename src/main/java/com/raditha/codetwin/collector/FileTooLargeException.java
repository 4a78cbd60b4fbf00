package com.raditha.codetwin.collector;

import java.io.IOException;

/**
 * A file exceeded the configured size limit and was not read.
 */
public class FileTooLargeException extends IOException {

    public FileTooLargeException(String path, long size, long limit) {
        super("file size " + size + " bytes exceeds limit of " + limit + " bytes: " + path);
    }
}
