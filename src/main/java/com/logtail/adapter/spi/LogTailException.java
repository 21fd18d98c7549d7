package com.logtail.adapter.spi;

/**
 * Base exception for logtail errors.
 */
public class LogTailException extends RuntimeException {

    public LogTailException(String message) {
        super(message);
    }

    public LogTailException(String message, Throwable cause) {
        super(message, cause);
    }
}
