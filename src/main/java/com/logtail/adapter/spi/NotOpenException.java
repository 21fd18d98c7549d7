package com.logtail.adapter.spi;

/**
 * Exception reported when an operation needs an open adapter.
 */
public class NotOpenException extends LogTailException {

    public NotOpenException(String message) {
        super(message);
    }
}
