package com.logtail.adapter.spi;

/**
 * Exception thrown when a callback or stream handler is missing.
 */
public class InvalidHandlerException extends LogTailException {

    public InvalidHandlerException(String message) {
        super(message);
    }
}
