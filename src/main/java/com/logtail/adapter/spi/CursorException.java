package com.logtail.adapter.spi;

/**
 * Exception raised by a live tailing cursor. Delivered to stream subscribers
 * rather than thrown out of the adapter.
 */
public class CursorException extends LogTailException {

    public CursorException(String message) {
        super(message);
    }

    public CursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
