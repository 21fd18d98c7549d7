package com.logtail.adapter.spi;

/**
 * Exception reported when releasing the cursor or the store connection fails.
 * The cause is the first failure; later failures are attached as suppressed.
 */
public class CloseException extends LogTailException {

    public CloseException(String message, Throwable cause) {
        super(message, cause);
    }
}
