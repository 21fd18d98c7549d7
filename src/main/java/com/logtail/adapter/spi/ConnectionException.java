package com.logtail.adapter.spi;

/**
 * Exception thrown when the log store cannot be reached.
 */
public class ConnectionException extends LogTailException {

    private final String target;

    public ConnectionException(String target, String message) {
        super(message);
        this.target = target;
    }

    public ConnectionException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    /**
     * Returns the store address that failed, without credentials.
     */
    public String getTarget() {
        return target;
    }
}
