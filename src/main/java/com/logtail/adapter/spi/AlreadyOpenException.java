package com.logtail.adapter.spi;

/**
 * Exception reported when {@code open} is requested while the adapter is
 * already open, or still opening or closing.
 */
public class AlreadyOpenException extends LogTailException {

    private final String state;

    public AlreadyOpenException(String state) {
        super("adapter is not closed (state " + state + ")");
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
