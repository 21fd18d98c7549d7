package com.logtail.stream;

/**
 * Lifecycle state of a {@link LogStreamAdapter}.
 */
public enum ConnectionState {
    CLOSED,
    CONNECTING,
    OPEN,
    CLOSING
}
