package com.logtail.adapter.spi;

/**
 * Entry point to a bounded log store implementation.
 */
public interface LogStoreDriver {

    /**
     * Returns the connection string scheme, including {@code ://}.
     */
    String scheme();

    /**
     * Connects to the store.
     *
     * @param connectionString the connection identifier
     * @return an established connection
     * @throws ConnectionException if the store cannot be reached
     */
    LogStoreConnection connect(String connectionString);
}
