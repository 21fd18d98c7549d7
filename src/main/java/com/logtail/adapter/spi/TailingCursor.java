package com.logtail.adapter.spi;

import java.util.Optional;

/**
 * A live, natural-order cursor over a capped collection that waits for new
 * records instead of ending when it catches up.
 *
 * <p>Not thread-safe: a cursor is owned by the single thread that reads it.
 */
public interface TailingCursor extends AutoCloseable {

    /**
     * Waits up to the store's await interval for the next record.
     *
     * @return the next record, or empty if none arrived in the interval
     * @throws CursorException if the feed failed or the cursor is dead
     */
    Optional<LogRecord> tryNext();

    /**
     * Closes the cursor. Closing an already closed cursor succeeds.
     */
    @Override
    void close();
}
