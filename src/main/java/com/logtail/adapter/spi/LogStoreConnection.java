package com.logtail.adapter.spi;

import java.util.List;
import java.util.Optional;

/**
 * An established connection to a bounded log store.
 */
public interface LogStoreConnection extends AutoCloseable {

    /**
     * Looks up collection metadata.
     *
     * @param collectionName the collection name
     * @return the options, or empty if the collection does not exist
     */
    Optional<CollectionOptions> collectionOptions(String collectionName);

    /**
     * Opens a tailing cursor in natural (append) order, positioned after the
     * newest record present when it opens.
     *
     * @param collectionName the collection name
     * @param fields         the fields to project
     * @return the open cursor
     * @throws CursorException if the cursor cannot be opened
     */
    TailingCursor openTailingCursor(String collectionName, List<LogField> fields);

    /**
     * Runs a point-in-time query over the whole collection.
     *
     * @param collectionName the collection name
     * @param fields         the fields to project
     * @param sortField      the field to sort on
     * @param descending     true to sort descending
     * @return the matching records in sort order
     */
    List<LogRecord> find(String collectionName, List<LogField> fields, LogField sortField, boolean descending);

    /**
     * Returns true if this connection has not been closed.
     */
    boolean isValid();

    /**
     * Closes this connection. Closing an already closed connection succeeds.
     */
    @Override
    void close();
}
