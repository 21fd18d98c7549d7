package com.logtail.adapter.spi;

/**
 * Exception thrown when the log collection exists but is not size-bounded.
 * A tailing cursor can only be opened on a capped collection.
 */
public class CollectionNotCappedException extends LogTailException {

    private final String collectionName;

    public CollectionNotCappedException(String collectionName) {
        super("collection '" + collectionName + "' is not capped");
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
