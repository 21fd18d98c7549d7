package com.logtail.adapter.spi;

/**
 * Exception thrown when the log collection's metadata cannot be read,
 * usually because the collection does not exist.
 */
public class CollectionNotFoundException extends LogTailException {

    private final String collectionName;

    public CollectionNotFoundException(String collectionName) {
        super("cannot get properties of collection '" + collectionName + "'; make sure it exists");
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
