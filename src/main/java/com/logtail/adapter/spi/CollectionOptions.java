package com.logtail.adapter.spi;

/**
 * Collection metadata relevant to tailing.
 *
 * @param capped       true if the collection is size-bounded
 * @param sizeBytes    maximum size in bytes, 0 if unknown
 * @param maxDocuments maximum number of documents, 0 if unbounded
 */
public record CollectionOptions(boolean capped, long sizeBytes, long maxDocuments) {

    public static CollectionOptions uncapped() {
        return new CollectionOptions(false, 0L, 0L);
    }

    public static CollectionOptions capped(long sizeBytes) {
        return new CollectionOptions(true, sizeBytes, 0L);
    }
}
