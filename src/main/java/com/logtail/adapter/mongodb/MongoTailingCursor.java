package com.logtail.adapter.mongodb;

import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.LogRecord;
import com.logtail.adapter.spi.TailingCursor;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCursor;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link TailingCursor} over a {@code TailableAwait} MongoDB cursor.
 *
 * <p>The server gives up on a tailable cursor when the collection has no
 * document to hold a position on. That is an empty read, not a failure: the
 * cursor waits one await interval and reissues the query after the last
 * {@code _id} it has seen, for as long as it stays open.
 */
class MongoTailingCursor implements TailingCursor {

    private static final Logger log = LoggerFactory.getLogger(MongoTailingCursor.class);

    private final Function<Object, MongoCursor<Document>> opener;
    private final String collectionName;
    private final long retryPauseMillis;

    private MongoCursor<Document> cursor;
    private Object lastId;
    private volatile boolean closed;

    /**
     * @param opener           opens a tailing cursor after the given {@code _id} (null for all)
     * @param collectionName   the collection, for messages
     * @param startAfterId     the newest {@code _id} at open time, or null if the collection is empty
     * @param retryPauseMillis pause before reissuing a query the server dropped
     */
    MongoTailingCursor(Function<Object, MongoCursor<Document>> opener, String collectionName,
                       Object startAfterId, long retryPauseMillis) {
        this.opener = Objects.requireNonNull(opener, "opener must not be null");
        this.collectionName = collectionName;
        this.lastId = startAfterId;
        this.retryPauseMillis = retryPauseMillis;
        this.cursor = open();
    }

    /**
     * Each call is at most one getMore; an empty result means the await
     * interval passed without new data.
     */
    @Override
    public Optional<LogRecord> tryNext() {
        if (closed) {
            throw new CursorException("tailing cursor on " + collectionName + " is closed");
        }
        if (cursor == null) {
            cursor = open();
        }

        Document next;
        try {
            next = cursor.tryNext();
        } catch (MongoException | IllegalStateException e) {
            throw new CursorException("tailing cursor on " + collectionName + " failed: " + e.getMessage(), e);
        }
        if (next != null) {
            lastId = next.get("_id");
            return Optional.of(LogRecordMapper.toLogRecord(next));
        }

        if (cursor.getServerCursor() == null) {
            log.debug("Tailing cursor on {} dropped by server; retrying after {} ms", collectionName, retryPauseMillis);
            releaseQuietly();
            pause();
        }
        return Optional.empty();
    }

    private MongoCursor<Document> open() {
        try {
            return opener.apply(lastId);
        } catch (MongoException e) {
            throw new CursorException("cannot open tailing cursor on " + collectionName + ": " + e.getMessage(), e);
        }
    }

    private void releaseQuietly() {
        MongoCursor<Document> dead = cursor;
        cursor = null;
        try {
            dead.close();
        } catch (MongoException e) {
            log.debug("Ignoring failure closing dead cursor on {}: {}", collectionName, e.toString());
        }
    }

    private void pause() {
        try {
            Thread.sleep(retryPauseMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CursorException("interrupted while waiting for data on " + collectionName, e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (cursor != null) {
            try {
                cursor.close();
            } catch (MongoException e) {
                throw new CursorException("failed to close tailing cursor on " + collectionName, e);
            }
            cursor = null;
        }
        closed = true;
    }
}
