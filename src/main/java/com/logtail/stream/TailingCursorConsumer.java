package com.logtail.stream;

import com.logtail.adapter.spi.CollectionNotCappedException;
import com.logtail.adapter.spi.CollectionNotFoundException;
import com.logtail.adapter.spi.CollectionOptions;
import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.LogField;
import com.logtail.adapter.spi.LogRecord;
import com.logtail.adapter.spi.LogStoreConnection;
import com.logtail.adapter.spi.TailingCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the live tailing cursor on one capped collection.
 *
 * <p>{@link #open()} validates the collection and opens the cursor on the
 * calling thread. {@link #start(Listener)} hands the cursor to a dedicated
 * daemon thread that reads it until {@link #stop()} is called or the feed
 * fails. Listener callbacks run on that thread, one record at a time, so a
 * record is fully dispatched before the next one is read.
 */
public class TailingCursorConsumer {

    private static final Logger log = LoggerFactory.getLogger(TailingCursorConsumer.class);

    /**
     * Events raised by the tail thread.
     */
    public interface Listener {

        void onData(LogRecord record);

        void onError(CursorException error);

        /**
         * The feed ended without a stop request. No further events follow.
         */
        void onClose();
    }

    private final LogStoreConnection connection;
    private final String collectionName;
    private final Duration stopTimeout;
    private final AtomicLong receivedCount = new AtomicLong();
    private final CompletableFuture<Void> finished = new CompletableFuture<>();

    private volatile boolean running;
    private volatile TailingCursor cursor;
    private Thread thread;

    public TailingCursorConsumer(LogStoreConnection connection, String collectionName, Duration stopTimeout) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName must not be null");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout must not be null");
    }

    /**
     * Checks that the collection exists and is capped, then opens the cursor.
     *
     * @throws CollectionNotFoundException  if no metadata is available
     * @throws CollectionNotCappedException if the collection is not capped
     * @throws CursorException              if the cursor cannot be opened
     * @throws IllegalStateException        if a cursor is already open
     */
    public void open() {
        if (cursor != null) {
            throw new IllegalStateException("tailing cursor already open on " + collectionName);
        }

        CollectionOptions options = connection.collectionOptions(collectionName)
                .orElseThrow(() -> new CollectionNotFoundException(collectionName));
        if (!options.capped()) {
            throw new CollectionNotCappedException(collectionName);
        }

        cursor = connection.openTailingCursor(collectionName, LogField.all());
        log.debug("Opened tailing cursor on {} (size={} bytes, max={} docs)",
                collectionName, options.sizeBytes(), options.maxDocuments());
    }

    /**
     * Starts the tail thread.
     *
     * @throws IllegalStateException if not opened or already started
     */
    public void start(Listener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        if (cursor == null) {
            throw new IllegalStateException("open() must succeed before start()");
        }
        if (thread != null) {
            throw new IllegalStateException("tail thread already started for " + collectionName);
        }

        running = true;
        thread = new Thread(() -> tail(listener), "logtail-tail-" + collectionName);
        thread.setDaemon(true);
        thread.start();
    }

    private void tail(Listener listener) {
        boolean stopRequested = false;
        try {
            while (running) {
                Optional<LogRecord> next;
                try {
                    next = cursor.tryNext();
                } catch (RuntimeException e) {
                    if (!running) {
                        log.debug("Tailing cursor on {} interrupted by stop: {}", collectionName, e.toString());
                        break;
                    }
                    listener.onError(e instanceof CursorException ce
                            ? ce
                            : new CursorException("tailing cursor on " + collectionName + " failed", e));
                    break;
                }

                if (next.isPresent() && running) {
                    receivedCount.incrementAndGet();
                    listener.onData(next.get());
                }
            }
            stopRequested = !running;
        } finally {
            try {
                closeCursor();
            } catch (RuntimeException e) {
                // stop() retries the close and reports it
                log.debug("Closing tailing cursor on {} from tail thread failed: {}", collectionName, e.toString());
            }
            finished.complete(null);
        }

        if (!stopRequested) {
            listener.onClose();
        }
    }

    /**
     * Stops the tail thread and closes the cursor. Safe to call repeatedly,
     * and before {@link #start(Listener)}. A failed close leaves the cursor in
     * place so a later call retries it.
     *
     * @throws CursorException if the cursor could not be closed, or the tail
     *                         thread did not finish within the stop timeout
     */
    public void stop() {
        running = false;

        if (thread != null) {
            awaitTailExit();
        }
        try {
            closeCursor();
        } catch (CursorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CursorException("failed to close tailing cursor on " + collectionName, e);
        }
    }

    private void awaitTailExit() {
        try {
            finished.get(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CursorException("tail thread for " + collectionName
                    + " did not stop within " + stopTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CursorException("interrupted while stopping tail thread for " + collectionName, e);
        } catch (ExecutionException e) {
            throw new CursorException("tail thread for " + collectionName + " failed", e.getCause());
        }
    }

    // the tail thread and stop() never run this concurrently: stop() waits for the thread first
    private void closeCursor() {
        TailingCursor current = cursor;
        if (current != null) {
            current.close();
            cursor = null;
        }
    }

    /**
     * Returns true while the tail thread is reading.
     */
    public boolean isRunning() {
        return thread != null && !finished.isDone();
    }

    /**
     * Returns the number of records received since open.
     */
    public long receivedCount() {
        return receivedCount.get();
    }

    void resetReceivedCount() {
        receivedCount.set(0);
    }
}
