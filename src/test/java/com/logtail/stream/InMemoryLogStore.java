package com.logtail.stream;

import com.logtail.adapter.spi.CollectionOptions;
import com.logtail.adapter.spi.ConnectionException;
import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.LogField;
import com.logtail.adapter.spi.LogRecord;
import com.logtail.adapter.spi.LogStoreConnection;
import com.logtail.adapter.spi.LogStoreDriver;
import com.logtail.adapter.spi.TailingCursor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory bounded store for adapter tests, with failure injection.
 */
final class InMemoryLogStore implements LogStoreDriver {

    static final String SCHEME = "memory://";

    private static final long AWAIT_MILLIS = 20;

    private final Map<String, Collection> collections = new ConcurrentHashMap<>();

    final List<String> connectionStrings = new CopyOnWriteArrayList<>();
    final AtomicInteger openConnections = new AtomicInteger();
    final AtomicInteger openCursors = new AtomicInteger();

    final AtomicReference<RuntimeException> connectFailure = new AtomicReference<>();
    final AtomicReference<RuntimeException> metadataFailure = new AtomicReference<>();
    final AtomicReference<RuntimeException> cursorOpenFailure = new AtomicReference<>();
    final AtomicReference<RuntimeException> snapshotFailure = new AtomicReference<>();
    // close keeps failing until cleared
    final AtomicReference<RuntimeException> cursorCloseFailure = new AtomicReference<>();
    final AtomicReference<RuntimeException> connectionCloseFailure = new AtomicReference<>();

    volatile CountDownLatch connectGate;

    void createCapped(String name) {
        collections.put(name, new Collection(new CollectionOptions(true, 1_048_576L, 0L)));
    }

    void createUncapped(String name) {
        collections.put(name, new Collection(CollectionOptions.uncapped()));
    }

    void append(String name, LogRecord record) {
        Collection coll = collections.get(name);
        synchronized (coll) {
            coll.records.add(record);
            coll.notifyAll();
        }
    }

    /**
     * Makes every open cursor on the collection fail with {@code error}.
     */
    void breakFeed(String name, CursorException error) {
        Collection coll = collections.get(name);
        synchronized (coll) {
            coll.failure = error;
            coll.notifyAll();
        }
    }

    static LogRecord record(long seq, Instant timestamp) {
        return LogRecord.builder()
                .program("sshd")
                .priority("info")
                .message("message " + seq)
                .host("web-1")
                .timestamp(timestamp)
                .sequenceNumber(seq)
                .build();
    }

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public LogStoreConnection connect(String connectionString) {
        connectionStrings.add(connectionString);
        CountDownLatch gate = connectGate;
        if (gate != null) {
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    throw new ConnectionException("memory", "connect gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("memory", "interrupted", e);
            }
        }
        RuntimeException failure = connectFailure.get();
        if (failure != null) {
            throw failure;
        }
        openConnections.incrementAndGet();
        return new Connection();
    }

    private static final class Collection {
        final CollectionOptions options;
        final List<LogRecord> records = new ArrayList<>();
        CursorException failure;

        Collection(CollectionOptions options) {
            this.options = options;
        }
    }

    private final class Connection implements LogStoreConnection {

        private boolean closed;

        @Override
        public Optional<CollectionOptions> collectionOptions(String collectionName) {
            RuntimeException failure = metadataFailure.get();
            if (failure != null) {
                throw failure;
            }
            Collection coll = collections.get(collectionName);
            return coll != null ? Optional.of(coll.options) : Optional.empty();
        }

        @Override
        public TailingCursor openTailingCursor(String collectionName, List<LogField> fields) {
            RuntimeException failure = cursorOpenFailure.get();
            if (failure != null) {
                throw failure;
            }
            Collection coll = collections.get(collectionName);
            int start;
            synchronized (coll) {
                start = coll.records.size();
            }
            openCursors.incrementAndGet();
            return new Cursor(coll, start);
        }

        @Override
        public List<LogRecord> find(String collectionName, List<LogField> fields, LogField sortField, boolean descending) {
            RuntimeException failure = snapshotFailure.get();
            if (failure != null) {
                throw failure;
            }
            Collection coll = collections.get(collectionName);
            List<LogRecord> copy;
            synchronized (coll) {
                copy = new ArrayList<>(coll.records);
            }
            Comparator<LogRecord> byTimestamp = Comparator.comparing(LogRecord::timestamp,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
            copy.sort(descending ? byTimestamp.reversed() : byTimestamp);
            return copy;
        }

        @Override
        public boolean isValid() {
            return !closed;
        }

        @Override
        public void close() {
            RuntimeException failure = connectionCloseFailure.get();
            if (failure != null) {
                throw failure;
            }
            if (!closed) {
                closed = true;
                openConnections.decrementAndGet();
            }
        }
    }

    private final class Cursor implements TailingCursor {

        private final Collection coll;
        private int position;
        private boolean closed;

        Cursor(Collection coll, int position) {
            this.coll = coll;
            this.position = position;
        }

        @Override
        public Optional<LogRecord> tryNext() {
            synchronized (coll) {
                if (closed) {
                    throw new CursorException("cursor closed");
                }
                if (position >= coll.records.size() && coll.failure == null) {
                    try {
                        coll.wait(AWAIT_MILLIS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CursorException("interrupted", e);
                    }
                }
                if (coll.failure != null) {
                    throw coll.failure;
                }
                if (position < coll.records.size()) {
                    return Optional.of(coll.records.get(position++));
                }
                return Optional.empty();
            }
        }

        @Override
        public void close() {
            RuntimeException failure = cursorCloseFailure.get();
            if (failure != null) {
                throw failure;
            }
            if (!closed) {
                closed = true;
                openCursors.decrementAndGet();
            }
        }
    }
}
