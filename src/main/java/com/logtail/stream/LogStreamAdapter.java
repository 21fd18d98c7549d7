package com.logtail.stream;

import com.logtail.adapter.spi.AlreadyOpenException;
import com.logtail.adapter.spi.CloseException;
import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.InvalidHandlerException;
import com.logtail.adapter.spi.LogField;
import com.logtail.adapter.spi.LogRecord;
import com.logtail.adapter.spi.LogStoreConfig;
import com.logtail.adapter.spi.LogStoreConnection;
import com.logtail.adapter.spi.LogStoreDriver;
import com.logtail.adapter.spi.LogTailException;
import com.logtail.adapter.spi.NotOpenException;
import com.logtail.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tails a capped log collection and fans new records out to registered handlers.
 *
 * <p>Lifecycle: {@code CLOSED -> CONNECTING -> OPEN -> CLOSING -> CLOSED}.
 * {@link #open}, {@link #close} and {@link #getLogs} are queued on a single
 * request thread per instance and run in call order; their callbacks run on
 * that thread. Records are delivered on the tail thread, in append order,
 * each one to every handler before the next is read. {@link #shutdown()}
 * releases the request thread once the adapter is no longer needed.
 *
 * <pre>{@code
 * LogStreamAdapter adapter = new LogStreamAdapter(config, new MongoLogStoreDriver(config));
 * adapter.onStreamData((err, record) -> sink.accept(record));
 * adapter.open(err -> { if (err != null) fail(err); });
 * }</pre>
 */
public class LogStreamAdapter {

    private static final Logger log = LoggerFactory.getLogger(LogStreamAdapter.class);
    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();

    private final LogStoreConfig config;
    private final LogStoreDriver driver;
    private final TimeSource timeSource;
    private final SubscriberRegistry subscribers = new SubscriberRegistry();
    private final ExecutorService requests;
    private final String requestThreadName;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CLOSED);

    // written on the request thread only
    private LogStoreConnection connection;
    private String collectionName;
    private volatile TailingCursorConsumer consumer;

    private volatile boolean accepting;
    private volatile long openedAtNanos;

    public LogStreamAdapter(LogStoreConfig config, LogStoreDriver driver) {
        this(config, driver, TimeSource.system());
    }

    public LogStreamAdapter(LogStoreConfig config, LogStoreDriver driver, TimeSource timeSource) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");

        this.requestThreadName = "logtail-requests-" + INSTANCE_COUNTER.incrementAndGet();
        this.requests = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, requestThreadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Connects to the store and starts tailing.
     *
     * <p>Reports {@link AlreadyOpenException} at once if the adapter is not
     * {@code CLOSED}. Any other failure leaves the adapter {@code CLOSED} with
     * nothing held open.
     *
     * @param callback receives null on success, or the failure
     * @return this adapter
     * @throws InvalidHandlerException if {@code callback} is null
     */
    public LogStreamAdapter open(CompletionHandler callback) {
        requireHandler(callback, "open");

        if (!state.compareAndSet(ConnectionState.CLOSED, ConnectionState.CONNECTING)) {
            ConnectionState current = state.get();
            log.debug("Rejecting open of {} in state {}", config.collection(), current);
            complete("open", callback, new AlreadyOpenException(current.name()));
            return this;
        }

        if (!submit(() -> doOpen(callback))) {
            state.set(ConnectionState.CLOSED);
            complete("open", callback, shutDownFailure());
        }
        return this;
    }

    private void doOpen(CompletionHandler callback) {
        TimeSource.TimingContext timing = timeSource.startTiming();
        String connectionString = ConnectionStringBuilder.build(driver.scheme(), config);
        LogStoreConnection conn = null;
        TailingCursorConsumer tail = null;

        log.info("Opening log stream on {} collection {}", config.describeTarget(), config.collection());
        try {
            conn = driver.connect(connectionString);
            tail = new TailingCursorConsumer(conn, config.collection(),
                    Duration.ofMillis(config.stopTimeoutMillis()));
            tail.open();
        } catch (RuntimeException e) {
            LogTailException failure = e instanceof LogTailException lte
                    ? lte
                    : new LogTailException("failed to open log stream on " + config.describeTarget(), e);
            releaseAfterFailedOpen(tail, conn, failure);
            state.set(ConnectionState.CLOSED);
            log.warn("Failed to open log stream on {} collection {}: {}",
                    config.describeTarget(), config.collection(), failure.getMessage());
            complete("open", callback, failure);
            return;
        }

        connection = conn;
        consumer = tail;
        collectionName = config.collection();
        openedAtNanos = timeSource.nanoTime();
        accepting = true;
        state.set(ConnectionState.OPEN);

        tail.start(new StreamEvents());
        log.info("Log stream open on {} collection {} in {} ms",
                config.describeTarget(), collectionName, timing.stop().toMillis());
        complete("open", callback, null);
    }

    private void releaseAfterFailedOpen(TailingCursorConsumer tail, LogStoreConnection conn, LogTailException failure) {
        if (tail != null) {
            try {
                tail.stop();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        if (conn != null) {
            try {
                conn.close();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }

    /**
     * Stops tailing and releases the cursor and the store connection.
     *
     * <p>Always safe to call; from {@code CLOSED} it succeeds with no side
     * effects. Queued behind an in-flight {@link #open}. Every release step
     * is attempted; if any fails the callback receives a {@link CloseException}
     * and the adapter stays {@code CLOSING}, holding only what was not released,
     * so a later close retries.
     *
     * @param callback receives null on success, or the failure
     * @return this adapter
     * @throws InvalidHandlerException if {@code callback} is null
     */
    public LogStreamAdapter close(CompletionHandler callback) {
        requireHandler(callback, "close");
        if (!submit(() -> doClose(callback))) {
            complete("close", callback, shutDownFailure());
        }
        return this;
    }

    private void doClose(CompletionHandler callback) {
        if (state.get() == ConnectionState.CLOSED) {
            complete("close", callback, null);
            return;
        }

        state.set(ConnectionState.CLOSING);
        accepting = false;
        collectionName = null;

        List<RuntimeException> failures = new ArrayList<>();
        TailingCursorConsumer tail = consumer;
        if (tail != null) {
            try {
                tail.stop();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (connection != null) {
            try {
                connection.close();
                connection = null;
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }

        if (!failures.isEmpty()) {
            CloseException failure = new CloseException(
                    "failed to release log stream on " + config.describeTarget(), failures.get(0));
            failures.stream().skip(1).forEach(failure::addSuppressed);
            log.warn("Log stream on {} not fully closed: {}", config.describeTarget(), failure.getCause().toString());
            complete("close", callback, failure);
            return;
        }

        long received = tail != null ? tail.receivedCount() : 0;
        if (tail != null) {
            tail.resetReceivedCount();
        }
        consumer = null;
        openedAtNanos = 0L;
        state.set(ConnectionState.CLOSED);
        log.info("Log stream on {} closed after {} records", config.describeTarget(), received);
        complete("close", callback, null);
    }

    /**
     * Registers a fan-out handler. Allowed in any state; handlers registered
     * before {@link #open} receive every record once tailing starts.
     *
     * @return this adapter
     * @throws InvalidHandlerException if {@code handler} is null
     */
    public LogStreamAdapter onStreamData(StreamDataHandler handler) {
        subscribers.register(handler);
        return this;
    }

    /**
     * Queries the whole collection, newest {@code DATE} first.
     * Reports {@link NotOpenException} unless the adapter is open.
     *
     * @return this adapter
     * @throws InvalidHandlerException if {@code callback} is null
     */
    public LogStreamAdapter getLogs(LogsHandler callback) {
        requireHandler(callback, "getLogs");
        if (!submit(() -> doGetLogs(callback))) {
            deliverLogs(callback, shutDownFailure(), null);
        }
        return this;
    }

    private void doGetLogs(LogsHandler callback) {
        if (collectionName == null) {
            deliverLogs(callback, new NotOpenException("collection not set; call open() first"), null);
            return;
        }

        List<LogRecord> records;
        try {
            records = connection.find(collectionName, LogField.all(), LogField.DATE, true);
        } catch (LogTailException e) {
            deliverLogs(callback, e, null);
            return;
        } catch (RuntimeException e) {
            deliverLogs(callback, new LogTailException("snapshot query on " + collectionName + " failed", e), null);
            return;
        }
        log.debug("Snapshot of {} returned {} records", collectionName, records.size());
        deliverLogs(callback, null, records);
    }

    /**
     * Returns milliseconds since the adapter entered {@code OPEN}, or -1 if it is not open.
     */
    public long getUptimeMillis() {
        if (state.get() != ConnectionState.OPEN) {
            return -1L;
        }
        return TimeUnit.NANOSECONDS.toMillis(timeSource.nanoTime() - openedAtNanos);
    }

    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Returns the number of records received in the current open session.
     */
    public long getReceivedCount() {
        TailingCursorConsumer tail = consumer;
        return tail != null ? tail.receivedCount() : 0L;
    }

    /**
     * Stops the request thread after every queued request has run. Call once
     * the final {@link #close} has completed; later requests are reported to
     * their callbacks as failures. Waits at most the connect plus stop timeout
     * before interrupting the thread.
     */
    public void shutdown() {
        requests.shutdown();
        try {
            long waitMillis = (long) config.connectTimeoutMillis() + config.stopTimeoutMillis();
            if (!requests.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Request thread {} still busy after {} ms; interrupting", requestThreadName, waitMillis);
                requests.shutdownNow();
            }
        } catch (InterruptedException e) {
            requests.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (state.get() != ConnectionState.CLOSED) {
            log.warn("Log stream on {} shut down in state {}; store resources may still be held",
                    config.describeTarget(), state.get());
        }
    }

    String requestThreadName() {
        return requestThreadName;
    }

    private boolean submit(Runnable request) {
        try {
            requests.execute(() -> {
                try {
                    request.run();
                } catch (RuntimeException e) {
                    log.error("Unexpected failure in log stream request", e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private LogTailException shutDownFailure() {
        return new LogTailException("log stream adapter for " + config.describeTarget() + " has been shut down");
    }

    private static void requireHandler(Object handler, String operation) {
        if (handler == null) {
            throw new InvalidHandlerException("no callback defined for " + operation);
        }
    }

    private static void complete(String operation, CompletionHandler callback, LogTailException error) {
        try {
            callback.onComplete(error);
        } catch (RuntimeException e) {
            log.error("{} callback threw", operation, e);
        }
    }

    private static void deliverLogs(LogsHandler callback, LogTailException error, List<LogRecord> records) {
        try {
            callback.onLogs(error, records);
        } catch (RuntimeException e) {
            log.error("getLogs callback threw", e);
        }
    }

    private final class StreamEvents implements TailingCursorConsumer.Listener {

        @Override
        public void onData(LogRecord record) {
            if (accepting) {
                subscribers.publish(null, record);
            }
        }

        @Override
        public void onError(CursorException error) {
            if (!accepting) {
                return;
            }
            log.warn("Tailing cursor on {} failed: {}", config.collection(), error.getMessage());
            subscribers.publish(error, null);
        }

        @Override
        public void onClose() {
            if (accepting) {
                log.warn("Tailing cursor on {} ended; no new records until the stream is reopened",
                        config.collection());
            }
        }
    }
}
