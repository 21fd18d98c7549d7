package com.logtail.app;

import com.logtail.adapter.spi.LogRecord;
import com.logtail.adapter.spi.LogTailException;
import com.logtail.stream.LogStreamAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wires a {@link LogStreamAdapter} to a {@link RecordSink} and drives its
 * lifecycle: open once at startup, close once at shutdown.
 */
public class LogTailService {

    private static final Logger log = LoggerFactory.getLogger(LogTailService.class);

    private final LogStreamAdapter adapter;
    private final RecordSink sink;
    private final Duration timeout;

    public LogTailService(LogStreamAdapter adapter, RecordSink sink, Duration timeout) {
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");

        adapter.onStreamData((error, record) -> {
            if (error != null) {
                sink.deliverError(error);
            } else {
                sink.deliverRecord(record);
            }
        });
    }

    /**
     * Opens the adapter and hands the initial snapshot to the sink.
     *
     * @throws LogTailException if the adapter cannot be opened
     */
    public void start() {
        CompletableFuture<LogTailException> opened = new CompletableFuture<>();
        adapter.open(opened::complete);

        LogTailException openError = await(opened, "open");
        if (openError != null) {
            throw openError;
        }

        CompletableFuture<List<LogRecord>> snapshot = new CompletableFuture<>();
        adapter.getLogs((error, records) -> {
            if (error != null) {
                snapshot.completeExceptionally(error);
            } else {
                snapshot.complete(records);
            }
        });
        try {
            sink.deliverSnapshot(snapshot.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            // tailing is up; a missing snapshot is not fatal
            log.warn("Initial snapshot failed: {}", e.getCause().toString());
        } catch (TimeoutException e) {
            log.warn("Initial snapshot did not complete within {} ms", timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogTailException("interrupted while waiting for snapshot", e);
        }
    }

    /**
     * Closes the adapter and shuts down its request thread.
     *
     * @return the process exit code: 0 if closed cleanly, 1 otherwise
     */
    public int stop() {
        long uptime = adapter.getUptimeMillis();
        long received = adapter.getReceivedCount();

        CompletableFuture<LogTailException> closed = new CompletableFuture<>();
        adapter.close(closed::complete);

        LogTailException closeError;
        try {
            closeError = await(closed, "close");
        } catch (LogTailException e) {
            closeError = e;
        } finally {
            adapter.shutdown();
        }
        if (closeError != null) {
            log.error("Log stream did not close cleanly", closeError);
            return 1;
        }
        log.info("Log stream stopped after {} ms uptime, {} records received", uptime, received);
        return 0;
    }

    private LogTailException await(CompletableFuture<LogTailException> result, String operation) {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new LogTailException(operation + " did not complete within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogTailException("interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            throw new LogTailException(operation + " failed", e.getCause());
        }
    }
}
