package com.logtail.adapter.mongodb;

import com.logtail.util.TimeSource;
import com.mongodb.event.CommandFailedEvent;
import com.mongodb.event.CommandListener;
import com.mongodb.event.CommandStartedEvent;
import com.mongodb.event.CommandSucceededEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MongoDB CommandListener that counts driver commands and logs their outcome.
 *
 * <p>Failed commands are logged at WARN; completed ones at DEBUG with the
 * client round trip, which for tailing {@code getMore}s includes the await interval.
 */
public class CommandMonitor implements CommandListener {

    private static final Logger log = LoggerFactory.getLogger(CommandMonitor.class);

    private final TimeSource timeSource;

    // Track pending commands by request ID
    private final Map<Integer, CommandTiming> pendingCommands;

    private final AtomicLong completedCommands;
    private final AtomicLong failedCommands;

    public CommandMonitor(TimeSource timeSource) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.pendingCommands = new ConcurrentHashMap<>();
        this.completedCommands = new AtomicLong(0);
        this.failedCommands = new AtomicLong(0);
    }

    @Override
    public void commandStarted(CommandStartedEvent event) {
        pendingCommands.put(event.getRequestId(),
                new CommandTiming(event.getCommandName(), timeSource.nanoTime()));
    }

    @Override
    public void commandSucceeded(CommandSucceededEvent event) {
        CommandTiming timing = pendingCommands.remove(event.getRequestId());
        completedCommands.incrementAndGet();

        if (timing != null && log.isDebugEnabled()) {
            log.debug("{} completed: round trip {} ms, server {} ms",
                    timing.commandName(),
                    TimeUnit.NANOSECONDS.toMillis(timeSource.nanoTime() - timing.startNanos()),
                    event.getElapsedTime(TimeUnit.MILLISECONDS));
        }
    }

    @Override
    public void commandFailed(CommandFailedEvent event) {
        pendingCommands.remove(event.getRequestId());
        failedCommands.incrementAndGet();

        log.warn("{} failed on {} after {} ms: {}",
                event.getCommandName(),
                event.getDatabaseName(),
                event.getElapsedTime(TimeUnit.MILLISECONDS),
                event.getThrowable() != null ? event.getThrowable().toString() : "unknown error");
    }

    public long getCompletedCommandCount() {
        return completedCommands.get();
    }

    public long getFailedCommandCount() {
        return failedCommands.get();
    }

    /**
     * Returns the number of commands started but not yet completed or failed.
     */
    public int getPendingCommandCount() {
        return pendingCommands.size();
    }

    private record CommandTiming(String commandName, long startNanos) {
    }
}
