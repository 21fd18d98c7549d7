package com.logtail.stream;

import com.logtail.adapter.spi.LogRecord;
import com.logtail.adapter.spi.LogTailException;

import java.util.List;

/**
 * Callback for a history snapshot.
 */
@FunctionalInterface
public interface LogsHandler {

    /**
     * @param error   the failure, or null on success
     * @param records the snapshot, newest first; null when {@code error} is set
     */
    void onLogs(LogTailException error, List<LogRecord> records);
}
