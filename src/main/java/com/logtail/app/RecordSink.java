package com.logtail.app;

import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Where records go once read: the delivery side of the process.
 */
public interface RecordSink {

    /**
     * Delivers the history snapshot taken at startup, newest first.
     */
    void deliverSnapshot(List<LogRecord> records);

    /**
     * Delivers one new record to every connected client.
     */
    void deliverRecord(LogRecord record);

    /**
     * Reports a feed failure to connected clients.
     */
    void deliverError(CursorException error);

    /**
     * Returns a sink that writes records to the application log.
     */
    static RecordSink logging() {
        return new LoggingRecordSink();
    }

    final class LoggingRecordSink implements RecordSink {

        private static final Logger log = LoggerFactory.getLogger("logtail.records");

        private LoggingRecordSink() {}

        @Override
        public void deliverSnapshot(List<LogRecord> records) {
            log.info("Snapshot holds {} records", records.size());
        }

        @Override
        public void deliverRecord(LogRecord record) {
            log.info("{} {} {}[{}]: {}",
                    record.timestamp(), record.host(), record.program(), record.priority(), record.message());
        }

        @Override
        public void deliverError(CursorException error) {
            log.warn("Log feed error: {}", error.getMessage());
        }
    }
}
