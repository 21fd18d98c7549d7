package com.logtail.stream;

import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.LogRecord;

/**
 * Receives records from the live tail. Exactly one of the arguments is non-null.
 */
@FunctionalInterface
public interface StreamDataHandler {

    /**
     * @param error  a feed failure, or null
     * @param record the new record, or null when {@code error} is set
     */
    void onStreamData(CursorException error, LogRecord record);
}
