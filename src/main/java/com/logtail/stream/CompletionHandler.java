package com.logtail.stream;

import com.logtail.adapter.spi.LogTailException;

/**
 * Callback for {@code open} and {@code close}.
 */
@FunctionalInterface
public interface CompletionHandler {

    /**
     * @param error the failure, or null on success
     */
    void onComplete(LogTailException error);
}
