package com.logtail.stream;

import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.InvalidHandlerException;
import com.logtail.adapter.spi.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered set of stream handlers. Handlers are never removed.
 */
public class SubscriberRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final List<StreamDataHandler> handlers = new CopyOnWriteArrayList<>();

    /**
     * Appends a handler.
     *
     * @throws InvalidHandlerException if {@code handler} is null
     */
    public void register(StreamDataHandler handler) {
        if (handler == null) {
            throw new InvalidHandlerException("stream data handler must not be null");
        }
        handlers.add(handler);
    }

    /**
     * Delivers the same pair to every handler in registration order.
     * A handler that throws is logged and skipped.
     */
    public void publish(CursorException error, LogRecord record) {
        for (StreamDataHandler handler : handlers) {
            try {
                handler.onStreamData(error, record);
            } catch (RuntimeException e) {
                log.warn("Stream handler {} failed; continuing with remaining handlers: {}",
                        handler, e.toString(), e);
            }
        }
    }

    public int size() {
        return handlers.size();
    }
}
