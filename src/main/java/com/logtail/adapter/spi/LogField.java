package com.logtail.adapter.spi;

import java.util.List;

/**
 * Fields of a syslog-ng log message that the adapter reads from the store.
 * Queries project onto exactly these fields.
 */
public enum LogField {
    PROGRAM("PROGRAM"),
    PRIORITY("PRIORITY"),
    MESSAGE("MESSAGE"),
    DATE("DATE"),
    HOST("HOST"),
    HOST_FROM("HOST_FROM"),
    SOURCEIP("SOURCEIP"),
    SEQNUM("SEQNUM"),
    TAGS("TAGS");

    private static final List<LogField> ALL = List.of(values());

    private final String storeName;

    LogField(String storeName) {
        this.storeName = storeName;
    }

    /**
     * Returns the field name as written by syslog-ng's MongoDB destination.
     */
    public String storeName() {
        return storeName;
    }

    /**
     * Returns every recognized field, in declaration order.
     */
    public static List<LogField> all() {
        return ALL;
    }

    /**
     * Returns the store names of the given fields.
     */
    public static List<String> storeNames(List<LogField> fields) {
        return fields.stream().map(LogField::storeName).toList();
    }
}
