package com.logtail.adapter.mongodb;

import com.logtail.adapter.spi.LogField;
import com.logtail.adapter.spi.LogRecord;
import org.bson.Document;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

/**
 * Converts syslog-ng documents to {@link LogRecord}s.
 *
 * <p>syslog-ng writes most values as strings unless its template sets a type,
 * so each field accepts the shapes that show up in practice. Values that
 * cannot be interpreted are left unset.
 */
final class LogRecordMapper {

    // below this an integer timestamp is taken as epoch seconds (${UNIXTIME})
    private static final long EPOCH_SECONDS_LIMIT = 100_000_000_000L;

    private LogRecordMapper() {}

    static LogRecord toLogRecord(Document doc) {
        return LogRecord.builder()
                .program(string(doc, LogField.PROGRAM))
                .priority(string(doc, LogField.PRIORITY))
                .message(string(doc, LogField.MESSAGE))
                .timestamp(instant(doc.get(LogField.DATE.storeName())))
                .host(string(doc, LogField.HOST))
                .originHost(string(doc, LogField.HOST_FROM))
                .sourceAddress(string(doc, LogField.SOURCEIP))
                .sequenceNumber(sequence(doc.get(LogField.SEQNUM.storeName())))
                .tags(tags(doc.get(LogField.TAGS.storeName())))
                .build();
    }

    private static String string(Document doc, LogField field) {
        Object value = doc.get(field.storeName());
        return value != null ? value.toString() : null;
    }

    static Instant instant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number n) {
            long epoch = n.longValue();
            return epoch < EPOCH_SECONDS_LIMIT ? Instant.ofEpochSecond(epoch) : Instant.ofEpochMilli(epoch);
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Instant.parse(s.trim());
            } catch (DateTimeParseException e) {
                return numericInstant(s.trim());
            }
        }
        return null;
    }

    private static Instant numericInstant(String s) {
        try {
            return instant(Long.parseLong(s));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Long sequence(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static List<String> tags(Object value) {
        if (value instanceof List<?> list) {
            List<String> tags = new ArrayList<>(list.size());
            for (Object tag : list) {
                if (tag != null) {
                    tags.add(tag.toString());
                }
            }
            return tags;
        }
        if (value instanceof String s) {
            return Arrays.stream(s.split(","))
                    .map(String::trim)
                    .filter(tag -> !tag.isEmpty())
                    .toList();
        }
        return List.of();
    }
}
