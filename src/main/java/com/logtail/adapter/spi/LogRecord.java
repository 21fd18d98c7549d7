package com.logtail.adapter.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One syslog message read from the log store.
 * Every field may be absent; an absent field is {@code null} (or an empty
 * tag list) and is never an error.
 */
public record LogRecord(
        String program,
        String priority,
        String message,
        Instant timestamp,
        String host,
        String originHost,
        String sourceAddress,
        Long sequenceNumber,
        List<String> tags
) {

    public LogRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Instant> timestampIfPresent() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<Long> sequenceNumberIfPresent() {
        return Optional.ofNullable(sequenceNumber);
    }

    public static final class Builder {
        private String program;
        private String priority;
        private String message;
        private Instant timestamp;
        private String host;
        private String originHost;
        private String sourceAddress;
        private Long sequenceNumber;
        private List<String> tags;

        private Builder() {}

        public Builder program(String program) {
            this.program = program;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder originHost(String originHost) {
            this.originHost = originHost;
            return this;
        }

        public Builder sourceAddress(String sourceAddress) {
            this.sourceAddress = sourceAddress;
            return this;
        }

        public Builder sequenceNumber(Long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public LogRecord build() {
            return new LogRecord(program, priority, message, timestamp, host,
                    originHost, sourceAddress, sequenceNumber, tags);
        }
    }
}
