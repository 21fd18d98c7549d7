package com.logtail.stream;

import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.InvalidHandlerException;
import com.logtail.adapter.spi.LogRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SubscriberRegistry")
class SubscriberRegistryTest {

    private SubscriberRegistry registry;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        registry = new SubscriberRegistry();
        calls = new ArrayList<>();
    }

    @Test
    @DisplayName("should reject a null handler")
    void register_null_shouldThrow() {
        assertThatThrownBy(() -> registry.register(null))
                .isInstanceOf(InvalidHandlerException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("should deliver to handlers in registration order")
    void publish_shouldFollowRegistrationOrder() {
        registry.register((err, rec) -> calls.add("first"));
        registry.register((err, rec) -> calls.add("second"));
        registry.register((err, rec) -> calls.add("third"));

        registry.publish(null, InMemoryLogStore.record(1, Instant.now()));

        assertThat(calls).containsExactly("first", "second", "third");
    }

    @Test
    @DisplayName("should pass the same pair to every handler")
    void publish_shouldPassIdenticalArguments() {
        List<Object[]> seen = new ArrayList<>();
        registry.register((err, rec) -> seen.add(new Object[]{err, rec}));
        registry.register((err, rec) -> seen.add(new Object[]{err, rec}));
        CursorException error = new CursorException("feed down");

        registry.publish(error, null);

        assertThat(seen).hasSize(2);
        assertThat(seen).allSatisfy(pair -> {
            assertThat(pair[0]).isSameAs(error);
            assertThat(pair[1]).isNull();
        });
    }

    @Test
    @DisplayName("should keep delivering after a handler throws")
    void publish_withFailingHandler_shouldContinue() {
        registry.register((err, rec) -> calls.add("before"));
        registry.register((err, rec) -> {
            throw new IllegalStateException("client gone");
        });
        registry.register((err, rec) -> calls.add("after"));

        LogRecord record = InMemoryLogStore.record(7, Instant.now());

        assertThatNoException().isThrownBy(() -> registry.publish(null, record));
        assertThat(calls).containsExactly("before", "after");
    }

    @Test
    @DisplayName("should do nothing without handlers")
    void publish_withoutHandlers_shouldBeNoOp() {
        assertThatNoException().isThrownBy(() -> registry.publish(null, InMemoryLogStore.record(1, null)));
    }
}
