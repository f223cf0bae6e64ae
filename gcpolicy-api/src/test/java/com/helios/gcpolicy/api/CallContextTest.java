/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api;

import com.helios.gcpolicy.api.exceptions.StoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallContextTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    @DisplayName("Should compute the remaining time from the clock")
    void shouldComputeRemaining() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CallContext context = CallContext.withTimeout(Duration.ofSeconds(30), clock);

        assertThat(context.deadline()).contains(NOW.plusSeconds(30));
        assertThat(context.remaining()).contains(Duration.ofSeconds(30));
        assertThat(context.isExpired()).isFalse();
    }

    @Test
    @DisplayName("Should fail with DEADLINE_EXCEEDED once the deadline has passed")
    void shouldFailAfterDeadline() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CallContext context = CallContext.withDeadline(NOW.minusSeconds(1), clock);

        assertThat(context.isExpired()).isTrue();
        assertThat(context.remaining()).contains(Duration.ZERO);
        assertThatThrownBy(() -> context.checkActive("SetGCPolicy"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("SetGCPolicy exceeded its deadline")
                .satisfies(e -> assertThat(((StoreException) e).code())
                        .isEqualTo(StoreException.Code.DEADLINE_EXCEEDED));
    }

    @Test
    @DisplayName("Should fail with CANCELLED after cancel")
    void shouldFailAfterCancel() {
        CallContext context = CallContext.withTimeout(Duration.ofMinutes(1));
        context.cancel();

        assertThat(context.isCancelled()).isTrue();
        assertThatThrownBy(() -> context.checkActive("GetGCPolicy"))
                .isInstanceOf(StoreException.class)
                .satisfies(e -> assertThat(((StoreException) e).code()).isEqualTo(StoreException.Code.CANCELLED));
    }

    @Test
    @DisplayName("The shared no-deadline context is always active")
    void noneIsAlwaysActive() {
        CallContext none = CallContext.none();

        assertThat(none.deadline()).isEmpty();
        assertThat(none.remaining()).isEmpty();
        assertThatCode(() -> none.checkActive("ListGCPolicies")).doesNotThrowAnyException();
        assertThatThrownBy(none::cancel).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject non-positive timeouts")
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(() -> CallContext.withTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Context is attached to store failures without losing the code")
    void storeFailureContext() {
        StoreException failure = new StoreException(StoreException.Code.PERMISSION_DENIED, "denied");
        StoreException wrapped = failure.withContext("projects/p/instances/i/tables/t", "cf1");

        assertThat(wrapped.code()).isEqualTo(StoreException.Code.PERMISSION_DENIED);
        assertThat(wrapped).hasMessage("Table (projects/p/instances/i/tables/t), column family (cf1): denied")
                .hasCause(failure);
        assertThat(wrapped.isNotFound()).isFalse();
    }
}
