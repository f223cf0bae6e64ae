/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api;

import com.helios.gcpolicy.api.exceptions.StoreException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-supplied deadline and cancellation signal for a store call.
 *
 * <h2>Usage</h2>
 * <pre>
 * CallContext context = CallContext.withTimeout(Duration.ofSeconds(30));
 * manager.apply(table, "cf1", rules, DeletionMode.DEFAULT, context);
 *
 * // from another thread
 * context.cancel();
 * </pre>
 */
public final class CallContext {

    private static final CallContext NONE = new CallContext(null, Clock.systemUTC());

    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CallContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A context without deadline that can never be cancelled.
     */
    public static CallContext none() {
        return NONE;
    }

    public static CallContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CallContext withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        return new CallContext(clock.instant().plus(timeout), clock);
    }

    public static CallContext withDeadline(Instant deadline, Clock clock) {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(clock, "clock");
        return new CallContext(deadline, clock);
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("CallContext.none() cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left before the deadline, or empty if there is none. Never negative.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Fails if the call was cancelled or its deadline has passed.
     *
     * @param operation name used in the error message
     */
    public void checkActive(String operation) throws StoreException {
        if (isCancelled()) {
            throw new StoreException(StoreException.Code.CANCELLED, operation + " was cancelled");
        }
        if (isExpired()) {
            throw new StoreException(StoreException.Code.DEADLINE_EXCEEDED,
                    operation + " exceeded its deadline " + deadline);
        }
    }
}
