/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.compiler;

import com.helios.gcpolicy.api.exceptions.PolicyDecompilationException;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads and writes {@code max_age} duration strings: a non-negative integer
 * followed by a single unit, e.g. {@code 168h}, {@code 90m}, {@code 30s}.
 */
public final class DurationFormat {

    /**
     * Accepted units, largest first. Adding a constant here extends both
     * parsing and formatting.
     */
    public enum Unit {
        HOURS("h", ChronoUnit.HOURS),
        MINUTES("m", ChronoUnit.MINUTES),
        SECONDS("s", ChronoUnit.SECONDS);

        private final String suffix;
        private final ChronoUnit chronoUnit;

        Unit(String suffix, ChronoUnit chronoUnit) {
            this.suffix = suffix;
            this.chronoUnit = chronoUnit;
        }

        public String suffix() {
            return suffix;
        }

        long seconds() {
            return chronoUnit.getDuration().getSeconds();
        }

        static Unit fromSuffix(String suffix) {
            for (Unit unit : values()) {
                if (unit.suffix.equals(suffix)) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unknown duration unit: " + suffix);
        }
    }

    private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+)("
            + Arrays.stream(Unit.values()).map(u -> Pattern.quote(u.suffix)).collect(Collectors.joining("|"))
            + ")");

    private DurationFormat() {
    }

    /**
     * Parses a duration string.
     *
     * @return the duration, or empty if the text is malformed or out of range
     */
    public static Optional<Duration> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = DURATION_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            long amount = Long.parseLong(matcher.group(1));
            Unit unit = Unit.fromSuffix(matcher.group(2));
            return Optional.of(Duration.ofSeconds(Math.multiplyExact(amount, unit.seconds())));
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * Formats a duration with the largest unit that divides it exactly.
     *
     * @throws PolicyDecompilationException if the duration is negative or not a whole number of seconds
     */
    public static String format(Duration duration) {
        if (duration.isNegative()) {
            throw new PolicyDecompilationException("max_age cannot be negative: " + duration);
        }
        if (duration.getNano() != 0) {
            throw new PolicyDecompilationException(
                    "max_age of " + duration + " is not a whole number of seconds");
        }
        long seconds = duration.getSeconds();
        if (seconds == 0) {
            return "0" + Unit.SECONDS.suffix;
        }
        for (Unit unit : Unit.values()) {
            if (seconds % unit.seconds() == 0) {
                return (seconds / unit.seconds()) + unit.suffix;
            }
        }
        // SECONDS always divides
        throw new IllegalStateException("No unit divides " + duration);
    }
}
