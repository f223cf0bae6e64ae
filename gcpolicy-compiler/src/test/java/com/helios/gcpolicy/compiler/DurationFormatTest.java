/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.compiler;

import com.helios.gcpolicy.api.exceptions.PolicyDecompilationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationFormatTest {

    @ParameterizedTest
    @CsvSource({
            "168h, 604800",
            "90m, 5400",
            "45s, 45",
            "0s, 0",
            "0h, 0"
    })
    @DisplayName("Should parse durations in hours, minutes and seconds")
    void shouldParse(String text, long seconds) {
        assertThat(DurationFormat.parse(text)).contains(Duration.ofSeconds(seconds));
    }

    @Test
    @DisplayName("Should reject overflowing amounts")
    void shouldRejectOverflow() {
        assertThat(DurationFormat.parse("99999999999999999999s")).isEmpty();
        assertThat(DurationFormat.parse("9223372036854775807h")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "604800, 168h",
            "5400, 90m",
            "61, 61s",
            "0, 0s",
            "3600, 1h"
    })
    @DisplayName("Should format with the largest exact unit")
    void shouldFormat(long seconds, String expected) {
        assertThat(DurationFormat.format(Duration.ofSeconds(seconds))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Sub-second durations have no textual form")
    void shouldRejectSubSecond() {
        assertThatThrownBy(() -> DurationFormat.format(Duration.ofMillis(1500)))
                .isInstanceOf(PolicyDecompilationException.class)
                .hasMessageContaining("whole number of seconds");
    }

    @Test
    @DisplayName("Units are listed largest first")
    void unitsLargestFirst() {
        assertThat(DurationFormat.Unit.values())
                .extracting(DurationFormat.Unit::suffix)
                .containsExactly("h", "m", "s");
    }
}
