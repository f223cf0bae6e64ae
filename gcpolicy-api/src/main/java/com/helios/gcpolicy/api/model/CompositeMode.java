/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Combinator of a composite GC rule.
 */
public enum CompositeMode {
    /**
     * Garbage-collect a cell when ANY child rule matches (OR).
     */
    UNION("union", 2),

    /**
     * Garbage-collect a cell only when ALL child rules match (AND).
     */
    INTERSECTION("intersection", 2),

    /**
     * No {@code mode} key: a wrapper around exactly one rule.
     */
    SINGLE(null, 1);

    private final String jsonValue;
    private final int minChildren;

    CompositeMode(String jsonValue, int minChildren) {
        this.jsonValue = jsonValue;
        this.minChildren = minChildren;
    }

    /**
     * Value of the {@code mode} key, or {@code null} for {@link #SINGLE}.
     */
    public String jsonValue() {
        return jsonValue;
    }

    public int minChildren() {
        return minChildren;
    }

    public boolean acceptsChildCount(int count) {
        return this == SINGLE ? count == 1 : count >= minChildren;
    }

    /**
     * Resolves a {@code mode} value case-insensitively. {@link #SINGLE} is never
     * returned because it has no textual form.
     */
    public static Optional<CompositeMode> fromJson(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CompositeMode mode : values()) {
            if (mode.jsonValue != null && mode.jsonValue.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
