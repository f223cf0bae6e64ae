/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

import java.util.Locale;

/**
 * What releasing a managed GC policy does to the store.
 */
public enum DeletionMode {
    /**
     * Reset the column family to no GC policy.
     */
    DEFAULT,

    /**
     * Stop managing the policy and leave the live policy untouched. Replicated
     * instances do not allow a GC policy to be removed.
     */
    ABANDON;

    /**
     * Parses the {@code deletion_policy} configuration value. A missing or blank
     * value means {@link #DEFAULT}.
     *
     * @throws IllegalArgumentException for any value other than {@code DEFAULT} or {@code ABANDON}
     */
    public static DeletionMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (DeletionMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
                "Unsupported deletion policy: " + value + ". Possible values are: DEFAULT, ABANDON");
    }
}
