/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.infra.management;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.gcpolicy.api.model.GcPolicy;

import java.util.Objects;
import java.util.Optional;

/**
 * Comparison between the configured rule of a column family and the policy
 * the store currently holds.
 *
 * @param configured the compiled configured rule
 * @param live       the policy read from the store, {@link GcPolicy#noGc()} if none
 * @param liveRules  canonical rule document of the live policy
 * @param inSync     whether both describe the same policy
 */
public record DriftReport(
        GcPolicy configured,
        GcPolicy live,
        Optional<JsonNode> liveRules,
        boolean inSync
) {
    public DriftReport {
        Objects.requireNonNull(configured, "configured");
        Objects.requireNonNull(live, "live");
        Objects.requireNonNull(liveRules, "liveRules");
    }

    public boolean hasDrifted() {
        return !inSync;
    }
}
