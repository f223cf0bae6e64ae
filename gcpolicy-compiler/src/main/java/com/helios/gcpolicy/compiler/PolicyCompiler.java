/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.compiler;

import com.helios.gcpolicy.api.model.GcPolicy;
import com.helios.gcpolicy.api.model.GcRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a validated {@link GcRule} onto the store's {@link GcPolicy}.
 *
 * <p>A single-rule wrapper compiles to its child directly, so the output never
 * contains a one-child combinator. Child order is preserved.
 */
public class PolicyCompiler {

    public GcPolicy compile(GcRule rule) {
        if (rule == null) {
            return GcPolicy.noGc();
        }
        if (rule instanceof GcRule.MaxAge maxAge) {
            return new GcPolicy.MaxAge(maxAge.maxAge());
        }
        if (rule instanceof GcRule.MaxVersions maxVersions) {
            return new GcPolicy.MaxVersions(maxVersions.maxVersions());
        }
        GcRule.Composite composite = (GcRule.Composite) rule;
        return switch (composite.mode()) {
            case SINGLE -> compile(composite.rules().get(0));
            case UNION -> new GcPolicy.Union(compileAll(composite.rules()));
            case INTERSECTION -> new GcPolicy.Intersection(compileAll(composite.rules()));
        };
    }

    private List<GcPolicy> compileAll(List<GcRule> rules) {
        List<GcPolicy> policies = new ArrayList<>(rules.size());
        for (GcRule child : rules) {
            policies.add(compile(child));
        }
        return policies;
    }
}
