/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Validated GC rule tree, as authored in the {@code gc_rules} JSON.
 *
 * <p>A node is either a {@link Leaf} carrying a single threshold or a
 * {@link Composite} combining child rules. The record constructors enforce the
 * grammar invariants, so an instance of this type is always a valid rule:
 * <ul>
 *   <li>{@code max_age} is non-negative and {@code max_version} is at least 1</li>
 *   <li>a {@link CompositeMode#SINGLE} composite holds exactly one rule</li>
 *   <li>a union or intersection holds at least two rules</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * GcRule rule = GcRule.union(
 *     new GcRule.MaxAge(Duration.ofHours(168)),
 *     new GcRule.MaxVersions(10));
 * </pre>
 */
public sealed interface GcRule permits GcRule.Leaf, GcRule.Composite {

    /**
     * A single retention threshold.
     */
    sealed interface Leaf extends GcRule permits MaxAge, MaxVersions {
    }

    /**
     * Cells older than {@code maxAge} are eligible for collection.
     */
    record MaxAge(Duration maxAge) implements Leaf {
        public MaxAge {
            Objects.requireNonNull(maxAge, "maxAge");
            if (maxAge.isNegative()) {
                throw new IllegalArgumentException("max_age must not be negative: " + maxAge);
            }
        }
    }

    /**
     * Only the newest {@code maxVersions} cells are retained.
     */
    record MaxVersions(int maxVersions) implements Leaf {
        public MaxVersions {
            if (maxVersions < 1) {
                throw new IllegalArgumentException("max_version must be at least 1: " + maxVersions);
            }
        }
    }

    /**
     * A combination of child rules.
     */
    record Composite(CompositeMode mode, List<GcRule> rules) implements GcRule {
        public Composite {
            Objects.requireNonNull(mode, "mode");
            Objects.requireNonNull(rules, "rules");
            rules = List.copyOf(rules);
            if (!mode.acceptsChildCount(rules.size())) {
                throw new IllegalArgumentException(mode + " composite cannot hold " + rules.size() + " rule(s)");
            }
        }
    }

    static GcRule union(GcRule... rules) {
        return new Composite(CompositeMode.UNION, List.of(rules));
    }

    static GcRule intersection(GcRule... rules) {
        return new Composite(CompositeMode.INTERSECTION, List.of(rules));
    }

    static GcRule single(GcRule rule) {
        return new Composite(CompositeMode.SINGLE, List.of(rule));
    }
}
