/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * GC policy tree in the shape consumed by the column-family store.
 *
 * <p>Unlike {@link GcRule}, a policy read back from the store is not bound by
 * the rule grammar: the store may normalize a combinator down to a single
 * child. Empty combinators and a nested {@link NoGc} have no meaning to the
 * store and are rejected.
 *
 * <p>Equality is structural and order-sensitive.
 */
public sealed interface GcPolicy
        permits GcPolicy.MaxAge, GcPolicy.MaxVersions, GcPolicy.Union, GcPolicy.Intersection, GcPolicy.NoGc {

    enum Type {
        MAX_AGE,
        MAX_VERSIONS,
        UNION,
        INTERSECTION,
        NO_GC
    }

    Type type();

    record MaxAge(Duration maxAge) implements GcPolicy {
        public MaxAge {
            Objects.requireNonNull(maxAge, "maxAge");
            if (maxAge.isNegative()) {
                throw new IllegalArgumentException("maxAge must not be negative: " + maxAge);
            }
        }

        @Override
        public Type type() {
            return Type.MAX_AGE;
        }
    }

    record MaxVersions(int maxVersions) implements GcPolicy {
        public MaxVersions {
            if (maxVersions < 1) {
                throw new IllegalArgumentException("maxVersions must be at least 1: " + maxVersions);
            }
        }

        @Override
        public Type type() {
            return Type.MAX_VERSIONS;
        }
    }

    record Union(List<GcPolicy> children) implements GcPolicy {
        public Union {
            children = checkChildren(children, "union");
        }

        @Override
        public Type type() {
            return Type.UNION;
        }
    }

    record Intersection(List<GcPolicy> children) implements GcPolicy {
        public Intersection {
            children = checkChildren(children, "intersection");
        }

        @Override
        public Type type() {
            return Type.INTERSECTION;
        }
    }

    /**
     * Absence of any rule. Only valid at the root of a policy tree.
     */
    final class NoGc implements GcPolicy {
        static final NoGc INSTANCE = new NoGc();

        private NoGc() {
        }

        @Override
        public Type type() {
            return Type.NO_GC;
        }

        @Override
        public String toString() {
            return "NoGc";
        }
    }

    static GcPolicy noGc() {
        return NoGc.INSTANCE;
    }

    static GcPolicy union(GcPolicy... children) {
        return new Union(List.of(children));
    }

    static GcPolicy intersection(GcPolicy... children) {
        return new Intersection(List.of(children));
    }

    private static List<GcPolicy> checkChildren(List<GcPolicy> children, String kind) {
        Objects.requireNonNull(children, "children");
        List<GcPolicy> copy = List.copyOf(children);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException(kind + " policy needs at least one child");
        }
        for (GcPolicy child : copy) {
            if (child.type() == Type.NO_GC) {
                throw new IllegalArgumentException(kind + " policy cannot contain NoGc");
            }
        }
        return copy;
    }
}
