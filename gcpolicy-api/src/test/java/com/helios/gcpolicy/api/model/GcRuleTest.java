/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GcRuleTest {

    private static final GcRule AGE = new GcRule.MaxAge(Duration.ofDays(7));
    private static final GcRule VERSIONS = new GcRule.MaxVersions(3);

    @Nested
    @DisplayName("Rule trees")
    class Rules {

        @Test
        @DisplayName("Single composites hold exactly one rule")
        void singleHoldsOneRule() {
            assertThat(GcRule.single(AGE)).isEqualTo(new GcRule.Composite(CompositeMode.SINGLE, List.of(AGE)));
            assertThatThrownBy(() -> new GcRule.Composite(CompositeMode.SINGLE, List.of(AGE, VERSIONS)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Union and intersection need at least two rules")
        void combinatorsNeedTwoRules() {
            assertThatThrownBy(() -> GcRule.union(AGE)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> GcRule.intersection()).isInstanceOf(IllegalArgumentException.class);
            assertThat(GcRule.union(AGE, VERSIONS, GcRule.single(AGE))).isNotNull();
        }

        @Test
        @DisplayName("Leaves reject out-of-range values")
        void leavesRejectInvalidValues() {
            assertThatThrownBy(() -> new GcRule.MaxVersions(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new GcRule.MaxAge(Duration.ofSeconds(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(new GcRule.MaxAge(Duration.ZERO).maxAge()).isZero();
        }

        @Test
        @DisplayName("Child lists are copied")
        void childListsAreCopied() {
            List<GcRule> children = new ArrayList<>(List.of(AGE, VERSIONS));
            GcRule.Composite composite = new GcRule.Composite(CompositeMode.UNION, children);
            children.clear();

            assertThat(composite.rules()).containsExactly(AGE, VERSIONS);
            assertThatThrownBy(() -> composite.rules().add(AGE)).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Composite modes")
    class Modes {

        @Test
        @DisplayName("Should resolve mode values case-insensitively")
        void shouldResolveModes() {
            assertThat(CompositeMode.fromJson("union")).contains(CompositeMode.UNION);
            assertThat(CompositeMode.fromJson("INTERSECTION")).contains(CompositeMode.INTERSECTION);
            assertThat(CompositeMode.fromJson("xor")).isEmpty();
            assertThat(CompositeMode.fromJson(null)).isEmpty();
        }

        @Test
        @DisplayName("Single mode has no textual form")
        void singleHasNoTextualForm() {
            assertThat(CompositeMode.SINGLE.jsonValue()).isNull();
            assertThat(CompositeMode.fromJson("single")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Policy trees")
    class Policies {

        @Test
        @DisplayName("Policies compare structurally and by child order")
        void structuralEquality() {
            GcPolicy first = GcPolicy.union(new GcPolicy.MaxAge(Duration.ofHours(1)), new GcPolicy.MaxVersions(2));
            GcPolicy same = GcPolicy.union(new GcPolicy.MaxAge(Duration.ofHours(1)), new GcPolicy.MaxVersions(2));
            GcPolicy reordered = GcPolicy.union(new GcPolicy.MaxVersions(2), new GcPolicy.MaxAge(Duration.ofHours(1)));

            assertThat(first).isEqualTo(same).hasSameHashCodeAs(same);
            assertThat(first).isNotEqualTo(reordered);
            assertThat(first.type()).isEqualTo(GcPolicy.Type.UNION);
        }

        @Test
        @DisplayName("A one-child combinator is a valid store policy")
        void oneChildCombinatorAllowed() {
            GcPolicy policy = GcPolicy.intersection(new GcPolicy.MaxVersions(1));
            assertThat(((GcPolicy.Intersection) policy).children()).hasSize(1);
        }

        @Test
        @DisplayName("Empty combinators and nested NoGc are rejected")
        void rejectsMeaninglessPolicies() {
            assertThatThrownBy(() -> GcPolicy.union()).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> GcPolicy.union(new GcPolicy.MaxVersions(1), GcPolicy.noGc()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("NoGc");
        }

        @Test
        @DisplayName("NoGc is a singleton")
        void noGcIsSingleton() {
            assertThat(GcPolicy.noGc()).isSameAs(GcPolicy.noGc());
            assertThat(GcPolicy.noGc().type()).isEqualTo(GcPolicy.Type.NO_GC);
        }

        @Test
        @DisplayName("Config unit defaults missing policy and mode")
        void configDefaults() {
            TableRef table = new TableRef("my-project", "my-instance", "events");
            ColumnFamilyGcConfig config = new ColumnFamilyGcConfig(table, "cf1", null, null);

            assertThat(config.policy()).isSameAs(GcPolicy.noGc());
            assertThat(config.deletionMode()).isEqualTo(DeletionMode.DEFAULT);
            assertThatThrownBy(() -> new ColumnFamilyGcConfig(table, "bad id", null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
