/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.infra.config;

import com.helios.gcpolicy.api.model.DeletionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GcPolicyConfigTest {

    @Test
    @DisplayName("Should use defaults without overrides")
    void shouldUseDefaults() {
        GcPolicyConfig config = GcPolicyConfig.defaults();

        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.wrapTopLevelLeaf()).isFalse();
        assertThat(config.defaultDeletionMode()).isEqualTo(DeletionMode.DEFAULT);
    }

    @Test
    @DisplayName("Should apply overrides from the environment")
    void shouldApplyOverrides() {
        GcPolicyConfig config = GcPolicyConfig.builder(Map.of(
                "GC_POLICY_DEFAULT_TIMEOUT_SECONDS", "5",
                "GC_POLICY_WRAP_TOP_LEVEL_LEAF", "TRUE",
                "GC_POLICY_DEFAULT_DELETION_MODE", "abandon")).build();

        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.wrapTopLevelLeaf()).isTrue();
        assertThat(config.defaultDeletionMode()).isEqualTo(DeletionMode.ABANDON);
    }

    @Test
    @DisplayName("Should ignore invalid overrides")
    void shouldIgnoreInvalidOverrides() {
        GcPolicyConfig config = GcPolicyConfig.builder(Map.of(
                "GC_POLICY_DEFAULT_TIMEOUT_SECONDS", "-1",
                "GC_POLICY_WRAP_TOP_LEVEL_LEAF", "yes",
                "GC_POLICY_DEFAULT_DELETION_MODE", "delete")).build();

        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.wrapTopLevelLeaf()).isFalse();
        assertThat(config.defaultDeletionMode()).isEqualTo(DeletionMode.DEFAULT);
    }

    @Test
    @DisplayName("Builder values win over the environment")
    void builderWins() {
        GcPolicyConfig config = GcPolicyConfig.builder(Map.of("GC_POLICY_DEFAULT_TIMEOUT_SECONDS", "5"))
                .defaultTimeout(Duration.ofSeconds(90))
                .build();

        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(() -> GcPolicyConfig.builder(Map.of()).defaultTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("defaultTimeout");
    }

    @Test
    @DisplayName("Should load settings from a classpath properties file")
    void shouldLoadFromClasspath() {
        GcPolicyConfig config = GcPolicyConfig.loadFromClasspath("gcpolicy-test.properties");

        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.wrapTopLevelLeaf()).isTrue();
        assertThat(config.defaultDeletionMode()).isEqualTo(DeletionMode.ABANDON);
    }

    @Test
    @DisplayName("Should fall back to defaults when the properties file is missing")
    void missingPropertiesFile() {
        assertThat(GcPolicyConfig.loadFromClasspath("missing.properties").defaultTimeout())
                .isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("System property names mirror the environment variable names")
    void propertyNames() {
        assertThat(GcPolicyConfig.propertyName("GC_POLICY_WRAP_TOP_LEVEL_LEAF"))
                .isEqualTo("gc.policy.wrap.top.level.leaf");
    }

    @Test
    @DisplayName("Property names and file lookups do not depend on the default locale")
    void localeIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(GcPolicyConfig.propertyName("GC_POLICY_DEFAULT_TIMEOUT_SECONDS"))
                    .isEqualTo("gc.policy.default.timeout.seconds");
            GcPolicyConfig config = GcPolicyConfig.loadFromClasspath("gcpolicy-test.properties");
            assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(15));
            assertThat(config.defaultDeletionMode()).isEqualTo(DeletionMode.ABANDON);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Should accept an explicit default deletion mode in any case")
    void explicitDefaultMode() {
        GcPolicyConfig config = GcPolicyConfig.builder(Map.of("GC_POLICY_DEFAULT_DELETION_MODE", "Default")).build();

        assertThat(config.defaultDeletionMode()).isEqualTo(DeletionMode.DEFAULT);
    }
}
