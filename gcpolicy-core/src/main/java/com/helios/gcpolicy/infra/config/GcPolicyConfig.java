/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.infra.config;

import com.helios.gcpolicy.api.model.DeletionMode;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration of the GC policy manager and rule compiler.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables:
 * <pre>
 * GC_POLICY_DEFAULT_TIMEOUT_SECONDS=30
 * GC_POLICY_WRAP_TOP_LEVEL_LEAF=true
 * GC_POLICY_DEFAULT_DELETION_MODE=ABANDON
 * </pre>
 * A system property with the dotted lowercase name (e.g.
 * {@code gc.policy.default.timeout.seconds}) is used when the variable is unset.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * GcPolicyConfig config = GcPolicyConfig.builder()
 *     .defaultTimeout(Duration.ofSeconds(30))
 *     .wrapTopLevelLeaf(true)
 *     .build();
 * }</pre>
 */
public final class GcPolicyConfig {

    private static final Logger logger = Logger.getLogger(GcPolicyConfig.class.getName());

    static final String ENV_DEFAULT_TIMEOUT_SECONDS = "GC_POLICY_DEFAULT_TIMEOUT_SECONDS";
    static final String ENV_WRAP_TOP_LEVEL_LEAF = "GC_POLICY_WRAP_TOP_LEVEL_LEAF";
    static final String ENV_DEFAULT_DELETION_MODE = "GC_POLICY_DEFAULT_DELETION_MODE";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final Duration defaultTimeout;
    private final boolean wrapTopLevelLeaf;
    private final DeletionMode defaultDeletionMode;

    private GcPolicyConfig(Builder builder) {
        this.defaultTimeout = builder.defaultTimeout;
        this.wrapTopLevelLeaf = builder.wrapTopLevelLeaf;
        this.defaultDeletionMode = builder.defaultDeletionMode;
        validate();
    }

    /**
     * Defaults overridden by environment variables and system properties.
     */
    public static GcPolicyConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Defaults only, ignoring the environment.
     */
    public static GcPolicyConfig defaults() {
        return builder(key -> null).build();
    }

    /**
     * Loads {@code gcpolicy.properties} from the classpath root. Environment
     * variables take precedence over file values.
     */
    public static GcPolicyConfig loadDefault() {
        return loadFromClasspath("gcpolicy.properties");
    }

    public static GcPolicyConfig loadFromClasspath(String resource) {
        Properties props = new Properties();
        try (InputStream is = GcPolicyConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + resource);
            } else {
                logger.warning("Could not find properties file: " + resource + ". Using defaults.");
            }
        } catch (IOException e) {
            logger.warning("Could not read properties file: " + resource + " (" + e.getMessage() + "). Using defaults.");
        }
        Function<String, String> environment = Builder::lookupEnvironment;
        return builder(key -> {
            String value = environment.apply(key);
            return value != null ? value : props.getProperty(propertyName(key));
        }).build();
    }

    public static Builder builder() {
        return new Builder(Builder::lookupEnvironment);
    }

    /**
     * Builder reading overrides from the given source instead of the process
     * environment. Keys are the {@code GC_POLICY_*} variable names.
     */
    public static Builder builder(Map<String, String> environment) {
        return new Builder(environment::get);
    }

    static Builder builder(Function<String, String> environment) {
        return new Builder(environment);
    }

    private void validate() {
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive: " + defaultTimeout);
        }
        if (defaultDeletionMode == null) {
            throw new IllegalArgumentException("defaultDeletionMode must not be null");
        }
    }

    static String propertyName(String environmentKey) {
        return environmentKey.toLowerCase(Locale.ROOT).replace('_', '.');
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public boolean wrapTopLevelLeaf() {
        return wrapTopLevelLeaf;
    }

    public DeletionMode defaultDeletionMode() {
        return defaultDeletionMode;
    }

    @Override
    public String toString() {
        return "GcPolicyConfig{defaultTimeout=" + defaultTimeout
                + ", wrapTopLevelLeaf=" + wrapTopLevelLeaf
                + ", defaultDeletionMode=" + defaultDeletionMode + "}";
    }

    public static class Builder {

        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private boolean wrapTopLevelLeaf = false;
        private DeletionMode defaultDeletionMode = DeletionMode.DEFAULT;

        private final Function<String, String> environment;

        private Builder(Function<String, String> environment) {
            this.environment = environment;
            applyEnvironmentVariables();
        }

        private void applyEnvironmentVariables() {
            getLong(ENV_DEFAULT_TIMEOUT_SECONDS).ifPresent(val -> {
                if (val > 0) {
                    this.defaultTimeout = Duration.ofSeconds(val);
                } else {
                    logger.warning("Invalid " + ENV_DEFAULT_TIMEOUT_SECONDS + ": " + val
                            + ", using default: " + this.defaultTimeout);
                }
            });
            getBoolean(ENV_WRAP_TOP_LEVEL_LEAF).ifPresent(val -> this.wrapTopLevelLeaf = val);
            get(ENV_DEFAULT_DELETION_MODE).ifPresent(val -> {
                try {
                    this.defaultDeletionMode = DeletionMode.fromString(val);
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid " + ENV_DEFAULT_DELETION_MODE + ": " + val
                            + ", using default: " + this.defaultDeletionMode);
                }
            });
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder wrapTopLevelLeaf(boolean wrapTopLevelLeaf) {
            this.wrapTopLevelLeaf = wrapTopLevelLeaf;
            return this;
        }

        public Builder defaultDeletionMode(DeletionMode defaultDeletionMode) {
            this.defaultDeletionMode = defaultDeletionMode;
            return this;
        }

        public GcPolicyConfig build() {
            return new GcPolicyConfig(this);
        }

        private Optional<String> get(String key) {
            String value = environment.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded setting: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private Optional<Long> getLong(String key) {
            return get(key).flatMap(val -> {
                try {
                    return Optional.of(Long.parseLong(val));
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return Optional.empty();
                }
            });
        }

        private Optional<Boolean> getBoolean(String key) {
            return get(key).flatMap(val -> {
                if ("true".equalsIgnoreCase(val) || "false".equalsIgnoreCase(val)) {
                    return Optional.of(Boolean.parseBoolean(val));
                }
                logger.warning("Invalid boolean value for " + key + ": " + val);
                return Optional.empty();
            });
        }

        private static String lookupEnvironment(String key) {
            String value = System.getenv(key);
            if (value == null || value.isEmpty()) {
                value = System.getProperty(propertyName(key));
            }
            return value;
        }
    }
}
