/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.gcpolicy.api.exceptions.CompilationException;
import com.helios.gcpolicy.api.exceptions.RuleValidationException;
import com.helios.gcpolicy.api.model.GcPolicy;
import com.helios.gcpolicy.api.model.GcRule;
import io.opentelemetry.api.trace.Tracer;

import java.util.Optional;

/**
 * Contract for translating {@code gc_rules} JSON into store policies and back.
 *
 * <p>Implementations are stateless apart from their configuration and are
 * discovered through {@link java.util.ServiceLoader}.
 */
public interface IGcRuleCompiler {

    /**
     * Validates a rule document node.
     *
     * @param raw      the JSON object
     * @param topLevel whether {@code raw} is the document root
     * @return the validated rule tree
     * @throws RuleValidationException on the first grammar violation
     */
    GcRule parse(JsonNode raw, boolean topLevel);

    /**
     * Parses and validates a serialized rule document.
     *
     * @throws RuleValidationException if the text is not JSON or violates the grammar
     */
    GcRule parse(String json);

    /**
     * Maps a validated rule onto a policy. {@code null} means no rule and
     * compiles to {@link GcPolicy#noGc()}.
     */
    GcPolicy compile(GcRule rule);

    /**
     * Canonical rule document for a policy, or empty for {@link GcPolicy.NoGc}.
     *
     * @throws CompilationException if the policy has no representation in the grammar
     */
    Optional<JsonNode> decompile(GcPolicy policy);

    /**
     * Validates and compiles a rule document in one step. A {@code null} or JSON
     * {@code null} document compiles to {@link GcPolicy#noGc()}.
     */
    default GcPolicy compile(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return GcPolicy.noGc();
        }
        return compile(parse(raw, true));
    }

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Whether a top-level leaf decompiles to {@code {"rules":[leaf]}} instead of
     * the bare leaf.
     */
    default void setWrapTopLevelLeaf(boolean wrapTopLevelLeaf) {
    }
}
