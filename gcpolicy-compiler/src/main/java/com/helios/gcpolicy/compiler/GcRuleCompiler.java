/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.gcpolicy.api.IGcRuleCompiler;
import com.helios.gcpolicy.api.exceptions.CompilationException;
import com.helios.gcpolicy.api.model.GcPolicy;
import com.helios.gcpolicy.api.model.GcRule;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default {@link IGcRuleCompiler}: {@link GcRuleParser} for validation,
 * {@link PolicyCompiler} and {@link PolicyDecompiler} for the two directions.
 *
 * <p>Registered in {@code META-INF/services} so that it can be discovered with
 * {@link java.util.ServiceLoader}.
 */
public class GcRuleCompiler implements IGcRuleCompiler {
    private static final Logger logger = Logger.getLogger(GcRuleCompiler.class.getName());

    private final GcRuleParser parser;
    private final PolicyCompiler policyCompiler = new PolicyCompiler();
    private volatile PolicyDecompiler decompiler = new PolicyDecompiler();
    private volatile Tracer tracer;

    public GcRuleCompiler() {
        this(OpenTelemetry.noop().getTracer("com.helios.gcpolicy"));
    }

    public GcRuleCompiler(Tracer tracer) {
        this(tracer, new ObjectMapper());
    }

    public GcRuleCompiler(Tracer tracer, ObjectMapper objectMapper) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.parser = new GcRuleParser(objectMapper);
    }

    @Override
    public GcRule parse(JsonNode raw, boolean topLevel) {
        return parser.parse(raw, topLevel);
    }

    @Override
    public GcRule parse(String json) {
        return parser.parse(json);
    }

    @Override
    public GcPolicy compile(GcRule rule) {
        return policyCompiler.compile(rule);
    }

    /**
     * Validates and compiles a rule document inside a {@code compile-gc-rule} span.
     */
    @Override
    public GcPolicy compile(JsonNode raw) {
        Span span = tracer.spanBuilder("compile-gc-rule").startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (raw == null || raw.isNull() || raw.isMissingNode()) {
                span.setAttribute("policyType", GcPolicy.Type.NO_GC.name());
                return GcPolicy.noGc();
            }
            GcRule rule = parser.parse(raw, true);
            GcPolicy policy = policyCompiler.compile(rule);
            span.setAttribute("policyType", policy.type().name());
            return policy;
        } catch (CompilationException e) {
            span.recordException(e);
            logger.fine("Rejected GC rules: " + e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Optional<JsonNode> decompile(GcPolicy policy) {
        return decompiler.decompile(policy);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setWrapTopLevelLeaf(boolean wrapTopLevelLeaf) {
        if (decompiler.wrapsTopLevelLeaf() != wrapTopLevelLeaf) {
            this.decompiler = new PolicyDecompiler(wrapTopLevelLeaf);
        }
    }
}
