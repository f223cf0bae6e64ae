/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.helios.gcpolicy.api.IGcRuleCompiler;
import com.helios.gcpolicy.api.exceptions.InvalidRuleCountException;
import com.helios.gcpolicy.api.exceptions.InvalidVersionCountException;
import com.helios.gcpolicy.api.model.GcPolicy;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GcRuleCompilerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should be discoverable through ServiceLoader")
    void shouldBeDiscoverable() {
        assertThat(ServiceLoader.load(IGcRuleCompiler.class).findFirst())
                .hasValueSatisfying(compiler -> assertThat(compiler).isInstanceOf(GcRuleCompiler.class));
    }

    @Test
    @DisplayName("Missing or null documents compile to NoGc")
    void missingDocumentIsNoGc() {
        GcRuleCompiler compiler = new GcRuleCompiler();

        assertThat(compiler.compile((JsonNode) null)).isSameAs(GcPolicy.noGc());
        assertThat(compiler.compile(NullNode.getInstance())).isSameAs(GcPolicy.noGc());
    }

    @Test
    @DisplayName("Should record validation failures on the compile span")
    void shouldRecordFailuresOnSpan() throws Exception {
        Tracer tracer = mock(Tracer.class);
        SpanBuilder spanBuilder = mock(SpanBuilder.class);
        Span span = mock(Span.class);
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(mock(Scope.class));

        GcRuleCompiler compiler = new GcRuleCompiler(tracer);

        assertThatThrownBy(() -> compiler.compile(mapper.readTree("{\"rules\":[]}")))
                .isInstanceOf(InvalidRuleCountException.class);
        verify(tracer).spanBuilder("compile-gc-rule");
        verify(span).recordException(any(InvalidRuleCountException.class));
        verify(span).end();
    }

    @Test
    @DisplayName("Should tag the compile span with the policy type")
    void shouldTagPolicyType() throws Exception {
        Tracer tracer = mock(Tracer.class);
        SpanBuilder spanBuilder = mock(SpanBuilder.class);
        Span span = mock(Span.class);
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(mock(Scope.class));

        GcRuleCompiler compiler = new GcRuleCompiler();
        compiler.setTracer(tracer);
        GcPolicy policy = compiler.compile(mapper.readTree(
                "{\"mode\":\"union\",\"rules\":[{\"max_age\":\"1h\"},{\"max_version\":1}]}"));

        assertThat(policy.type()).isEqualTo(GcPolicy.Type.UNION);
        verify(span).setAttribute("policyType", "UNION");
    }

    @Test
    @DisplayName("Should report an out-of-range nested version count as a validation error")
    void shouldRejectInfiniteVersionCount() {
        Tracer tracer = mock(Tracer.class);
        SpanBuilder spanBuilder = mock(SpanBuilder.class);
        Span span = mock(Span.class);
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(mock(Scope.class));

        GcRuleCompiler compiler = new GcRuleCompiler(tracer);

        assertThatThrownBy(() -> compiler.compile(mapper.readTree("{\"rules\":[{\"max_version\": -1e400}]}")))
                .isInstanceOf(InvalidVersionCountException.class)
                .hasMessageStartingWith("$.rules[0].max_version:");
        verify(span).recordException(any(InvalidVersionCountException.class));
    }
}
