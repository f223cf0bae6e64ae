/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.infra.config;

import com.helios.gcpolicy.api.IGcRuleCompiler;
import io.opentelemetry.api.trace.Tracer;

import java.util.ServiceLoader;

/**
 * Locates the {@link IGcRuleCompiler} implementation on the classpath.
 */
public final class GcRuleCompilers {

    private GcRuleCompilers() {
    }

    /**
     * Loads the first registered compiler and applies the configuration to it.
     *
     * @throws IllegalStateException if no implementation is registered
     */
    public static IGcRuleCompiler load(Tracer tracer, GcPolicyConfig config) {
        IGcRuleCompiler compiler = ServiceLoader.load(IGcRuleCompiler.class)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No IGcRuleCompiler implementation found"));
        compiler.setTracer(tracer);
        compiler.setWrapTopLevelLeaf(config.wrapTopLevelLeaf());
        return compiler;
    }
}
