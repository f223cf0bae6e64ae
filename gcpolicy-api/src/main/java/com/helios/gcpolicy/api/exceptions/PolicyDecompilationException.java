/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * A live policy cannot be expressed in the {@code gc_rules} grammar.
 */
public class PolicyDecompilationException extends CompilationException {

    public PolicyDecompilationException(String message) {
        super(message);
    }
}
