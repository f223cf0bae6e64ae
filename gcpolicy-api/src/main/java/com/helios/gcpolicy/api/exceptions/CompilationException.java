/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * Exception thrown when GC rule compilation fails.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the codebase, while still providing clear error messages
 * for compilation failures.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
