/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * A {@code gc_rules} document violates the rule grammar.
 *
 * <p>Raised before anything is compiled or sent to the store. {@link #path()}
 * locates the offending node, e.g. {@code $.rules[1].max_age}.
 */
public abstract class RuleValidationException extends CompilationException {

    private final String path;

    protected RuleValidationException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    protected RuleValidationException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
