/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * A composite rule has the wrong number of children for its mode.
 */
public class InvalidRuleCountException extends RuleValidationException {

    private final String expected;
    private final int actual;

    public InvalidRuleCountException(String path, String expected, int actual) {
        super(path, "`rules` must contain " + expected + " rule(s), found " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
