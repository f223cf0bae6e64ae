/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * The document is not JSON, or a node has the wrong JSON type
 * (e.g. {@code rules} is not an array).
 */
public class MalformedRuleException extends RuleValidationException {

    public MalformedRuleException(String path, String message) {
        super(path, message);
    }

    public MalformedRuleException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
