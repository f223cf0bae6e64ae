/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * A leaf rule sets both {@code max_age} and {@code max_version}.
 */
public class ConflictingLeafFieldsException extends RuleValidationException {

    public ConflictingLeafFieldsException(String path) {
        super(path, "a rule can only have one of `max_age` or `max_version`");
    }
}
