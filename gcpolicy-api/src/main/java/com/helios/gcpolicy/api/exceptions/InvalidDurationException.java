/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

public class InvalidDurationException extends RuleValidationException {

    private final String value;

    public InvalidDurationException(String path, String value) {
        super(path, "invalid duration string: " + value);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
