/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

public class InvalidModeException extends RuleValidationException {

    private final String value;

    public InvalidModeException(String path, String value) {
        super(path, "`mode` must be either `union` or `intersection`, got " + value);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
