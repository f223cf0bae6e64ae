/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

public class InvalidVersionCountException extends RuleValidationException {

    private final String value;

    public InvalidVersionCountException(String path, String value) {
        super(path, "`max_version` must be an integer of at least 1, got " + value);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
