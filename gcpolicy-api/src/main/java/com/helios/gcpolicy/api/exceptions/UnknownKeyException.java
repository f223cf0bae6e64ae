/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

public class UnknownKeyException extends RuleValidationException {

    private final String key;

    public UnknownKeyException(String path, String key) {
        super(path, "unknown field `" + key + "`");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
