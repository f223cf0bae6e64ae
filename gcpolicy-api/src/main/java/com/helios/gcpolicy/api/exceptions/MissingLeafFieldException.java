/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * A leaf rule sets neither {@code max_age} nor {@code max_version}.
 */
public class MissingLeafFieldException extends RuleValidationException {

    public MissingLeafFieldException(String path) {
        super(path, "need `max_version` or `max_age` for the rule");
    }
}
