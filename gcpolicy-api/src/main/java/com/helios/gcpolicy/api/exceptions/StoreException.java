/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.exceptions;

/**
 * Failure reported by the column-family store or raised before calling it.
 *
 * <p>Checked, like the I/O failures it usually wraps. The code follows the
 * store's RPC status codes.
 */
public class StoreException extends Exception {

    public enum Code {
        NOT_FOUND,
        INVALID_ARGUMENT,
        PERMISSION_DENIED,
        FAILED_PRECONDITION,
        UNAVAILABLE,
        DEADLINE_EXCEEDED,
        CANCELLED,
        INTERNAL
    }

    private final Code code;

    public StoreException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public StoreException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code code() {
        return code;
    }

    public boolean isNotFound() {
        return code == Code.NOT_FOUND;
    }

    /**
     * Wraps this failure with the table and column family it concerns, keeping
     * the code.
     */
    public StoreException withContext(String table, String columnFamilyId) {
        return new StoreException(code,
                "Table (" + table + "), column family (" + columnFamilyId + "): " + getMessage(), this);
    }
}
