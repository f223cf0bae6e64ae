/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

/**
 * Lifecycle of a column family's GC policy as tracked by the policy manager.
 */
public enum FamilyState {
    /** Never applied, or reset to no GC policy. */
    ABSENT,

    /** A policy was applied and is managed. */
    CONFIGURED,

    /** Released with {@link DeletionMode#ABANDON}; the live policy was left in place. */
    UNMANAGED
}
