/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

import java.util.Objects;

/**
 * The unit exchanged with the store: one column family and its GC policy.
 * Built per apply/read cycle and never persisted.
 */
public record ColumnFamilyGcConfig(
        TableRef tableRef,
        String columnFamilyId,
        GcPolicy policy,
        DeletionMode deletionMode
) {
    public ColumnFamilyGcConfig {
        Objects.requireNonNull(tableRef, "tableRef");
        TableRef.checkColumnFamilyId(columnFamilyId);
        policy = policy != null ? policy : GcPolicy.noGc();
        deletionMode = deletionMode != null ? deletionMode : DeletionMode.DEFAULT;
    }
}
