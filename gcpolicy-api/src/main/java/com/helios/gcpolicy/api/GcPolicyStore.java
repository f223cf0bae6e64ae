/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api;

import com.helios.gcpolicy.api.exceptions.StoreException;
import com.helios.gcpolicy.api.model.GcPolicy;
import com.helios.gcpolicy.api.model.TableRef;

import java.util.Map;
import java.util.Optional;

/**
 * Administrative client of the column-family store, limited to GC policies.
 *
 * <p>Implementations perform a single attempt per call: retry and backoff
 * belong to the caller. Each call must honour the given {@link CallContext}.
 */
public interface GcPolicyStore {

    /**
     * Replaces the GC policy of a column family.
     *
     * @return the policy now in effect, as reported by the store
     */
    GcPolicy setGcPolicy(TableRef table, String columnFamilyId, GcPolicy policy, CallContext context)
            throws StoreException;

    /**
     * Reads the GC policy of a column family.
     *
     * @return the live policy, or empty if the family has none
     * @throws StoreException with {@link StoreException.Code#NOT_FOUND} if the table or family does not exist
     */
    Optional<GcPolicy> getGcPolicy(TableRef table, String columnFamilyId, CallContext context)
            throws StoreException;

    /**
     * Lists the GC policies of every column family of a table that has one.
     *
     * @return policies keyed by column family id
     */
    Map<String, GcPolicy> listGcPolicies(TableRef table, CallContext context) throws StoreException;
}
