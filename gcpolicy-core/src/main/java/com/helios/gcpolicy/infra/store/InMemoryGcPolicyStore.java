/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.infra.store;

import com.helios.gcpolicy.api.CallContext;
import com.helios.gcpolicy.api.GcPolicyStore;
import com.helios.gcpolicy.api.exceptions.StoreException;
import com.helios.gcpolicy.api.model.GcPolicy;
import com.helios.gcpolicy.api.model.TableRef;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * In-memory {@link GcPolicyStore} for tests and local development.
 *
 * Features:
 * - Tables and column families must be registered before use; unknown ones
 *   are reported as NOT_FOUND, like the real admin API
 * - Live policies can be seeded directly, including shapes the compiler never
 *   produces (e.g. a one-child union after store-side normalization)
 * - Optional store-side normalization: one-child combinators written by a
 *   client are collapsed to their child
 * - A single failure can be injected for the next call
 * - Call counters for verifying that no store traffic happened
 *
 * Data is lost when the process stops.
 */
public class InMemoryGcPolicyStore implements GcPolicyStore {
    private static final Logger logger = Logger.getLogger(InMemoryGcPolicyStore.class.getName());

    private final ConcurrentMap<TableRef, ConcurrentMap<String, GcPolicy>> tables = new ConcurrentHashMap<>();
    private final AtomicReference<StoreException> nextFailure = new AtomicReference<>();

    private final LongAdder setCalls = new LongAdder();
    private final LongAdder getCalls = new LongAdder();
    private final LongAdder listCalls = new LongAdder();

    private final boolean collapseSingleChildCombinators;

    public InMemoryGcPolicyStore() {
        this(false);
    }

    /**
     * @param collapseSingleChildCombinators whether written one-child unions and
     *                                       intersections are stored as their child
     */
    public InMemoryGcPolicyStore(boolean collapseSingleChildCombinators) {
        this.collapseSingleChildCombinators = collapseSingleChildCombinators;
    }

    /**
     * Registers a column family without GC policy. Creates the table if needed.
     */
    public InMemoryGcPolicyStore createColumnFamily(TableRef table, String columnFamilyId) {
        TableRef.checkColumnFamilyId(columnFamilyId);
        tables.computeIfAbsent(table, t -> new ConcurrentHashMap<>())
                .putIfAbsent(columnFamilyId, GcPolicy.noGc());
        return this;
    }

    /**
     * Replaces the live policy of a registered column family without going
     * through the client API and without counting a call.
     */
    public void putLivePolicy(TableRef table, String columnFamilyId, GcPolicy policy) {
        families(table).put(columnFamilyId, policy);
    }

    /**
     * The live policy, {@link GcPolicy#noGc()} if none is set.
     */
    public GcPolicy livePolicy(TableRef table, String columnFamilyId) {
        ConcurrentMap<String, GcPolicy> families = tables.get(table);
        GcPolicy policy = families == null ? null : families.get(columnFamilyId);
        return policy == null ? GcPolicy.noGc() : policy;
    }

    /**
     * Makes the next store call fail with the given exception.
     */
    public void failNextCall(StoreException failure) {
        nextFailure.set(failure);
    }

    @Override
    public GcPolicy setGcPolicy(TableRef table, String columnFamilyId, GcPolicy policy, CallContext context)
            throws StoreException {
        setCalls.increment();
        beforeCall("SetGCPolicy", context);
        ConcurrentMap<String, GcPolicy> families = existingFamilies(table);
        GcPolicy newPolicy = policy != null ? normalize(policy) : GcPolicy.noGc();
        if (families.replace(columnFamilyId, newPolicy) == null) {
            throw columnFamilyNotFound(columnFamilyId);
        }
        logger.fine("Set GC policy of " + table + "/" + columnFamilyId + " to " + newPolicy);
        return newPolicy;
    }

    @Override
    public Optional<GcPolicy> getGcPolicy(TableRef table, String columnFamilyId, CallContext context)
            throws StoreException {
        getCalls.increment();
        beforeCall("GetGCPolicy", context);
        GcPolicy policy = existingFamilies(table).get(columnFamilyId);
        if (policy == null) {
            throw columnFamilyNotFound(columnFamilyId);
        }
        return policy.type() == GcPolicy.Type.NO_GC ? Optional.empty() : Optional.of(policy);
    }

    @Override
    public Map<String, GcPolicy> listGcPolicies(TableRef table, CallContext context) throws StoreException {
        listCalls.increment();
        beforeCall("ListGCPolicies", context);
        Map<String, GcPolicy> result = new TreeMap<>();
        existingFamilies(table).forEach((family, policy) -> {
            if (policy.type() != GcPolicy.Type.NO_GC) {
                result.put(family, policy);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    public long setCallCount() {
        return setCalls.sum();
    }

    public long getCallCount() {
        return getCalls.sum();
    }

    public long listCallCount() {
        return listCalls.sum();
    }

    public long totalCallCount() {
        return setCallCount() + getCallCount() + listCallCount();
    }

    private GcPolicy normalize(GcPolicy policy) {
        if (!collapseSingleChildCombinators) {
            return policy;
        }
        return switch (policy.type()) {
            case UNION -> collapse(((GcPolicy.Union) policy).children(), GcPolicy.Union::new);
            case INTERSECTION -> collapse(((GcPolicy.Intersection) policy).children(), GcPolicy.Intersection::new);
            default -> policy;
        };
    }

    private GcPolicy collapse(List<GcPolicy> children, Function<List<GcPolicy>, GcPolicy> combinator) {
        List<GcPolicy> normalized = children.stream().map(this::normalize).toList();
        return normalized.size() == 1 ? normalized.get(0) : combinator.apply(normalized);
    }

    private void beforeCall(String operation, CallContext context) throws StoreException {
        context.checkActive(operation);
        StoreException failure = nextFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
    }

    private ConcurrentMap<String, GcPolicy> existingFamilies(TableRef table) throws StoreException {
        ConcurrentMap<String, GcPolicy> families = tables.get(table);
        if (families == null) {
            throw new StoreException(StoreException.Code.NOT_FOUND, "Table " + table + " not found");
        }
        return families;
    }

    private ConcurrentMap<String, GcPolicy> families(TableRef table) {
        ConcurrentMap<String, GcPolicy> families = tables.get(table);
        if (families == null) {
            throw new IllegalStateException("Table " + table + " is not registered");
        }
        return families;
    }

    private static StoreException columnFamilyNotFound(String columnFamilyId) {
        return new StoreException(StoreException.Code.NOT_FOUND, "Column family " + columnFamilyId + " not found");
    }
}
