/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.infra.management;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.gcpolicy.api.CallContext;
import com.helios.gcpolicy.api.GcPolicyStore;
import com.helios.gcpolicy.api.IGcRuleCompiler;
import com.helios.gcpolicy.api.exceptions.StoreException;
import com.helios.gcpolicy.api.model.ColumnFamilyGcConfig;
import com.helios.gcpolicy.api.model.DeletionMode;
import com.helios.gcpolicy.api.model.FamilyState;
import com.helios.gcpolicy.api.model.GcPolicy;
import com.helios.gcpolicy.api.model.TableRef;
import com.helios.gcpolicy.infra.config.GcPolicyConfig;
import com.helios.gcpolicy.infra.config.GcRuleCompilers;
import com.helios.gcpolicy.infra.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies, reads and releases the GC policy of column families.
 *
 * <p>Rule documents are validated and compiled before the store is touched,
 * so an invalid document never causes a store call. The manager keeps a
 * per-family record of what it configured and with which deletion mode:
 *
 * <pre>
 * ABSENT --apply--> CONFIGURED --release(DEFAULT)--> ABSENT
 *                   CONFIGURED --release(ABANDON)--> UNMANAGED --apply--> CONFIGURED
 * </pre>
 *
 * <p>Store failures are rethrown with the table and family attached. The only
 * translated failure is NOT_FOUND on read, which means "no policy".
 */
public class GcPolicyManager {
    private static final Logger logger = Logger.getLogger(GcPolicyManager.class.getName());

    private final GcPolicyStore store;
    private final IGcRuleCompiler compiler;
    private final Tracer tracer;
    private final GcPolicyConfig config;

    private final ConcurrentMap<FamilyKey, Registration> registrations = new ConcurrentHashMap<>();

    public GcPolicyManager(GcPolicyStore store, IGcRuleCompiler compiler, Tracer tracer, GcPolicyConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.config = Objects.requireNonNull(config, "config");
        this.compiler.setTracer(tracer);
    }

    /**
     * Manager with the discovered compiler and the process-wide tracer.
     */
    public GcPolicyManager(GcPolicyStore store, GcPolicyConfig config) {
        this(store, TracingService.getInstance().getTracer(), config);
    }

    private GcPolicyManager(GcPolicyStore store, Tracer tracer, GcPolicyConfig config) {
        this(store, GcRuleCompilers.load(tracer, config), tracer, config);
    }

    public GcPolicy apply(TableRef table, String columnFamilyId, JsonNode rawRule, DeletionMode deletionMode)
            throws StoreException {
        return apply(table, columnFamilyId, rawRule, deletionMode, newContext());
    }

    /**
     * Validates and compiles {@code rawRule}, then writes it to the store.
     *
     * @param rawRule      rule document, {@code null} for no GC policy
     * @param deletionMode what a later release does, {@code null} for the configured default
     * @return the policy as reported by the store
     * @throws com.helios.gcpolicy.api.exceptions.RuleValidationException if the document is invalid
     * @throws StoreException if the store rejects the write or the call is no longer active
     */
    public GcPolicy apply(TableRef table, String columnFamilyId, JsonNode rawRule, DeletionMode deletionMode,
                          CallContext context) throws StoreException {
        return applyCompiled(table, columnFamilyId, c -> c.compile(rawRule), deletionMode, context);
    }

    public GcPolicy apply(TableRef table, String columnFamilyId, String rules, DeletionMode deletionMode)
            throws StoreException {
        return apply(table, columnFamilyId, rules, deletionMode, newContext());
    }

    /**
     * Same as {@link #apply(TableRef, String, JsonNode, DeletionMode, CallContext)}
     * for a serialized document. {@code null} or blank text means no GC policy.
     */
    public GcPolicy apply(TableRef table, String columnFamilyId, String rules, DeletionMode deletionMode,
                          CallContext context) throws StoreException {
        return applyCompiled(table, columnFamilyId,
                c -> rules == null || rules.isBlank() ? GcPolicy.noGc() : c.compile(c.parse(rules)),
                deletionMode, context);
    }

    private GcPolicy applyCompiled(TableRef table, String columnFamilyId,
                                   Function<IGcRuleCompiler, GcPolicy> compilation,
                                   DeletionMode deletionMode, CallContext context) throws StoreException {
        DeletionMode mode = deletionMode != null ? deletionMode : config.defaultDeletionMode();
        Span span = startSpan("apply-gc-policy", table, columnFamilyId);
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("deletionMode", mode.name());
            checkTarget(table, columnFamilyId);

            GcPolicy policy = compilation.apply(compiler);
            span.setAttribute("policyType", policy.type().name());

            GcPolicy stored = write(table, columnFamilyId, policy, context);
            FamilyKey key = new FamilyKey(table, columnFamilyId);
            Registration previous = registrations.put(key, new Registration(FamilyState.CONFIGURED, mode));
            if (previous != null && previous.state() == FamilyState.UNMANAGED) {
                logger.info("Column family " + key + " is managed again");
            }
            logger.info("Applied GC policy " + stored + " to " + key);
            return stored;
        } catch (StoreException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Optional<JsonNode> read(TableRef table, String columnFamilyId) throws StoreException {
        return read(table, columnFamilyId, newContext());
    }

    /**
     * Canonical rule document of the live policy, empty if the family has none
     * or does not exist.
     */
    public Optional<JsonNode> read(TableRef table, String columnFamilyId, CallContext context)
            throws StoreException {
        Span span = startSpan("read-gc-policy", table, columnFamilyId);
        try (Scope scope = span.makeCurrent()) {
            checkTarget(table, columnFamilyId);
            GcPolicy live = fetch(table, columnFamilyId, context);
            span.setAttribute("policyType", live.type().name());
            return compiler.decompile(live);
        } catch (StoreException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void release(TableRef table, String columnFamilyId, DeletionMode deletionMode) throws StoreException {
        release(table, columnFamilyId, deletionMode, newContext());
    }

    /**
     * Gives up management of a family's GC policy.
     *
     * <p>{@link DeletionMode#ABANDON} leaves the live policy untouched and makes
     * no store call. {@link DeletionMode#DEFAULT} clears the policy. A
     * {@code null} mode falls back to the mode given at apply time, then to the
     * configured default.
     */
    public void release(TableRef table, String columnFamilyId, DeletionMode deletionMode, CallContext context)
            throws StoreException {
        FamilyKey key = new FamilyKey(table, columnFamilyId);
        DeletionMode mode = deletionMode != null ? deletionMode : registeredMode(key);
        Span span = startSpan("release-gc-policy", table, columnFamilyId);
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("deletionMode", mode.name());
            checkTarget(table, columnFamilyId);

            if (mode == DeletionMode.ABANDON) {
                // Only a managed family can become unmanaged
                registrations.computeIfPresent(key, (k, previous) -> new Registration(FamilyState.UNMANAGED, mode));
                span.addEvent("GC policy abandoned");
                logger.warning("Column family " + key + " is in ABANDON deletion mode, "
                        + "its GC policy stays in place and is no longer managed");
                return;
            }

            write(table, columnFamilyId, GcPolicy.noGc(), context);
            registrations.remove(key);
            logger.info("Cleared GC policy of " + key);
        } catch (StoreException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public FamilyState state(TableRef table, String columnFamilyId) {
        Registration registration = registrations.get(new FamilyKey(table, columnFamilyId));
        return registration != null ? registration.state() : FamilyState.ABSENT;
    }

    public Map<String, JsonNode> list(TableRef table) throws StoreException {
        return list(table, newContext());
    }

    /**
     * Canonical rule documents of every family of {@code table} that has a
     * policy, ordered by family id.
     */
    public Map<String, JsonNode> list(TableRef table, CallContext context) throws StoreException {
        Objects.requireNonNull(table, "table");
        Span span = tracer.spanBuilder("list-gc-policies").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("table", table.name());
            context.checkActive("ListGCPolicies");
            Map<String, GcPolicy> policies = store.listGcPolicies(table, context);

            Map<String, JsonNode> result = new TreeMap<>();
            policies.forEach((family, policy) ->
                    compiler.decompile(policy).ifPresent(rules -> result.put(family, rules)));
            span.setAttribute("columnFamilies", result.size());
            return Collections.unmodifiableMap(result);
        } catch (StoreException e) {
            StoreException failure = new StoreException(e.code(),
                    "Table (" + table.name() + "): " + e.getMessage(), e);
            span.recordException(failure);
            throw failure;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public DriftReport detectDrift(TableRef table, String columnFamilyId, JsonNode configured)
            throws StoreException {
        return detectDrift(table, columnFamilyId, configured, newContext());
    }

    /**
     * Compares the configured rule document with the live policy.
     *
     * <p>The live policy is compared in its canonical form, so a one-child
     * combinator kept by the store equals its child. Key order and formatting
     * of the configured document do not matter.
     */
    public DriftReport detectDrift(TableRef table, String columnFamilyId, JsonNode configured,
                                   CallContext context) throws StoreException {
        Span span = startSpan("detect-gc-drift", table, columnFamilyId);
        try (Scope scope = span.makeCurrent()) {
            checkTarget(table, columnFamilyId);
            GcPolicy wanted = compiler.compile(configured);
            GcPolicy live = fetch(table, columnFamilyId, context);
            Optional<JsonNode> liveRules = compiler.decompile(live);
            GcPolicy canonicalLive = liveRules.map(compiler::compile).orElse(GcPolicy.noGc());

            boolean inSync = wanted.equals(canonicalLive);
            span.setAttribute("inSync", inSync);
            if (!inSync) {
                logger.info("GC policy of " + new FamilyKey(table, columnFamilyId)
                        + " drifted: configured " + wanted + ", live " + live);
            }
            return new DriftReport(wanted, live, liveRules, inSync);
        } catch (StoreException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * The live policy of a family together with the deletion mode it is
     * managed with.
     */
    public ColumnFamilyGcConfig describe(TableRef table, String columnFamilyId, CallContext context)
            throws StoreException {
        Span span = startSpan("describe-gc-policy", table, columnFamilyId);
        try (Scope scope = span.makeCurrent()) {
            checkTarget(table, columnFamilyId);
            GcPolicy live = fetch(table, columnFamilyId, context);
            DeletionMode mode = registeredMode(new FamilyKey(table, columnFamilyId));
            return new ColumnFamilyGcConfig(table, columnFamilyId, live, mode);
        } catch (StoreException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private GcPolicy write(TableRef table, String columnFamilyId, GcPolicy policy, CallContext context)
            throws StoreException {
        try {
            context.checkActive("SetGCPolicy");
            return store.setGcPolicy(table, columnFamilyId, policy, context);
        } catch (StoreException e) {
            throw e.withContext(table.name(), columnFamilyId);
        }
    }

    /**
     * Live policy, {@link GcPolicy#noGc()} when the store has none or reports
     * NOT_FOUND.
     */
    private GcPolicy fetch(TableRef table, String columnFamilyId, CallContext context) throws StoreException {
        try {
            context.checkActive("GetGCPolicy");
            return store.getGcPolicy(table, columnFamilyId, context).orElse(GcPolicy.noGc());
        } catch (StoreException e) {
            if (e.isNotFound()) {
                logger.log(Level.WARNING, "No GC policy found for " + new FamilyKey(table, columnFamilyId)
                        + ", treating it as absent", e);
                return GcPolicy.noGc();
            }
            throw e.withContext(table.name(), columnFamilyId);
        }
    }

    private Span startSpan(String name, TableRef table, String columnFamilyId) {
        Span span = tracer.spanBuilder(name).startSpan();
        if (table != null) {
            span.setAttribute("table", table.name());
        }
        if (columnFamilyId != null) {
            span.setAttribute("columnFamily", columnFamilyId);
        }
        return span;
    }

    private static void checkTarget(TableRef table, String columnFamilyId) {
        Objects.requireNonNull(table, "table");
        TableRef.checkColumnFamilyId(columnFamilyId);
    }

    private DeletionMode registeredMode(FamilyKey key) {
        Registration registration = registrations.get(key);
        return registration != null ? registration.deletionMode() : config.defaultDeletionMode();
    }

    private CallContext newContext() {
        return CallContext.withTimeout(config.defaultTimeout());
    }

    private record FamilyKey(TableRef table, String columnFamilyId) {
        @Override
        public String toString() {
            return table.name() + "/columnFamilies/" + columnFamilyId;
        }
    }

    private record Registration(FamilyState state, DeletionMode deletionMode) {
    }
}
