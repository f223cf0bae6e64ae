/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.helios.gcpolicy.api.exceptions.PolicyDecompilationException;
import com.helios.gcpolicy.api.model.CompositeMode;
import com.helios.gcpolicy.api.model.GcPolicy;

import java.util.List;
import java.util.Optional;

/**
 * Serializes a {@link GcPolicy} into a canonical {@code gc_rules} document that
 * {@link GcRuleParser} accepts.
 *
 * <p>The live store may hand back policies that {@link PolicyCompiler} never
 * produces, such as a union with a single child. Those are written in the
 * single-rule form {@code {"rules":[child]}} to stay within the grammar.
 *
 * <p>For every policy {@code p} produced by {@link PolicyCompiler},
 * compiling the parsed output of {@code decompile(p)} yields {@code p} again.
 */
public class PolicyDecompiler {

    private final JsonNodeFactory nodeFactory;
    private final boolean wrapTopLevelLeaf;

    public PolicyDecompiler() {
        this(false);
    }

    /**
     * @param wrapTopLevelLeaf write a root leaf as {@code {"rules":[leaf]}}
     *                         rather than as the bare leaf
     */
    public PolicyDecompiler(boolean wrapTopLevelLeaf) {
        this.nodeFactory = JsonNodeFactory.instance;
        this.wrapTopLevelLeaf = wrapTopLevelLeaf;
    }

    public boolean wrapsTopLevelLeaf() {
        return wrapTopLevelLeaf;
    }

    /**
     * @return the rule document, or empty for {@link GcPolicy.NoGc}
     * @throws PolicyDecompilationException if a duration is not a whole number of seconds
     */
    public Optional<JsonNode> decompile(GcPolicy policy) {
        if (policy == null || policy.type() == GcPolicy.Type.NO_GC) {
            return Optional.empty();
        }
        ObjectNode node = toNode(policy);
        if (wrapTopLevelLeaf && isLeaf(policy)) {
            return Optional.of(singleRule(node));
        }
        return Optional.of(node);
    }

    private ObjectNode toNode(GcPolicy policy) {
        return switch (policy.type()) {
            case MAX_AGE -> nodeFactory.objectNode()
                    .put(GcRuleParser.MAX_AGE, DurationFormat.format(((GcPolicy.MaxAge) policy).maxAge()));
            case MAX_VERSIONS -> nodeFactory.objectNode()
                    .put(GcRuleParser.MAX_VERSION, ((GcPolicy.MaxVersions) policy).maxVersions());
            case UNION -> combinator(CompositeMode.UNION, ((GcPolicy.Union) policy).children());
            case INTERSECTION -> combinator(CompositeMode.INTERSECTION, ((GcPolicy.Intersection) policy).children());
            case NO_GC -> throw new PolicyDecompilationException("NoGc can only appear at the root of a policy");
        };
    }

    private ObjectNode combinator(CompositeMode mode, List<GcPolicy> children) {
        if (children.size() == 1) {
            return singleRule(toNode(children.get(0)));
        }
        ObjectNode node = nodeFactory.objectNode();
        node.put(GcRuleParser.MODE, mode.jsonValue());
        ArrayNode rules = node.putArray(GcRuleParser.RULES);
        for (GcPolicy child : children) {
            rules.add(toNode(child));
        }
        return node;
    }

    private ObjectNode singleRule(ObjectNode child) {
        ObjectNode node = nodeFactory.objectNode();
        node.putArray(GcRuleParser.RULES).add(child);
        return node;
    }

    private static boolean isLeaf(GcPolicy policy) {
        return policy.type() == GcPolicy.Type.MAX_AGE || policy.type() == GcPolicy.Type.MAX_VERSIONS;
    }
}
