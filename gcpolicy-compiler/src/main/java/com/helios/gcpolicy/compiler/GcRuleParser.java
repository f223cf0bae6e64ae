/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.gcpolicy.api.exceptions.ConflictingLeafFieldsException;
import com.helios.gcpolicy.api.exceptions.InvalidDurationException;
import com.helios.gcpolicy.api.exceptions.InvalidModeException;
import com.helios.gcpolicy.api.exceptions.InvalidRuleCountException;
import com.helios.gcpolicy.api.exceptions.InvalidVersionCountException;
import com.helios.gcpolicy.api.exceptions.MalformedRuleException;
import com.helios.gcpolicy.api.exceptions.MissingLeafFieldException;
import com.helios.gcpolicy.api.exceptions.RuleValidationException;
import com.helios.gcpolicy.api.exceptions.UnknownKeyException;
import com.helios.gcpolicy.api.model.CompositeMode;
import com.helios.gcpolicy.api.model.GcRule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes a {@code gc_rules} JSON document into a validated {@link GcRule} tree.
 *
 * <p>Grammar, checked top-down at every node:
 * <ul>
 *   <li>a node with {@code rules} is a composite: only {@code mode} and
 *       {@code rules} are allowed; without {@code mode} it must hold exactly one
 *       rule, with {@code mode} ({@code union} | {@code intersection}) at least two</li>
 *   <li>any other node is a leaf with exactly one of {@code max_age} (duration
 *       string) or {@code max_version} (integer &ge; 1)</li>
 * </ul>
 *
 * <p>Validation is fail-fast: the first violation is thrown as a
 * {@link RuleValidationException} whose path locates the node. The parser is
 * stateless and safe for concurrent use.
 */
public class GcRuleParser {
    private static final Logger logger = Logger.getLogger(GcRuleParser.class.getName());

    static final String MODE = "mode";
    static final String RULES = "rules";
    static final String MAX_AGE = "max_age";
    static final String MAX_VERSION = "max_version";

    static final String ROOT_PATH = "$";

    private static final Set<String> COMPOSITE_KEYS = Set.of(MODE, RULES);
    private static final Set<String> LEAF_KEYS = Set.of(MAX_AGE, MAX_VERSION);

    private final ObjectMapper objectMapper;

    public GcRuleParser() {
        this(new ObjectMapper());
    }

    public GcRuleParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses and validates a serialized rule document.
     *
     * @throws MalformedRuleException if the text is not valid JSON
     * @throws RuleValidationException if the document violates the grammar
     */
    public GcRule parse(String json) {
        if (json == null) {
            throw new MalformedRuleException(ROOT_PATH, "GC rules document is null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRuleException(ROOT_PATH, "Could not parse GC rules: " + e.getOriginalMessage(), e);
        }
        return parse(root, true);
    }

    /**
     * Validates a rule node.
     *
     * @param raw      JSON object to validate
     * @param topLevel whether {@code raw} is the document root; a bare leaf is
     *                 accepted at the root as well as nested
     */
    public GcRule parse(JsonNode raw, boolean topLevel) {
        GcRule rule = parseNode(raw, ROOT_PATH);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Parsed " + (topLevel ? "top-level" : "nested") + " GC rule: " + rule);
        }
        return rule;
    }

    private GcRule parseNode(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new MalformedRuleException(path, "a rule must be a JSON object, got " + describe(node));
        }
        return node.has(RULES) ? parseComposite(node, path) : parseLeaf(node, path);
    }

    private GcRule parseComposite(JsonNode node, String path) {
        rejectUnknownKeys(node, COMPOSITE_KEYS, path);

        JsonNode rulesNode = node.get(RULES);
        if (!rulesNode.isArray()) {
            throw new MalformedRuleException(path + "." + RULES, "`rules` must be array, got " + describe(rulesNode));
        }

        CompositeMode mode = CompositeMode.SINGLE;
        if (node.has(MODE)) {
            JsonNode modeNode = node.get(MODE);
            String modeValue = modeNode.isTextual() ? modeNode.textValue() : modeNode.toString();
            if (!modeNode.isTextual()) {
                throw new InvalidModeException(path + "." + MODE, modeValue);
            }
            mode = CompositeMode.fromJson(modeValue)
                    .orElseThrow(() -> new InvalidModeException(path + "." + MODE, modeValue));
        }

        int count = rulesNode.size();
        if (!mode.acceptsChildCount(count)) {
            String expected = mode == CompositeMode.SINGLE ? "exactly 1" : "at least " + mode.minChildren();
            throw new InvalidRuleCountException(path + "." + RULES, expected, count);
        }

        List<GcRule> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            children.add(parseNode(rulesNode.get(i), path + "." + RULES + "[" + i + "]"));
        }
        return new GcRule.Composite(mode, children);
    }

    private GcRule parseLeaf(JsonNode node, String path) {
        rejectUnknownKeys(node, LEAF_KEYS, path);

        boolean hasAge = node.has(MAX_AGE);
        boolean hasVersion = node.has(MAX_VERSION);
        if (hasAge && hasVersion) {
            throw new ConflictingLeafFieldsException(path);
        }
        if (!hasAge && !hasVersion) {
            throw new MissingLeafFieldException(path);
        }
        return hasAge
                ? parseMaxAge(node.get(MAX_AGE), path + "." + MAX_AGE)
                : parseMaxVersion(node.get(MAX_VERSION), path + "." + MAX_VERSION);
    }

    private GcRule parseMaxAge(JsonNode value, String path) {
        if (!value.isTextual()) {
            throw new InvalidDurationException(path, value.toString());
        }
        Duration duration = DurationFormat.parse(value.textValue())
                .orElseThrow(() -> new InvalidDurationException(path, value.textValue()));
        return new GcRule.MaxAge(duration);
    }

    private GcRule parseMaxVersion(JsonNode value, String path) {
        if (!value.isNumber()) {
            throw new InvalidVersionCountException(path, value.toString());
        }
        if (!Double.isFinite(value.doubleValue())) {
            throw new InvalidVersionCountException(path, value.toString());
        }
        int versions;
        try {
            // Integral doubles such as 10.0 are accepted
            versions = value.decimalValue().intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidVersionCountException(path, value.toString());
        }
        if (versions < 1) {
            throw new InvalidVersionCountException(path, value.toString());
        }
        return new GcRule.MaxVersions(versions);
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> allowed, String path) {
        Iterator<String> fieldNames = node.fieldNames();
        while (fieldNames.hasNext()) {
            String key = fieldNames.next();
            if (!allowed.contains(key)) {
                throw new UnknownKeyException(path, key);
            }
        }
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
