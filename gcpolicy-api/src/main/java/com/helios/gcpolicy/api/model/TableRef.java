/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.api.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fully qualified reference to a column-family table:
 * {@code projects/{project}/instances/{instance}/tables/{table}}.
 */
public record TableRef(String project, String instance, String table) {

    private static final String PROJECT_ID = "[a-z][a-z0-9-]{4,28}[a-z0-9]";
    private static final String INSTANCE_ID = "[a-z][a-z0-9-]{4,31}[a-z0-9]";
    private static final String TABLE_ID = "[_a-zA-Z0-9][-_.a-zA-Z0-9]{0,49}";

    private static final Pattern PROJECT_PATTERN = Pattern.compile(PROJECT_ID);
    private static final Pattern INSTANCE_PATTERN = Pattern.compile(INSTANCE_ID);
    private static final Pattern TABLE_PATTERN = Pattern.compile(TABLE_ID);
    private static final Pattern NAME_PATTERN = Pattern.compile(
            "projects/(" + PROJECT_ID + ")/instances/(" + INSTANCE_ID + ")/tables/(" + TABLE_ID + ")");
    private static final Pattern COLUMN_FAMILY_PATTERN = Pattern.compile("[_a-zA-Z0-9][-_.a-zA-Z0-9]{0,63}");

    public TableRef {
        requireMatch(project, PROJECT_PATTERN, "project");
        requireMatch(instance, INSTANCE_PATTERN, "instance");
        requireMatch(table, TABLE_PATTERN, "table");
    }

    /**
     * Parses a full table resource name.
     *
     * @throws IllegalArgumentException if the name is not of the form
     *                                  {@code projects/{project}/instances/{instance}/tables/{table}}
     */
    public static TableRef parse(String name) {
        Objects.requireNonNull(name, "name");
        Matcher matcher = NAME_PATTERN.matcher(name);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid table name (" + name + "), must match `" + NAME_PATTERN.pattern() + "`");
        }
        return new TableRef(matcher.group(1), matcher.group(2), matcher.group(3));
    }

    /**
     * Validates a column family id and returns it unchanged.
     */
    public static String checkColumnFamilyId(String columnFamilyId) {
        requireMatch(columnFamilyId, COLUMN_FAMILY_PATTERN, "column_family_id");
        return columnFamilyId;
    }

    public String name() {
        return "projects/" + project + "/instances/" + instance + "/tables/" + table;
    }

    @Override
    public String toString() {
        return name();
    }

    private static void requireMatch(String value, Pattern pattern, String argument) {
        if (value == null || !pattern.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Invalid argument " + argument + " (" + value + "), must match `" + pattern.pattern() + "`");
        }
    }
}
