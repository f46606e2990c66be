package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A single operation inside a function.
 * <p>
 * Besides {@code id} and {@code op}, a node carries an open, ordered property bag whose
 * values are literals or string references to other ids. Control annotations such as
 * {@code exec_in} and {@code next} live in the same bag but are never operation arguments.
 */
public final class Node {

    /** Keys that annotate control flow or tooling and are never operation arguments. */
    public static final Set<String> RESERVED_KEYS = Set.of(
            "id", "op", "metadata", "comment", "const_data",
            "exec_in", "exec_out", "exec_true", "exec_false", "exec_body", "exec_completed",
            "next", "_next");

    private final String id;
    private final String op;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    @JsonCreator
    public Node(@JsonProperty("id") String id, @JsonProperty("op") String op) {
        this.id = Objects.requireNonNull(id, "node id");
        this.op = Objects.requireNonNull(op, "node op");
    }

    public static Node of(String id, String op) {
        return new Node(id, op);
    }

    /**
     * Adds a property and returns this node, for fluent construction.
     *
     * @param key   The property key.
     * @param value The literal or reference.
     * @return This node.
     */
    public Node with(String key, Object value) {
        set(key, value);
        return this;
    }

    @JsonAnySetter
    public void set(String key, Object value) {
        properties.put(key, value);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("op")
    public String getOp() {
        return op;
    }

    public Object get(String key) {
        return properties.get(key);
    }

    public boolean has(String key) {
        return properties.get(key) != null;
    }

    public String getString(String key) {
        Object value = properties.get(key);
        return value instanceof String s ? s : null;
    }

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public static boolean isReservedKey(String key) {
        return RESERVED_KEYS.contains(key) || key.startsWith("exec_");
    }

    @Override
    public String toString() {
        return id + "(" + op + ")";
    }
}
