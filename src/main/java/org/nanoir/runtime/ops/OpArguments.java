package org.nanoir.runtime.ops;

import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.InterpreterException;
import org.nanoir.runtime.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The resolved arguments of one node invocation, with typed accessors that fail with a
 * message naming the node.
 */
public final class OpArguments {

    private final String nodeId;
    private final BuiltinOp op;
    private final Map<String, Object> values;

    public OpArguments(String nodeId, BuiltinOp op, Map<String, Object> values) {
        this.nodeId = nodeId;
        this.op = op;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Creates arguments for a direct handler call, naming the node after the op.
     *
     * @param op     The operation.
     * @param values Argument values in runtime representation.
     * @return The arguments.
     */
    public static OpArguments of(BuiltinOp op, Map<String, Object> values) {
        return new OpArguments(op.id(), op, values);
    }

    public String nodeId() {
        return nodeId;
    }

    public BuiltinOp op() {
        return op;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Object require(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw error("missing argument '" + key + "'");
        }
        return value;
    }

    public double getDouble(String key) {
        return Values.toDouble(require(key), describe(key));
    }

    public double getDouble(String key, double defaultValue) {
        return has(key) ? getDouble(key) : defaultValue;
    }

    public int getInt(String key) {
        return Values.toInt(require(key), describe(key));
    }

    public int getInt(String key, int defaultValue) {
        return has(key) ? getInt(key) : defaultValue;
    }

    public double[] getVector(String key) {
        return Values.toVector(require(key), describe(key));
    }

    public String getString(String key) {
        Object value = require(key);
        if (!(value instanceof String s)) {
            throw error("argument '" + key + "' must be a string, but got " + Values.describe(value));
        }
        return s;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Creates a runtime error that names this node and operation.
     *
     * @param message The problem.
     * @return The exception, to be thrown by the caller.
     */
    public InterpreterException error(String message) {
        return new InterpreterException("Node '" + nodeId + "' (" + op.id() + "): " + message);
    }

    private String describe(String key) {
        return "'" + key + "' of node '" + nodeId + "'";
    }

    @Override
    public String toString() {
        return nodeId + "(" + op.id() + ")" + values.keySet();
    }
}
