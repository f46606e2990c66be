package org.nanoir.runtime;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * One function invocation: its variables, active loop indices and memoised node results.
 * A frame is owned by the invocation that pushed it.
 */
public class StackFrame {

    private final String name;
    private final Map<String, Object> vars = new HashMap<>();
    private final Map<String, Integer> loopIndices = new HashMap<>();
    private final Map<String, Object> nodeResults = new HashMap<>();
    private final Set<String> pulledNodes = new HashSet<>();
    private final Set<String> evaluating = new HashSet<>();

    public StackFrame(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getVars() {
        return vars;
    }

    public Map<String, Integer> getLoopIndices() {
        return loopIndices;
    }

    public Map<String, Object> getNodeResults() {
        return nodeResults;
    }

    /**
     * Executable nodes that already ran because a consumer pulled their value before
     * control flow reached them.
     *
     * @return The mutable set of node ids.
     */
    public Set<String> getPulledNodes() {
        return pulledNodes;
    }

    /**
     * Nodes whose value is currently being computed, for cycle detection.
     *
     * @return The mutable set of node ids.
     */
    public Set<String> getEvaluating() {
        return evaluating;
    }

    @Override
    public String toString() {
        return "StackFrame{" + name + ", vars=" + vars.keySet() + "}";
    }
}
