package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A derived connection between two ids of a function graph.
 * <p>
 * Data edges run from a value producer (node, variable, input, resource or function)
 * to the consuming node's argument port. Execution edges run between executable nodes.
 *
 * @param from    The producing id.
 * @param portOut The output port, {@code val} for data edges.
 * @param to      The consuming node id.
 * @param portIn  The input port, possibly suffixed with {@code [i]} or {@code .key}.
 * @param type    The edge type.
 */
public record Edge(
        @JsonProperty("from") String from,
        @JsonProperty("portOut") String portOut,
        @JsonProperty("to") String to,
        @JsonProperty("portIn") String portIn,
        @JsonProperty("type") EdgeType type
) {

    public static final String PORT_VALUE = "val";
    public static final String PORT_EXEC_IN = "exec_in";
    public static final String PORT_EXEC_OUT = "exec_out";

    public static Edge data(String from, String to, String portIn) {
        return new Edge(from, PORT_VALUE, to, portIn, EdgeType.DATA);
    }

    public static Edge execution(String from, String portOut, String to) {
        return new Edge(from, portOut, to, PORT_EXEC_IN, EdgeType.EXECUTION);
    }

    /**
     * Returns the identity used to collapse duplicate edges.
     *
     * @return {@code from:portOut:to:portIn:type}
     */
    @JsonIgnore
    public String dedupKey() {
        return from + ":" + portOut + ":" + to + ":" + portIn + ":" + type.id();
    }

    @Override
    public String toString() {
        return String.format("%s.%s -[%s]-> %s.%s", from, portOut, type.id(), to, portIn);
    }
}
