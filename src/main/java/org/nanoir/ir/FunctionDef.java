package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * A flat list of nodes forming either the host orchestration or a shader stage.
 *
 * @param id            The function id.
 * @param type          {@code cpu} or {@code shader}.
 * @param inputs        Typed input ports, visible as variables in the body.
 * @param outputs       Typed output ports.
 * @param localVars     Mutable function-local variables.
 * @param nodes         The nodes in declaration order.
 * @param edges         Authored edges, or empty when they are to be reconstructed.
 * @param workgroupSize Optional compute workgroup size {@code [x, y, z]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionDef(
        @JsonProperty("id") String id,
        @JsonProperty("type") FunctionType type,
        @JsonProperty("inputs") List<PortDef> inputs,
        @JsonProperty("outputs") List<PortDef> outputs,
        @JsonProperty("localVars") List<VariableDef> localVars,
        @JsonProperty("nodes") List<Node> nodes,
        @JsonProperty("edges") List<Edge> edges,
        @JsonProperty("workgroupSize") List<Integer> workgroupSize
) {
    public FunctionDef {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        localVars = localVars == null ? List.of() : List.copyOf(localVars);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        workgroupSize = workgroupSize == null ? List.of() : List.copyOf(workgroupSize);
    }

    public static FunctionDef cpu(String id, List<Node> nodes) {
        return new FunctionDef(id, FunctionType.CPU, null, null, null, nodes, null, null);
    }

    public static FunctionDef shader(String id, List<Node> nodes) {
        return new FunctionDef(id, FunctionType.SHADER, null, null, null, nodes, null, null);
    }

    public FunctionDef withInputs(List<PortDef> value) {
        return new FunctionDef(id, type, value, outputs, localVars, nodes, edges, workgroupSize);
    }

    public FunctionDef withLocalVars(List<VariableDef> value) {
        return new FunctionDef(id, type, inputs, outputs, value, nodes, edges, workgroupSize);
    }

    public FunctionDef withEdges(List<Edge> value) {
        return new FunctionDef(id, type, inputs, outputs, localVars, nodes, value, workgroupSize);
    }

    public FunctionDef withWorkgroupSize(List<Integer> value) {
        return new FunctionDef(id, type, inputs, outputs, localVars, nodes, edges, value);
    }

    public Optional<Node> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId().equals(nodeId)).findFirst();
    }

    public boolean hasLocalVar(String varId) {
        return localVars.stream().anyMatch(v -> v.id().equals(varId));
    }

    public boolean hasInput(String inputId) {
        return inputs.stream().anyMatch(p -> p.id().equals(inputId));
    }
}
