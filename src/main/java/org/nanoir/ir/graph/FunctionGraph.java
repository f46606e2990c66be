package org.nanoir.ir.graph;

import org.nanoir.ir.Builtin;
import org.nanoir.ir.Edge;
import org.nanoir.ir.EdgeType;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.schema.OpArg;
import org.nanoir.ir.schema.OpDef;
import org.nanoir.ir.schema.OpSchemaRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An index-resolved view of one function, built once and reused for every execution.
 * <p>
 * Nodes are addressed by their position in the function. Execution successors are kept
 * per node and output port, and every node's properties are pre-resolved into argument
 * templates in which references are either a {@link NodeRef} or a {@link SymbolRef}, so no
 * string lookup against the node list happens while interpreting.
 */
public final class FunctionGraph {

    /** A reference to another node of the same function, by index. */
    public record NodeRef(int index) {
    }

    /** A reference to a variable, function input, document input or builtin, by name. */
    public record SymbolRef(String name) {
    }

    private static final Set<String> RAW_KEYS = Set.of("type", "dataType");
    private static final int[] NONE = new int[0];

    private final FunctionDef function;
    private final List<Node> nodes;
    private final Map<String, Integer> indexById = new HashMap<>();
    private final List<Edge> edges;
    private final boolean[] executable;
    private final List<Map<String, int[]>> execSuccessors;
    private final List<Map<String, Object>> templates;
    private final List<Map<String, Integer>> authoredSources;
    private final int[] entryNodes;

    private FunctionGraph(FunctionDef function, IRDocument document) {
        this.function = function;
        this.nodes = function.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            indexById.putIfAbsent(nodes.get(i).getId(), i);
        }
        this.edges = function.edges().isEmpty() ? EdgeReconstructor.reconstruct(function, document) : function.edges();

        int n = nodes.size();
        this.executable = new boolean[n];
        for (int i = 0; i < n; i++) {
            executable[i] = OpSchemaRegistry.isExecutable(nodes.get(i).getOp());
        }

        this.execSuccessors = new ArrayList<>(n);
        this.authoredSources = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            execSuccessors.add(new HashMap<>());
            authoredSources.add(new HashMap<>());
        }
        boolean[] hasIncomingExec = new boolean[n];
        for (Edge edge : edges) {
            Integer from = indexById.get(edge.from());
            Integer to = indexById.get(edge.to());
            if (to == null) continue;
            if (edge.type() == EdgeType.EXECUTION) {
                hasIncomingExec[to] = true;
                if (from != null) {
                    execSuccessors.get(from).merge(edge.portOut(), new int[]{to}, FunctionGraph::concat);
                }
            } else if (from != null && isPlainPort(edge.portIn()) && !nodes.get(to).has(edge.portIn())) {
                authoredSources.get(to).put(edge.portIn(), from);
            }
        }

        List<Integer> entries = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (executable[i] && !hasIncomingExec[i]) {
                entries.add(i);
            }
        }
        this.entryNodes = entries.stream().mapToInt(Integer::intValue).toArray();

        Set<String> symbols = new HashSet<>();
        function.localVars().stream().map(VariableDef::id).forEach(symbols::add);
        function.inputs().stream().map(PortDef::id).forEach(symbols::add);
        if (document != null) {
            document.inputs().stream().map(InputDef::id).forEach(symbols::add);
        }
        Arrays.stream(Builtin.values()).map(Builtin::wireName).forEach(symbols::add);

        this.templates = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            templates.add(buildTemplate(i, symbols));
        }
    }

    /**
     * Builds the graph of a function, reconstructing its edges if none are authored.
     *
     * @param function The function.
     * @param document The owning document; may be {@code null}.
     * @return The graph.
     */
    public static FunctionGraph build(FunctionDef function, IRDocument document) {
        return new FunctionGraph(function, document);
    }

    private Map<String, Object> buildTemplate(int index, Set<String> symbols) {
        Node node = nodes.get(index);
        Optional<OpDef> def = OpSchemaRegistry.find(node.getOp());
        Map<String, Object> template = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : node.getProperties().entrySet()) {
            String key = entry.getKey();
            if (Node.isReservedKey(key)) continue;
            Optional<OpArg> arg = def.flatMap(d -> d.arg(key));
            if (RAW_KEYS.contains(key) || arg.map(OpArg::passesStringThrough).orElse(false)) {
                template.put(key, entry.getValue());
            } else {
                template.put(key, resolve(entry.getValue(), node.getId(), symbols));
            }
        }
        return Collections.unmodifiableMap(template);
    }

    private Object resolve(Object value, String selfId, Set<String> symbols) {
        if (value instanceof String s) {
            Integer target = indexById.get(s);
            if (target != null && !s.equals(selfId)) {
                return new NodeRef(target);
            }
            return symbols.contains(s) ? new SymbolRef(s) : s;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(resolve(item, selfId, symbols));
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), resolve(e.getValue(), selfId, symbols));
            }
            return out;
        }
        return value;
    }

    private static boolean isPlainPort(String port) {
        return port.indexOf('[') < 0 && port.indexOf('.') < 0;
    }

    private static int[] concat(int[] a, int[] b) {
        int[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    public FunctionDef function() {
        return function;
    }

    public int size() {
        return nodes.size();
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public int indexOf(String nodeId) {
        return indexById.getOrDefault(nodeId, -1);
    }

    public boolean isExecutable(int index) {
        return executable[index];
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * Returns the executable nodes without an incoming execution edge, in declaration order.
     *
     * @return The entry node indices.
     */
    public int[] entryNodes() {
        return entryNodes.clone();
    }

    /**
     * Returns the nodes reached from a node through one output port.
     *
     * @param index The source node.
     * @param port  The output port, e.g. {@code exec_out} or {@code exec_true}.
     * @return The target node indices; empty if none.
     */
    public int[] successors(int index, String port) {
        return execSuccessors.get(index).getOrDefault(port, NONE);
    }

    /**
     * Returns the argument template of a node: its non-reserved properties with references
     * resolved to {@link NodeRef} or {@link SymbolRef}; name slots keep their raw string.
     *
     * @param index The node.
     * @return The template.
     */
    public Map<String, Object> template(int index) {
        return templates.get(index);
    }

    /**
     * Returns ports fed only by an authored data edge, with no property on the node.
     *
     * @param index The consuming node.
     * @return Port name to source node index.
     */
    public Map<String, Integer> authoredSources(int index) {
        return authoredSources.get(index);
    }
}
