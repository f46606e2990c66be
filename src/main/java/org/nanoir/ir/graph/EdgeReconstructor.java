package org.nanoir.ir.graph;

import org.nanoir.ir.Edge;
import org.nanoir.ir.EdgeType;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.schema.OpArg;
import org.nanoir.ir.schema.OpDef;
import org.nanoir.ir.schema.OpSchemaRegistry;
import org.nanoir.ir.schema.RefType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the explicit data and execution edges of a function from the references
 * its nodes hold in their properties.
 * <p>
 * The pass is driven by {@link OpSchemaRegistry}: declared reference slots produce data
 * edges (one per element for arrays, with an {@code [i]} port suffix), legacy exec slots
 * produce execution edges, and consolidated {@code args}/{@code values} containers are
 * walked recursively. Only executable nodes take part in execution edges.
 * The result is deduplicated, so reconstruction is idempotent.
 */
public final class EdgeReconstructor {

    private static final Logger LOG = LoggerFactory.getLogger(EdgeReconstructor.class);

    /** Outgoing control ports whose key doubles as the edge's {@code portOut}. */
    private static final List<String> NAMED_EXEC_PORTS = List.of("exec_true", "exec_false", "exec_body", "exec_completed");

    private static final List<String> NEXT_KEYS = List.of("next", "_next", Edge.PORT_EXEC_OUT);

    private final FunctionDef function;
    private final Map<String, Node> nodesById = new HashMap<>();
    private final Set<String> refIds = new HashSet<>();

    private EdgeReconstructor(FunctionDef function, IRDocument document) {
        this.function = function;
        for (Node node : function.nodes()) {
            nodesById.putIfAbsent(node.getId(), node);
        }
        refIds.addAll(nodesById.keySet());
        function.inputs().stream().map(PortDef::id).forEach(refIds::add);
        function.localVars().stream().map(VariableDef::id).forEach(refIds::add);
        if (document != null) {
            document.resources().stream().map(ResourceDef::id).forEach(refIds::add);
            document.inputs().stream().map(InputDef::id).forEach(refIds::add);
            document.functions().stream().map(FunctionDef::id).forEach(refIds::add);
        }
    }

    /**
     * Reconstructs the edges of a function without document-level scope.
     *
     * @param function The function.
     * @return The deduplicated edges.
     */
    public static List<Edge> reconstruct(FunctionDef function) {
        return reconstruct(function, null);
    }

    /**
     * Reconstructs the edges of a function.
     *
     * @param function The function.
     * @param document The owning document, used to resolve document-level ids; may be {@code null}.
     * @return The deduplicated edges, in discovery order.
     */
    public static List<Edge> reconstruct(FunctionDef function, IRDocument document) {
        List<Edge> edges = new EdgeReconstructor(function, document).run();
        if (LOG.isDebugEnabled()) {
            long exec = edges.stream().filter(e -> e.type() == EdgeType.EXECUTION).count();
            LOG.debug("Reconstructed {} edges ({} data, {} execution) for function '{}'",
                    edges.size(), edges.size() - exec, exec, function.id());
        }
        return edges;
    }

    private List<Edge> run() {
        Map<String, Edge> edges = new LinkedHashMap<>();

        for (Node node : function.nodes()) {
            Optional<OpDef> def = OpSchemaRegistry.find(node.getOp());
            if (def.isPresent()) {
                schemaEdges(node, def.get(), edges);
                if (node.has("args") || node.has("values") || def.get().dynamic()) {
                    containerEdges(node, def.get(), edges);
                }
            }
            if (isExecutable(node)) {
                outgoingExecEdges(node, edges);
            }
        }

        // exec_in is a fallback: it only applies where nothing else already enters the node
        for (Node node : function.nodes()) {
            String source = node.getString(Edge.PORT_EXEC_IN);
            if (source == null || !nodesById.containsKey(source) || !isExecutable(nodesById.get(source))) {
                continue;
            }
            boolean hasIncoming = edges.values().stream().anyMatch(e -> e.type() == EdgeType.EXECUTION
                    && e.to().equals(node.getId()) && e.portIn().equals(Edge.PORT_EXEC_IN));
            if (!hasIncoming) {
                add(edges, Edge.execution(source, Edge.PORT_EXEC_OUT, node.getId()));
            }
        }

        return List.copyOf(edges.values());
    }

    private void schemaEdges(Node node, OpDef def, Map<String, Edge> edges) {
        Object container = node.get("args");
        for (OpArg arg : def.args().values()) {
            if (!arg.isReferenceSlot()) continue;
            Object value = node.get(arg.name());
            if (value == null && container instanceof Map<?, ?> map) {
                value = map.get(arg.name());
            }
            if (value == null) continue;

            if (arg.refType() == RefType.EXEC) {
                if (value instanceof String target && nodesById.containsKey(target) && isExecutable(node)) {
                    add(edges, Edge.execution(node.getId(), arg.execPort(), target));
                }
            } else if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    dataEdge(list.get(i), node, arg.name() + "[" + i + "]", edges);
                }
            } else {
                dataEdge(value, node, arg.name(), edges);
            }
        }
    }

    private void containerEdges(Node node, OpDef def, Map<String, Edge> edges) {
        for (Map.Entry<String, Object> entry : node.getProperties().entrySet()) {
            String key = entry.getKey();
            if (Node.isReservedKey(key)) continue;
            if (def.declares(key) && !key.equals("args") && !key.equals("values")) continue;
            walk(entry.getValue(), key, node, edges);
        }
    }

    private void walk(Object value, String path, Node node, Map<String, Edge> edges) {
        if (value instanceof String) {
            dataEdge(value, node, path, edges);
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                walk(list.get(i), path + "[" + i + "]", node, edges);
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                walk(entry.getValue(), path + "." + entry.getKey(), node, edges);
            }
        }
    }

    private void dataEdge(Object value, Node node, String port, Map<String, Edge> edges) {
        if (value instanceof String ref && !ref.isEmpty() && refIds.contains(ref)) {
            add(edges, Edge.data(ref, node.getId(), port));
        }
    }

    private void outgoingExecEdges(Node node, Map<String, Edge> edges) {
        for (String key : NEXT_KEYS) {
            String target = node.getString(key);
            if (target != null && nodesById.containsKey(target)) {
                add(edges, Edge.execution(node.getId(), Edge.PORT_EXEC_OUT, target));
                break;
            }
        }
        for (String port : NAMED_EXEC_PORTS) {
            String target = node.getString(port);
            if (target != null && nodesById.containsKey(target)) {
                add(edges, Edge.execution(node.getId(), port, target));
            }
        }
    }

    private static boolean isExecutable(Node node) {
        return OpSchemaRegistry.isExecutable(node.getOp());
    }

    private static void add(Map<String, Edge> edges, Edge edge) {
        edges.putIfAbsent(edge.dedupKey(), edge);
    }
}
