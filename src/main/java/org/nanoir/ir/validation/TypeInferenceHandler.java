package org.nanoir.ir.validation;

import org.nanoir.ir.Edge;
import org.nanoir.ir.EdgeType;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.ir.schema.IrValueType;
import org.nanoir.ir.schema.OpArg;
import org.nanoir.ir.schema.OpDef;
import org.nanoir.ir.schema.OpSchemaRegistry;
import org.nanoir.ir.schema.OpSignature;
import org.nanoir.ir.schema.OpSignatures;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Infers the result shape of every node from the {@link OpSignatures} overloads and reports
 * arguments whose shape no overload accepts.
 * <p>
 * Argument shapes come from data edges, literals and references to other nodes, function
 * inputs, local variables or document inputs. Anything that cannot be typed statically
 * (builtins, resources, untyped operations) is {@link IrValueType#ANY} and matches every
 * overload. Integers and floats are interchangeable.
 */
public class TypeInferenceHandler implements IValidationHandler {

    private static final String SWIZZLE_COMPONENTS = "xyzwrgba";

    private final Collection<String> implicitTargets;

    public TypeInferenceHandler(Collection<String> implicitTargets) {
        this.implicitTargets = List.copyOf(implicitTargets);
    }

    @Override
    public void validate(IRDocument document, DiagnosticsEngine diagnostics) {
        for (int f = 0; f < document.functions().size(); f++) {
            FunctionDef func = document.functions().get(f);
            Inference inference = new Inference(document, func, f, diagnostics);
            for (Node node : func.nodes()) {
                inference.resolve(node.getId());
            }
        }
    }

    /**
     * Infers the result shape of every node of a function without reporting anything.
     *
     * @param document The owning document.
     * @param func     The function.
     * @return Node id to inferred shape, in node order.
     */
    public Map<String, IrValueType> inferTypes(IRDocument document, FunctionDef func) {
        Inference inference = new Inference(document, func, document.functions().indexOf(func), null);
        Map<String, IrValueType> types = new LinkedHashMap<>();
        for (Node node : func.nodes()) {
            types.put(node.getId(), inference.resolve(node.getId()));
        }
        return types;
    }

    private final class Inference {

        private final IRDocument document;
        private final FunctionDef func;
        private final int functionIndex;
        private final DiagnosticsEngine diagnostics;
        private final ScopeResolver scope;
        private final Map<String, IrValueType> cache = new HashMap<>();

        Inference(IRDocument document, FunctionDef func, int functionIndex, DiagnosticsEngine diagnostics) {
            this.document = document;
            this.func = func;
            this.functionIndex = functionIndex;
            this.diagnostics = diagnostics;
            this.scope = new ScopeResolver(document, func, implicitTargets);
        }

        IrValueType resolve(String nodeId) {
            IrValueType cached = cache.get(nodeId);
            if (cached != null) return cached;
            // Placeholder while resolving, so cycles terminate.
            cache.put(nodeId, IrValueType.ANY);

            int index = indexOf(nodeId);
            if (index < 0) return IrValueType.ANY;
            Node node = func.nodes().get(index);
            Optional<BuiltinOp> op = BuiltinOp.fromId(node.getOp());
            if (op.isEmpty()) return IrValueType.ANY;

            IrValueType result;
            if (op.get() == BuiltinOp.LITERAL) {
                result = literalType(node.get("val"));
            } else if (OpSignatures.has(op.get())) {
                result = match(node, index, op.get(), argumentTypes(node, op.get()));
            } else {
                result = IrValueType.ANY;
            }
            cache.put(nodeId, result);
            return result;
        }

        private Map<String, IrValueType> argumentTypes(Node node, BuiltinOp op) {
            Map<String, IrValueType> types = new HashMap<>();
            for (Edge edge : func.edges()) {
                if (edge.type() == EdgeType.DATA && node.getId().equals(edge.to()) && edge.from() != null) {
                    types.put(edge.portIn(), resolve(edge.from()));
                }
            }
            OpDef def = OpSchemaRegistry.get(op);
            for (OpSignature signature : OpSignatures.get(op)) {
                for (String arg : signature.inputs().keySet()) {
                    if (types.containsKey(arg) || !node.has(arg)) continue;
                    boolean isReference = def.arg(arg).map(OpArg::refable).orElse(true);
                    types.put(arg, valueType(node.get(arg), isReference));
                }
            }
            return types;
        }

        private IrValueType valueType(Object value, boolean isReference) {
            if (value instanceof String ref) {
                if (!isReference) return IrValueType.STRING;
                return scope.resolve(ref).map(kind -> switch (kind) {
                    case NODE -> resolve(ref);
                    case LOCAL_VARIABLE -> declaredType(func.localVars().stream()
                            .filter(v -> v.id().equals(ref)).map(VariableDef::type).findFirst().orElse(null));
                    case FUNCTION_INPUT -> declaredType(func.inputs().stream()
                            .filter(p -> p.id().equals(ref)).map(PortDef::type).findFirst().orElse(null));
                    case DOCUMENT_INPUT -> declaredType(document.findInput(ref).map(InputDef::type).orElse(null));
                    default -> IrValueType.ANY;
                }).orElse(IrValueType.ANY);
            }
            return literalType(value);
        }

        private IrValueType declaredType(String typeName) {
            if (typeName != null && document.findStruct(typeName).isPresent()) {
                return IrValueType.STRUCT;
            }
            return IrValueType.fromTypeName(typeName);
        }

        private IrValueType match(Node node, int index, BuiltinOp op, Map<String, IrValueType> provided) {
            List<OpSignature> signatures = OpSignatures.get(op);
            IrValueType result = null;
            for (OpSignature signature : signatures) {
                if (!accepts(signature, provided)) continue;
                IrValueType output = refine(node, op, signature.output(), provided);
                if (result == null) {
                    result = output;
                } else if (result != output) {
                    // Untyped arguments leave the overload open.
                    return IrValueType.ANY;
                }
            }
            if (result != null) return result;

            OpSignature reference = closest(signatures, provided);
            for (Map.Entry<String, IrValueType> arg : reference.inputs().entrySet()) {
                IrValueType actual = provided.get(arg.getKey());
                if (actual != null && !compatible(arg.getValue(), actual)) {
                    report(index, node, arg.getKey(), "Type Mismatch at '" + arg.getKey() + "': expected "
                            + arg.getValue().id() + ", got " + actual.id());
                }
            }
            return IrValueType.ANY;
        }

        private boolean accepts(OpSignature signature, Map<String, IrValueType> provided) {
            for (Map.Entry<String, IrValueType> arg : signature.inputs().entrySet()) {
                IrValueType actual = provided.get(arg.getKey());
                if (actual == null || !compatible(arg.getValue(), actual)) {
                    return false;
                }
            }
            return true;
        }

        /** The first overload accepting the most provided arguments. */
        private OpSignature closest(List<OpSignature> signatures, Map<String, IrValueType> provided) {
            OpSignature best = signatures.get(0);
            long bestScore = -1;
            for (OpSignature signature : signatures) {
                long score = signature.inputs().entrySet().stream()
                        .filter(arg -> provided.containsKey(arg.getKey()))
                        .filter(arg -> compatible(arg.getValue(), provided.get(arg.getKey())))
                        .count();
                if (score > bestScore) {
                    best = signature;
                    bestScore = score;
                }
            }
            return best;
        }

        private IrValueType refine(Node node, BuiltinOp op, IrValueType output, Map<String, IrValueType> provided) {
            switch (op) {
                case VAR_SET:
                    return provided.getOrDefault("val", IrValueType.ANY);
                case VEC_SWIZZLE: {
                    Object mask = node.get("channels");
                    if (!(mask instanceof String channels) || channels.isEmpty() || channels.length() > 4
                            || !channels.chars().allMatch(c -> SWIZZLE_COMPONENTS.indexOf(c) >= 0)) {
                        return IrValueType.ANY;
                    }
                    return channels.length() == 1 ? IrValueType.FLOAT : IrValueType.fromTypeName("float" + channels.length());
                }
                case MAT_IDENTITY: {
                    Object size = node.get("size");
                    return size instanceof Number n && n.intValue() == 3 ? IrValueType.FLOAT3X3 : output;
                }
                default:
                    return output;
            }
        }

        private void report(int index, Node node, String arg, String message) {
            if (diagnostics == null) return;
            diagnostics.reportError(List.of("functions", functionIndex, "nodes", index, arg), node.getId(), message);
        }

        private int indexOf(String nodeId) {
            for (int i = 0; i < func.nodes().size(); i++) {
                if (func.nodes().get(i).getId().equals(nodeId)) return i;
            }
            return -1;
        }
    }

    private static IrValueType literalType(Object value) {
        IrValueType type = IrValueType.detect(value);
        return type == IrValueType.UNKNOWN ? IrValueType.ANY : type;
    }

    private static boolean compatible(IrValueType expected, IrValueType actual) {
        if (expected.isWildcard() || actual.isWildcard() || expected == actual) return true;
        return (expected == IrValueType.FLOAT && actual == IrValueType.INT)
                || (expected == IrValueType.INT && actual == IrValueType.FLOAT);
    }
}
