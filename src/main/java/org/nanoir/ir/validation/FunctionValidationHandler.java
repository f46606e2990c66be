package org.nanoir.ir.validation;

import org.nanoir.ir.Builtin;
import org.nanoir.ir.Edge;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.FunctionType;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.Node;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.ResourceType;
import org.nanoir.ir.TextureFormat;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.ir.schema.IrValueType;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the nodes of every function: unique ids, authored edges, argument schemas, and
 * the semantic rules that depend on the document (builtin availability, constants,
 * resource addressing, atomics, swizzle masks, variable targets).
 */
public class FunctionValidationHandler implements IValidationHandler {

    private static final String SWIZZLE_COMPONENTS = "xyzwrgba";

    private final Collection<String> implicitTargets;

    public FunctionValidationHandler(Collection<String> implicitTargets) {
        this.implicitTargets = List.copyOf(implicitTargets);
    }

    @Override
    public void validate(IRDocument document, DiagnosticsEngine diagnostics) {
        for (int f = 0; f < document.functions().size(); f++) {
            validateFunction(document, document.functions().get(f), f, diagnostics);
        }
    }

    private void validateFunction(IRDocument document, FunctionDef func, int f, DiagnosticsEngine diagnostics) {
        ScopeResolver scope = new ScopeResolver(document, func, implicitTargets);
        SchemaVerifier verifier = new SchemaVerifier(document, func, scope);

        Set<String> seen = new HashSet<>();
        for (int n = 0; n < func.nodes().size(); n++) {
            Node node = func.nodes().get(n);
            List<Object> nodePath = List.of("functions", f, "nodes", n);
            if (!seen.add(node.getId())) {
                diagnostics.reportError(SchemaVerifier.path(nodePath, "id"), node.getId(),
                        "Duplicate node id '" + node.getId() + "' in function '" + func.id() + "'");
            }
            verifier.verify(node, nodePath, diagnostics);
            validateSemantics(document, func, scope, node, nodePath, diagnostics);
        }

        for (int e = 0; e < func.edges().size(); e++) {
            Edge edge = func.edges().get(e);
            if (edge.from() == null || !scope.exists(edge.from())) {
                diagnostics.reportError(List.of("functions", f, "edges", e, "from"), null,
                        "Edge source '" + edge.from() + "' not found");
            }
            if (edge.to() == null || func.findNode(edge.to()).isEmpty()) {
                diagnostics.reportError(List.of("functions", f, "edges", e, "to"), null,
                        "Edge target '" + edge.to() + "' not found");
            }
        }
    }

    private void validateSemantics(IRDocument document, FunctionDef func, ScopeResolver scope, Node node,
                                   List<Object> nodePath, DiagnosticsEngine diagnostics) {
        Optional<BuiltinOp> op = BuiltinOp.fromId(node.getOp());
        if (op.isEmpty()) return;

        switch (op.get()) {
            case BUILTIN_GET -> checkBuiltinGet(func, node, nodePath, diagnostics);
            case CONST_GET -> checkConstant(node, nodePath, diagnostics);
            case VEC_SWIZZLE -> checkSwizzle(func, node, nodePath, diagnostics);
            case VAR_SET -> checkVariableTarget(func, node, nodePath, diagnostics);
            case LOOP_INDEX -> checkLoopReference(func, node, nodePath, diagnostics);
            default -> {
            }
        }
        if (addressesResource(op.get())) {
            checkResourceAccess(document, scope, op.get(), node, nodePath, diagnostics);
        }
    }

    private void checkBuiltinGet(FunctionDef func, Node node, List<Object> path, DiagnosticsEngine diagnostics) {
        String name = node.getString("name");
        if (name == null) return;
        Optional<Builtin> builtin = Builtin.fromWireName(name);
        if (builtin.isEmpty()) {
            diagnostics.reportError(SchemaVerifier.path(path, "name"), node.getId(), "Unknown builtin '" + name + "'");
        } else if (builtin.get().isGpuOnly() && func.type() == FunctionType.CPU) {
            diagnostics.reportError(SchemaVerifier.path(path, "name"), node.getId(),
                    "GPU Built-in '" + name + "' is not available in CPU context");
        }
    }

    private void checkConstant(Node node, List<Object> path, DiagnosticsEngine diagnostics) {
        String name = node.getString("name");
        if (name == null || name.isEmpty()) return;
        if (name.startsWith("TextureFormat.")) {
            String key = name.substring("TextureFormat.".length());
            if (TextureFormat.fromConstantKey(key).isEmpty()) {
                diagnostics.reportError(SchemaVerifier.path(path, "name"), node.getId(),
                        "Invalid TextureFormat constant '" + name + "'");
            }
        } else if (!name.contains(".")) {
            diagnostics.reportError(SchemaVerifier.path(path, "name"), node.getId(), "Invalid constant name '" + name + "'");
        }
    }

    private void checkSwizzle(FunctionDef func, Node node, List<Object> path, DiagnosticsEngine diagnostics) {
        Object mask = node.get("channels");
        List<Object> maskPath = SchemaVerifier.path(path, "channels");
        if (!(mask instanceof String channels)) {
            diagnostics.reportError(maskPath, node.getId(), "Swizzle mask must be a string literal");
            return;
        }
        if (channels.isEmpty() || channels.length() > 4) {
            diagnostics.reportError(maskPath, node.getId(), "Invalid swizzle mask length '" + channels + "'");
        }
        int width = vectorWidth(func, node.get("vec"));
        for (char c : channels.toCharArray()) {
            int idx = SWIZZLE_COMPONENTS.indexOf(c);
            if (idx < 0) {
                diagnostics.reportError(maskPath, node.getId(), "Invalid swizzle component '" + c + "'");
            } else if (width > 0 && idx % 4 >= width) {
                diagnostics.reportError(maskPath, node.getId(),
                        "Swizzle component '" + c + "' out of bounds for float" + width);
            }
        }
    }

    /** Width of a literal vector or of a vector constructor node, or 0 when unknown. */
    private int vectorWidth(FunctionDef func, Object vec) {
        if (vec instanceof String ref) {
            return func.findNode(ref).map(n -> switch (n.getOp()) {
                case "float2", "vec2", "int2" -> 2;
                case "float3", "vec3", "int3" -> 3;
                case "float4", "vec4", "int4" -> 4;
                default -> 0;
            }).orElse(0);
        }
        IrValueType type = IrValueType.detect(vec);
        return switch (type) {
            case FLOAT2 -> 2;
            case FLOAT3 -> 3;
            case FLOAT4 -> 4;
            default -> 0;
        };
    }

    private void checkVariableTarget(FunctionDef func, Node node, List<Object> path, DiagnosticsEngine diagnostics) {
        String var = node.getString("var");
        if (var != null && !func.hasLocalVar(var) && !func.hasInput(var)) {
            diagnostics.reportError(SchemaVerifier.path(path, "var"), node.getId(),
                    "Variable '" + var + "' is not declared in function '" + func.id() + "'");
        }
    }

    private void checkLoopReference(FunctionDef func, Node node, List<Object> path, DiagnosticsEngine diagnostics) {
        String loop = node.getString("loop");
        if (loop == null) return;
        boolean isLoop = func.nodes().stream().anyMatch(n -> BuiltinOp.FLOW_LOOP.id().equals(n.getOp())
                && (loop.equals(n.getId()) || loop.equals(n.getString("tag"))));
        if (!isLoop) {
            diagnostics.reportError(SchemaVerifier.path(path, "loop"), node.getId(),
                    "loop_index references '" + loop + "', which is not a flow_loop node or tag");
        }
    }

    private static boolean addressesResource(BuiltinOp op) {
        return op.id().startsWith("buffer_") || op.id().startsWith("texture_")
                || op == BuiltinOp.CMD_RESIZE_RESOURCE || op.category() == BuiltinOp.Category.ATOMIC;
    }

    private void checkResourceAccess(IRDocument document, ScopeResolver scope, BuiltinOp op, Node node,
                                     List<Object> path, DiagnosticsEngine diagnostics) {
        String key = firstPresent(node, "buffer", "tex", "resource", "counter");
        if (key == null) return;
        String resId = node.getString(key);
        if (!scope.isResource(resId)) {
            diagnostics.reportError(SchemaVerifier.path(path, key), node.getId(), "Referenced resource '" + resId + "' not found");
            return;
        }
        Optional<ResourceDef> resource = document.findResource(resId);
        if (resource.isEmpty()) return;
        ResourceDef res = resource.get();

        if (op.category() == BuiltinOp.Category.ATOMIC && res.type() != ResourceType.ATOMIC_COUNTER) {
            diagnostics.reportError(SchemaVerifier.path(path, key), node.getId(),
                    "Operation '" + op.id() + "' requires an atomic_counter resource, but '" + resId + "' is a "
                            + (res.type() == null ? "resource of unknown type" : res.type().name().toLowerCase()));
        }

        if (node.get("index") instanceof Number index) {
            double value = index.doubleValue();
            if (value < 0) {
                diagnostics.reportError(SchemaVerifier.path(path, "index"), node.getId(),
                        "Invalid Negative Index: " + formatNumber(value));
            }
            int size = res.size().fixedScalar();
            if (size >= 0 && value >= size) {
                diagnostics.reportError(SchemaVerifier.path(path, "index"), node.getId(),
                        "Static OOB Access: Index " + formatNumber(value) + " >= Size " + size);
            }
        }

        if (op == BuiltinOp.BUFFER_STORE && res.dataType() != null && node.get("value") != null
                && !(node.get("value") instanceof String)) {
            checkStoredLiteral(res, node, path, diagnostics);
        }
    }

    private void checkStoredLiteral(ResourceDef res, Node node, List<Object> path, DiagnosticsEngine diagnostics) {
        IrValueType actual = IrValueType.detect(node.get("value"));
        String expected = res.dataType();
        boolean scalarExpected = "float".equals(expected) || "int".equals(expected);
        boolean compatible = switch (actual) {
            case FLOAT, INT -> scalarExpected;
            case BOOL -> "bool".equals(expected);
            case FLOAT2, FLOAT3, FLOAT4, FLOAT3X3, FLOAT4X4 -> actual.id().equals(expected);
            default -> true;
        };
        boolean known = scalarExpected || DataTypes.PRIMITIVES.contains(expected);
        if (known && !compatible) {
            diagnostics.reportError(SchemaVerifier.path(path, "value"), node.getId(),
                    "Type Mismatch in buffer_store: Buffer '" + res.id() + "' expects '" + expected + "', got '" + actual.id() + "'");
        }
    }

    private static String firstPresent(Node node, String... keys) {
        for (String key : keys) {
            if (node.getString(key) != null) return key;
        }
        return null;
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
