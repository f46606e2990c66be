package org.nanoir.ir.validation;

import org.nanoir.ir.Builtin;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.FunctionType;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.StructDef;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.ir.schema.IrValueType;
import org.nanoir.ir.schema.OpArg;
import org.nanoir.ir.schema.OpDef;
import org.nanoir.ir.schema.OpSchemaRegistry;
import org.nanoir.ir.validation.ScopeResolver.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the arguments of a node against its {@link OpDef}: required arguments are present,
 * references point at existing ids, literals have an accepted shape and no unknown keys
 * appear. Dynamic operations are checked against the struct or function they target.
 */
public class SchemaVerifier {

    /** Keys accepted on any node in addition to the reserved control keys. */
    static final Set<String> TOLERATED_KEYS = Set.of("type", "dataType");

    private static final Set<String> CONTAINER_KEYS = Set.of("args", "values");
    private static final Set<String> ARRAY_CONSTRUCT_KEYS = Set.of("values", "length", "fill");

    private final IRDocument document;
    private final FunctionDef function;
    private final ScopeResolver scope;

    public SchemaVerifier(IRDocument document, FunctionDef function, ScopeResolver scope) {
        this.document = document;
        this.function = function;
        this.scope = scope;
    }

    /**
     * Verifies one node, reporting every problem found.
     *
     * @param node        The node.
     * @param nodePath    The document path of the node.
     * @param diagnostics The sink for problems.
     */
    public void verify(Node node, List<Object> nodePath, DiagnosticsEngine diagnostics) {
        Optional<OpDef> found = OpSchemaRegistry.find(node.getOp());
        if (found.isEmpty()) {
            diagnostics.reportError(path(nodePath, "op"), node.getId(), "Unknown operation '" + node.getOp() + "'");
            return;
        }
        OpDef def = found.get();
        Reporter reporter = new Reporter(node, nodePath, diagnostics);

        for (OpArg arg : def.args().values()) {
            Object value = node.get(arg.name());
            if (value == null) {
                if (!arg.optional()) {
                    reporter.error(arg.name(), "Missing required argument '" + arg.name() + "'");
                }
                continue;
            }
            verifyArg(arg, value, reporter);
        }
        verifyAlternatives(node, reporter);

        if (def.dynamic()) {
            verifyDynamic(node, def, reporter);
        } else {
            for (String key : node.getProperties().keySet()) {
                if (Node.isReservedKey(key) || TOLERATED_KEYS.contains(key) || def.declares(key)) continue;
                reporter.error(key, "Unknown argument(s) '" + key + "' in operation '" + node.getOp() + "'.");
            }
        }
    }

    private void verifyAlternatives(Node node, Reporter reporter) {
        if (BuiltinOp.TEXTURE_SAMPLE.id().equals(node.getOp()) && !node.has("coords") && !node.has("uv")) {
            reporter.error("coords", "Missing required argument 'coords'");
        }
        if (BuiltinOp.CMD_DISPATCH.id().equals(node.getOp()) && !node.has("func") && !node.has("target")) {
            reporter.error("func", "Missing required argument 'func'");
        }
    }

    private void verifyArg(OpArg arg, Object value, Reporter reporter) {
        String key = arg.name();
        if (arg.requiredRef()) {
            if (value instanceof String ref) {
                checkRef(arg, ref, key, reporter);
            } else {
                reporter.error(key, "Argument '" + key + "' must be a reference (string), but got " + jsonKind(value));
            }
            return;
        }
        if (value instanceof String ref && arg.refable()) {
            checkRef(arg, ref, key, reporter);
            return;
        }
        if (!arg.literalTypes().isEmpty() && IrValueType.matches(IrValueType.detect(value), arg.literalTypes())) {
            return;
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                Object element = list.get(i);
                String port = key + "[" + i + "]";
                if (element instanceof String ref && arg.refable()) {
                    checkRef(arg, ref, port, reporter);
                } else {
                    checkLiteral(arg, element, port, true, reporter);
                }
            }
        } else {
            checkLiteral(arg, value, key, false, reporter);
        }
    }

    private void checkLiteral(OpArg arg, Object value, String port, boolean element, Reporter reporter) {
        if (arg.literalTypes().isEmpty()) {
            if (!arg.refable() && value instanceof String s) {
                reporter.error(arg.name(), "Argument '" + port + "' does not support references, but got string '" + s + "'");
            }
            return;
        }
        IrValueType type = IrValueType.detect(value);
        if (element && (type == IrValueType.FLOAT || type == IrValueType.INT)
                && arg.literalTypes().stream().anyMatch(t -> t.isVector() || t == IrValueType.FLOAT3X3 || t == IrValueType.FLOAT4X4)) {
            return;
        }
        if (IrValueType.matches(type, arg.literalTypes())) {
            return;
        }
        reporter.error(arg.name(), "Argument '" + port + "' has invalid literal type: expected one of ["
                + IrValueType.describe(arg.literalTypes()) + "], but got " + type.id());
    }

    private void checkRef(OpArg arg, String ref, String port, Reporter reporter) {
        Optional<ReferenceKind> kind = scope.resolve(ref);
        if (kind.isEmpty()) {
            reporter.error(arg.name(), "Argument '" + port + "' references unknown ID '" + ref + "'");
            return;
        }
        switch (arg.refType()) {
            case FUNCTION -> {
                if (kind.get() != ReferenceKind.FUNCTION) {
                    reporter.error(arg.name(), "Argument '" + port + "' must reference a function, but '" + ref + "' is not one");
                }
            }
            case RESOURCE -> {
                if (!scope.isResource(ref)) {
                    reporter.error(arg.name(), "Argument '" + port + "' must reference a resource, but '" + ref + "' is not one");
                }
            }
            case NODE -> {
                if (kind.get() != ReferenceKind.NODE && kind.get() != ReferenceKind.LOOP_TAG) {
                    reporter.error(arg.name(), "Argument '" + port + "' must reference a node, but '" + ref + "' is not one");
                }
            }
            default -> checkBuiltinScope(kind.get(), ref, arg.name(), reporter);
        }
    }

    private void checkBuiltinScope(ReferenceKind kind, String ref, String key, Reporter reporter) {
        if (kind != ReferenceKind.BUILTIN || function.type() != FunctionType.CPU) return;
        Builtin builtin = Builtin.fromWireName(ref).orElseThrow();
        if (builtin.isGpuOnly()) {
            reporter.error(key, "GPU Built-in '" + ref + "' is not available in CPU context");
        }
    }

    private void verifyDynamic(Node node, OpDef def, Reporter reporter) {
        String op = node.getOp();
        boolean callsFunction = BuiltinOp.CALL_FUNC.id().equals(op) || BuiltinOp.CMD_DISPATCH.id().equals(op);
        String funcId = node.getString("func") != null ? node.getString("func") : node.getString("target");
        Optional<FunctionDef> targetFunction = callsFunction ? document.findFunction(funcId) : Optional.empty();
        Optional<StructDef> targetStruct = BuiltinOp.STRUCT_CONSTRUCT.id().equals(op)
                ? document.findStruct(node.getString("type")) : Optional.empty();

        for (Map.Entry<String, Object> entry : node.getProperties().entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (Node.isReservedKey(key) || TOLERATED_KEYS.contains(key) || def.declares(key)) continue;

            if (CONTAINER_KEYS.contains(key)) {
                verifyContainer(key, value, targetFunction, targetStruct, funcId, node, reporter);
                continue;
            }
            if (BuiltinOp.ARRAY_CONSTRUCT.id().equals(op) && !ARRAY_CONSTRUCT_KEYS.contains(key)) {
                reporter.error(key, "Unknown argument(s) '" + key + "' in operation '" + op + "'.");
                continue;
            }
            if (targetFunction.isPresent() && !isInput(targetFunction.get(), key)) {
                reporter.error(key, "Unknown argument '" + key + "' for function '" + funcId + "'");
            }
            if (targetStruct.isPresent() && targetStruct.get().member(key).isEmpty()) {
                reporter.error(key, "Unknown member '" + key + "' for struct '" + targetStruct.get().id() + "'");
            }
            if (value instanceof String ref) {
                checkDynamicRef(ref, key, "Argument '" + key + "'", reporter);
            }
        }
    }

    private void verifyContainer(String key, Object value, Optional<FunctionDef> targetFunction,
                                 Optional<StructDef> targetStruct, String funcId, Node node, Reporter reporter) {
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String name = String.valueOf(entry.getKey());
                if ("args".equals(key) && targetFunction.isPresent() && !isInput(targetFunction.get(), name)) {
                    reporter.error(key, "Unknown argument '" + name + "' in consolidated 'args' for function '" + funcId + "'");
                }
                if ("values".equals(key) && targetStruct.isPresent() && targetStruct.get().member(name).isEmpty()) {
                    reporter.error(key, "Unknown member '" + name + "' in consolidated 'values' for struct '"
                            + node.getString("type") + "'");
                }
                if (entry.getValue() instanceof String ref) {
                    checkDynamicRef(ref, key, "Argument '" + name + "' in '" + key + "'", reporter);
                }
            }
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i) instanceof String ref) {
                    checkDynamicRef(ref, key, "Element at index " + i + " in '" + key + "'", reporter);
                }
            }
        }
    }

    private void checkDynamicRef(String ref, String key, String subject, Reporter reporter) {
        Optional<ReferenceKind> kind = scope.resolve(ref);
        if (kind.isEmpty()) {
            reporter.error(key, subject + " references unknown ID '" + ref + "'");
        } else {
            checkBuiltinScope(kind.get(), ref, key, reporter);
        }
    }

    private static boolean isInput(FunctionDef function, String name) {
        return function.inputs().stream().map(PortDef::id).anyMatch(name::equals);
    }

    static String jsonKind(Object value) {
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof List<?>) return "array";
        if (value instanceof Map<?, ?>) return "object";
        return value == null ? "null" : "unknown";
    }

    static List<Object> path(List<Object> base, Object... segments) {
        List<Object> result = new ArrayList<>(base);
        result.addAll(List.of(segments));
        return result;
    }

    private record Reporter(Node node, List<Object> nodePath, DiagnosticsEngine diagnostics) {
        void error(String key, String message) {
            diagnostics.reportError(path(nodePath, key), node.getId(), message);
        }
    }
}
