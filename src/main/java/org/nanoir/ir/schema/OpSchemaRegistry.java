package org.nanoir.ir.schema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.nanoir.ir.schema.BuiltinOp.*;
import static org.nanoir.ir.schema.IrValueType.ARRAY;
import static org.nanoir.ir.schema.IrValueType.BOOL;
import static org.nanoir.ir.schema.IrValueType.FLOAT;
import static org.nanoir.ir.schema.IrValueType.FLOAT2;
import static org.nanoir.ir.schema.IrValueType.FLOAT3;
import static org.nanoir.ir.schema.IrValueType.FLOAT3X3;
import static org.nanoir.ir.schema.IrValueType.FLOAT4;
import static org.nanoir.ir.schema.IrValueType.FLOAT4X4;
import static org.nanoir.ir.schema.IrValueType.INT;
import static org.nanoir.ir.schema.IrValueType.STRING;
import static org.nanoir.ir.schema.IrValueType.STRUCT;

/**
 * The single source of truth for operation argument contracts.
 * <p>
 * Both edge reconstruction and validation read from here, so changing an operation's
 * contract only requires changing its registration below.
 */
public final class OpSchemaRegistry {

    private static final Map<BuiltinOp, OpDef> DEFINITIONS = new EnumMap<>(BuiltinOp.class);

    static {
        init();
    }

    private OpSchemaRegistry() {
        // Static registry
    }

    /**
     * Returns the definition of an operation.
     *
     * @param op The operation.
     * @return Its definition; every {@link BuiltinOp} has one.
     */
    public static OpDef get(BuiltinOp op) {
        return DEFINITIONS.get(op);
    }

    /**
     * Looks up the definition for an op string as it appears on a node.
     *
     * @param opId The op string.
     * @return The definition, or empty for an unknown op.
     */
    public static Optional<OpDef> find(String opId) {
        return BuiltinOp.fromId(opId).map(DEFINITIONS::get);
    }

    public static boolean isExecutable(String opId) {
        return find(opId).map(OpDef::executable).orElse(false);
    }

    public static Map<BuiltinOp, OpDef> all() {
        return Collections.unmodifiableMap(DEFINITIONS);
    }

    private static void init() {
        // Math
        OpDef binary = OpDef.pure("Element-wise binary operation over scalars and equal-length vectors.",
                OpArg.value("a", "First operand").withLiterals(FLOAT, INT, FLOAT2, FLOAT3, FLOAT4),
                OpArg.value("b", "Second operand").withLiterals(FLOAT, INT, FLOAT2, FLOAT3, FLOAT4));
        registerFamily(binary, MATH_ADD, MATH_SUB, MATH_MUL, MATH_DIV, MATH_MOD, MATH_POW, MATH_MIN, MATH_MAX,
                MATH_GT, MATH_LT, MATH_GE, MATH_LE, MATH_EQ, MATH_NEQ, MATH_ATAN2);

        registerFamily(OpDef.pure("Boolean logic over truthy operands.",
                        OpArg.value("a", "First operand").withLiterals(BOOL, FLOAT, INT),
                        OpArg.value("b", "Second operand").withLiterals(BOOL, FLOAT, INT)),
                MATH_AND, MATH_OR, MATH_XOR);

        register(MATH_DIV_SCALAR, OpDef.pure("Divide a scalar or vector by a scalar.",
                OpArg.value("val", "Value"),
                OpArg.value("scalar", "Scalar divisor").withLiterals(FLOAT, INT)));

        OpDef unary = OpDef.pure("Element-wise unary operation.",
                OpArg.value("val", "Input value").withLiterals(FLOAT, INT, BOOL, FLOAT2, FLOAT3, FLOAT4));
        registerFamily(unary, MATH_ABS, MATH_CEIL, MATH_FLOOR, MATH_SQRT, MATH_EXP, MATH_LOG,
                MATH_SIN, MATH_COS, MATH_TAN, MATH_ASIN, MATH_ACOS, MATH_ATAN,
                MATH_SINH, MATH_COSH, MATH_TANH, MATH_ASINH, MATH_ACOSH, MATH_ATANH,
                MATH_SIGN, MATH_FRACT, MATH_TRUNC, MATH_ROUND, MATH_IS_NAN, MATH_IS_INF, MATH_IS_FINITE,
                MATH_NOT, MATH_FLUSH_SUBNORMAL, MATH_MANTISSA, MATH_EXPONENT, MATH_FREXP_MANTISSA, MATH_FREXP_EXPONENT,
                STATIC_CAST_INT, STATIC_CAST_FLOAT, STATIC_CAST_BOOL, STATIC_CAST_UINT);

        register(MATH_LDEXP, OpDef.pure("val * 2^exp",
                OpArg.value("val", "Mantissa"),
                OpArg.value("exp", "Exponent").withLiterals(INT, FLOAT)));
        register(MATH_MAD, OpDef.pure("a * b + c",
                OpArg.value("a", "a"), OpArg.value("b", "b"), OpArg.value("c", "c")));
        register(MATH_CLAMP, OpDef.pure("Clamp a value between min and max.",
                OpArg.value("val", "Value to clamp"), OpArg.value("min", "Minimum"), OpArg.value("max", "Maximum")));
        register(MATH_STEP, OpDef.pure("0 where x < edge, else 1.",
                OpArg.value("edge", "Edge"), OpArg.value("x", "Value")));
        register(MATH_SMOOTHSTEP, OpDef.pure("Hermite interpolation between two edges.",
                OpArg.value("edge0", "Lower edge"), OpArg.value("edge1", "Upper edge"), OpArg.value("x", "Value")));
        register(MATH_MIX, OpDef.pure("Linear interpolation a*(1-t) + b*t.",
                OpArg.value("a", "a"), OpArg.value("b", "b"), OpArg.value("t", "t")));
        registerFamily(OpDef.pure("Mathematical constant."), MATH_PI, MATH_E);

        // Vectors
        registerFamily(OpDef.pure("Dot product.",
                        OpArg.value("a", "First vector").withLiterals(FLOAT2, FLOAT3, FLOAT4),
                        OpArg.value("b", "Second vector").withLiterals(FLOAT2, FLOAT3, FLOAT4)),
                VEC_DOT);
        registerFamily(OpDef.pure("Unary vector operation.",
                        OpArg.value("a", "Vector").withLiterals(FLOAT2, FLOAT3, FLOAT4)),
                VEC_LENGTH, VEC_NORMALIZE);
        register(VEC_SWIZZLE, OpDef.pure("Swizzle components of a vector.",
                OpArg.value("vec", "Input vector").withLiterals(FLOAT2, FLOAT3, FLOAT4),
                OpArg.literal("channels", "Swizzle mask (e.g. 'xyz')", STRING)));
        register(VEC_MIX, OpDef.pure("Linearly interpolate between two vectors.",
                OpArg.value("a", "a"), OpArg.value("b", "b"), OpArg.value("t", "t")));
        register(VEC_GET_ELEMENT, OpDef.pure("Get one component of a vector.",
                OpArg.value("vec", "Vector").withLiterals(FLOAT2, FLOAT3, FLOAT4),
                OpArg.value("index", "Index").withLiterals(INT)));
        register(COLOR_MIX, OpDef.pure("Source-over composite of b onto a (straight alpha).",
                OpArg.value("a", "Destination color").withLiterals(FLOAT3, FLOAT4),
                OpArg.value("b", "Source color").withLiterals(FLOAT3, FLOAT4),
                OpArg.value("t", "Unused blend factor").withLiterals(FLOAT, INT).asOptional()));

        // Constructors
        register(LITERAL, OpDef.pure("Constant literal value.",
                OpArg.literal("val", "The literal value", FLOAT, INT, BOOL, STRING, FLOAT2, FLOAT3, FLOAT4,
                        FLOAT3X3, FLOAT4X4, ARRAY, STRUCT)));
        register(BuiltinOp.FLOAT, OpDef.pure("Float constructor.", OpArg.value("val", "Value").withLiterals(FLOAT, INT)));
        registerFamily(OpDef.pure("Integer constructor.", OpArg.value("val", "Value").withLiterals(INT, FLOAT)), BuiltinOp.INT, UINT);
        register(BuiltinOp.BOOL, OpDef.pure("Bool constructor.", OpArg.value("val", "Value").withLiterals(BOOL)));
        register(BuiltinOp.STRING, OpDef.pure("String constructor.", OpArg.literal("val", "Value", STRING)));

        OpArg x = OpArg.value("x", "X").withLiterals(FLOAT, INT);
        OpArg y = OpArg.value("y", "Y").withLiterals(FLOAT, INT);
        OpArg z = OpArg.value("z", "Z").withLiterals(FLOAT, INT);
        OpArg w = OpArg.value("w", "W").withLiterals(FLOAT, INT);
        registerFamily(OpDef.pure("Construct a 2-component vector.", x, y), BuiltinOp.FLOAT2, VEC2, INT2);
        registerFamily(OpDef.pure("Construct a 3-component vector.", x, y, z), BuiltinOp.FLOAT3, VEC3, INT3);
        registerFamily(OpDef.pure("Construct a 4-component vector.", x, y, z, w), BuiltinOp.FLOAT4, VEC4, INT4);

        // Matrices
        register(BuiltinOp.FLOAT3X3, matrixConstructor(3));
        register(BuiltinOp.FLOAT4X4, matrixConstructor(4));
        register(MAT_IDENTITY, OpDef.pure("Identity matrix.",
                OpArg.value("size", "Size (3 or 4)").withLiterals(INT)));
        register(MAT_MUL, OpDef.pure("Column-major matrix product, or matrix-vector product.",
                OpArg.value("a", "Matrix A"), OpArg.value("b", "Matrix B or vector")));
        registerFamily(OpDef.pure("Matrix unary operation.", OpArg.value("val", "Input matrix")),
                MAT_TRANSPOSE, MAT_INVERSE);
        register(MAT_EXTRACT, OpDef.pure("Read one matrix element.",
                OpArg.value("mat", "Matrix"),
                OpArg.value("col", "Column").withLiterals(INT),
                OpArg.value("row", "Row").withLiterals(INT)));

        // Quaternions
        register(QUAT, OpDef.pure("Construct a quaternion from axis/angle or components.",
                OpArg.value("axis", "Rotation axis").withLiterals(FLOAT3).asOptional(),
                OpArg.value("angle", "Rotation angle").withLiterals(FLOAT, INT).asOptional(),
                x.asOptional(), y.asOptional(), z.asOptional(), w.asOptional()));
        register(QUAT_IDENTITY, OpDef.pure("Identity quaternion."));
        register(QUAT_MUL, OpDef.pure("Quaternion product.",
                OpArg.value("a", "Quat A").withLiterals(FLOAT4), OpArg.value("b", "Quat B").withLiterals(FLOAT4)));
        register(QUAT_SLERP, OpDef.pure("Spherical interpolation.",
                OpArg.value("a", "a").withLiterals(FLOAT4), OpArg.value("b", "b").withLiterals(FLOAT4),
                OpArg.value("t", "t").withLiterals(FLOAT, INT)));
        register(QUAT_TO_FLOAT4X4, OpDef.pure("Rotation matrix of a quaternion.",
                OpArg.value("q", "q").withLiterals(FLOAT4)));
        register(QUAT_ROTATE, OpDef.pure("Rotate a vector by a quaternion.",
                OpArg.value("v", "Vector").withLiterals(FLOAT3), OpArg.value("q", "q").withLiterals(FLOAT4)));

        // Resources
        OpArg tex = OpArg.ref("tex", "Texture resource", RefType.RESOURCE);
        register(TEXTURE_SAMPLE, OpDef.pure("Sample a texture with its sampler state.",
                tex,
                OpArg.value("coords", "Normalized coordinates").withLiterals(FLOAT2).asOptional(),
                OpArg.value("uv", "Alias for coords").withLiterals(FLOAT2).asOptional()));
        register(TEXTURE_LOAD, OpDef.pure("Load a texel by integer coordinates.",
                tex, OpArg.value("coords", "Texel coordinates [x, y]").withLiterals(FLOAT2)));
        register(TEXTURE_STORE, OpDef.executable("Store a texel.",
                tex,
                OpArg.value("coords", "Texel coordinates [x, y]").withLiterals(FLOAT2),
                OpArg.value("value", "Color").withLiterals(FLOAT4, FLOAT3, FLOAT, INT)));
        OpArg buffer = OpArg.ref("buffer", "Buffer resource", RefType.RESOURCE);
        OpArg index = OpArg.value("index", "Element index").withLiterals(INT);
        register(BUFFER_LOAD, OpDef.pure("Load a buffer element (bounds-checked).", buffer, index));
        register(BUFFER_STORE, OpDef.executable("Store a buffer element (bounds-checked).",
                buffer, index, OpArg.value("value", "Value to store")));
        registerFamily(OpDef.pure("Resource metadata.", OpArg.ref("resource", "Resource", RefType.RESOURCE)),
                RESOURCE_GET_SIZE, RESOURCE_GET_FORMAT);

        // Atomics
        OpArg counter = OpArg.ref("counter", "Atomic counter resource", RefType.RESOURCE);
        OpArg counterIndex = OpArg.value("index", "Counter slot").withLiterals(INT).asOptional();
        OpArg counterValue = OpArg.value("value", "Operand").withLiterals(INT, FLOAT);
        register(ATOMIC_LOAD, OpDef.pure("Read a counter slot.", counter, counterIndex));
        register(ATOMIC_STORE, OpDef.executable("Write a counter slot.", counter, counterIndex, counterValue));
        registerFamily(OpDef.executable("Read-modify-write a counter slot; yields the previous value.",
                        counter, counterIndex, counterValue),
                ATOMIC_ADD, ATOMIC_SUB, ATOMIC_MIN, ATOMIC_MAX, ATOMIC_EXCHANGE);

        // Structs & Arrays
        register(STRUCT_CONSTRUCT, OpDef.pure("Construct a struct from the node's fields.").asDynamic());
        register(STRUCT_EXTRACT, OpDef.pure("Extract a field from a struct.",
                OpArg.value("struct", "Struct instance"),
                OpArg.literal("field", "Field name", STRING)));
        register(ARRAY_CONSTRUCT, OpDef.pure("Construct an array from values, or length and fill.").asDynamic());
        register(ARRAY_SET, OpDef.executable("Set an element of an array variable.",
                OpArg.ref("array", "Array variable", RefType.VARIABLE),
                index,
                OpArg.value("value", "Value")));
        register(ARRAY_EXTRACT, OpDef.pure("Read an element of an array.",
                OpArg.value("array", "Array"), index));
        register(ARRAY_LENGTH, OpDef.pure("Length of an array.",
                OpArg.value("array", "Array").withLiterals(ARRAY)));

        // Variables
        register(VAR_SET, OpDef.executable("Assign a local variable.",
                OpArg.literal("var", "Variable name", STRING),
                OpArg.value("val", "Value to store")));
        register(VAR_GET, OpDef.pure("Read a variable.",
                OpArg.ref("var", "Variable name", RefType.VARIABLE)));
        register(CONST_GET, OpDef.pure("Read a named constant.",
                OpArg.literal("name", "Constant name", STRING)));
        register(LOOP_INDEX, OpDef.pure("Current index of an enclosing loop.",
                OpArg.ref("loop", "Loop node id or tag", RefType.NODE)));
        register(BUILTIN_GET, OpDef.pure("Read a per-invocation builtin.",
                OpArg.literal("name", "Builtin name", STRING)));

        // Flow
        register(FLOW_BRANCH, OpDef.executable("Follow exec_true or exec_false depending on cond.",
                OpArg.value("cond", "Condition").withLiterals(BOOL, INT, FLOAT),
                OpArg.exec("true", "Legacy alias of exec_true", "exec_true"),
                OpArg.exec("false", "Legacy alias of exec_false", "exec_false")));
        register(FLOW_LOOP, OpDef.executable("Run exec_body once per index, then exec_completed.",
                OpArg.value("count", "Iteration count").withLiterals(INT).asOptional(),
                OpArg.value("start", "Start index").withLiterals(INT).asOptional(),
                OpArg.value("end", "End index (exclusive)").withLiterals(INT).asOptional(),
                OpArg.exec("body", "Legacy alias of exec_body", "exec_body"),
                OpArg.literal("tag", "Loop tag", STRING).asOptional()));
        register(CALL_FUNC, OpDef.executable("Call a function with arguments.",
                OpArg.ref("func", "Function id", RefType.FUNCTION)).asDynamic());
        register(FUNC_RETURN, OpDef.executable("Return from the current function.",
                OpArg.value("val", "Return value").asOptional(),
                OpArg.value("value", "Return value (alias)").asOptional()));

        // Commands
        register(CMD_DRAW, OpDef.executable("Draw primitives to a target resource.",
                OpArg.ref("target", "Target resource", RefType.RESOURCE),
                OpArg.ref("vertex", "Vertex shader function", RefType.FUNCTION),
                OpArg.ref("fragment", "Fragment shader function", RefType.FUNCTION),
                OpArg.value("count", "Vertex count").withLiterals(INT),
                OpArg.literal("pipeline", "Render pipeline state", STRUCT).asOptional()));
        register(CMD_DISPATCH, OpDef.executable("Run a shader once per cell of an invocation grid.",
                OpArg.ref("func", "Shader function", RefType.FUNCTION).asOptional(),
                OpArg.ref("target", "Alias for func", RefType.FUNCTION).asOptional(),
                OpArg.value("x", "Grid size X").withLiterals(INT).asOptional(),
                OpArg.value("y", "Grid size Y").withLiterals(INT).asOptional(),
                OpArg.value("z", "Grid size Z").withLiterals(INT).asOptional(),
                OpArg.value("dispatch", "Grid size [x, y, z]").withLiterals(FLOAT3).asOptional(),
                OpArg.value("threads", "Alias for dispatch").withLiterals(FLOAT3).asOptional()).asDynamic());
        register(CMD_RESIZE_RESOURCE, OpDef.executable("Resize a resource.",
                OpArg.ref("resource", "Resource", RefType.RESOURCE),
                OpArg.value("size", "New size: scalar or [w, h]").withLiterals(INT, FLOAT, FLOAT2),
                new OpArg("clear", "Optional clear value", true, false, false, Set.of(), RefType.DATA, null),
                OpArg.value("format", "Optional format id or name").withLiterals(INT, STRING).asOptional()));
        register(CMD_COPY_BUFFER, OpDef.executable("Copy a range of buffer elements.",
                OpArg.ref("src", "Source buffer", RefType.RESOURCE),
                OpArg.ref("dst", "Destination buffer", RefType.RESOURCE),
                OpArg.value("src_offset", "Source offset").withLiterals(INT).asOptional(),
                OpArg.value("dst_offset", "Destination offset").withLiterals(INT).asOptional(),
                OpArg.value("count", "Element count").withLiterals(INT).asOptional()));
        register(CMD_COPY_TEXTURE, OpDef.executable("Copy texels, optionally blending.",
                OpArg.ref("src", "Source texture", RefType.RESOURCE),
                OpArg.ref("dst", "Destination texture", RefType.RESOURCE),
                OpArg.value("src_rect", "Source rect [x, y, w, h]").withLiterals(FLOAT4).asOptional(),
                OpArg.value("dst_rect", "Destination rect [x, y, w, h]").withLiterals(FLOAT4).asOptional(),
                OpArg.value("alpha", "Blend opacity").withLiterals(FLOAT, INT).asOptional()));
    }

    private static OpDef matrixConstructor(int dim) {
        OpArg[] args = new OpArg[dim * dim + 2];
        int i = 0;
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                args[i++] = OpArg.literal("m" + r + c, "Row " + r + ", column " + c, FLOAT, INT).asOptional();
            }
        }
        args[i++] = OpArg.value("cols", "Column vectors").asOptional();
        args[i] = OpArg.value("vals", "Column-major values").asOptional();
        return OpDef.pure(dim + "x" + dim + " matrix.", args);
    }

    private static void registerFamily(OpDef def, BuiltinOp... ops) {
        for (BuiltinOp op : ops) {
            register(op, def);
        }
    }

    private static void register(BuiltinOp op, OpDef def) {
        if (DEFINITIONS.containsKey(op)) {
            throw new IllegalStateException("Duplicate schema registration for op '" + op.id() + "'");
        }
        DEFINITIONS.put(op, def);
    }
}
