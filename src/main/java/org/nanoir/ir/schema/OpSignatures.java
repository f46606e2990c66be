package org.nanoir.ir.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.nanoir.ir.schema.BuiltinOp.*;
import static org.nanoir.ir.schema.IrValueType.ANY;
import static org.nanoir.ir.schema.IrValueType.BOOL;
import static org.nanoir.ir.schema.IrValueType.FLOAT;
import static org.nanoir.ir.schema.IrValueType.FLOAT2;
import static org.nanoir.ir.schema.IrValueType.FLOAT3;
import static org.nanoir.ir.schema.IrValueType.FLOAT3X3;
import static org.nanoir.ir.schema.IrValueType.FLOAT4;
import static org.nanoir.ir.schema.IrValueType.FLOAT4X4;
import static org.nanoir.ir.schema.IrValueType.INT;
import static org.nanoir.ir.schema.IrValueType.STRING;

/**
 * Typed overloads of the operations whose result shape follows from their argument shapes.
 * <p>
 * Overloads are tried in registration order; the first one whose arguments all match wins.
 * Operations without an entry produce {@link IrValueType#ANY}.
 */
public final class OpSignatures {

    private static final List<IrValueType> GEN_TYPES = List.of(FLOAT, FLOAT2, FLOAT3, FLOAT4);
    private static final List<IrValueType> VECTORS = List.of(FLOAT2, FLOAT3, FLOAT4);

    private static final Map<BuiltinOp, List<OpSignature>> SIGNATURES = new EnumMap<>(BuiltinOp.class);

    static {
        init();
    }

    private OpSignatures() {
        // Static table
    }

    /**
     * @param op The operation.
     * @return Its overloads in matching order, empty if the operation is untyped.
     */
    public static List<OpSignature> get(BuiltinOp op) {
        return SIGNATURES.getOrDefault(op, List.of());
    }

    public static boolean has(BuiltinOp op) {
        return SIGNATURES.containsKey(op);
    }

    private static void init() {
        // Math
        for (BuiltinOp op : List.of(MATH_ADD, MATH_SUB, MATH_MUL, MATH_DIV, MATH_MOD, MATH_POW, MATH_MIN, MATH_MAX,
                MATH_ATAN2)) {
            register(op, binary(false));
        }
        for (BuiltinOp op : List.of(MATH_GT, MATH_LT, MATH_GE, MATH_LE, MATH_EQ, MATH_NEQ)) {
            register(op, binary(true));
        }
        for (BuiltinOp op : List.of(MATH_SIN, MATH_COS, MATH_TAN, MATH_ASIN, MATH_ACOS, MATH_ATAN,
                MATH_SINH, MATH_COSH, MATH_TANH, MATH_SIGN, MATH_EXP, MATH_LOG, MATH_SQRT,
                MATH_ABS, MATH_CEIL, MATH_FLOOR, MATH_FRACT, MATH_TRUNC,
                MATH_FLUSH_SUBNORMAL, MATH_MANTISSA, MATH_EXPONENT)) {
            register(op, unary(false));
        }
        for (BuiltinOp op : List.of(MATH_IS_NAN, MATH_IS_INF, MATH_IS_FINITE)) {
            register(op, unary(true));
        }

        List<OpSignature> divScalar = new ArrayList<>();
        for (IrValueType t : GEN_TYPES) {
            divScalar.add(OpSignature.of("val", t, "scalar", FLOAT, t));
        }
        register(MATH_DIV_SCALAR, divScalar);

        List<OpSignature> mad = new ArrayList<>();
        for (IrValueType t : GEN_TYPES) {
            mad.add(OpSignature.of("a", t, "b", t, "c", t, t));
        }
        register(MATH_MAD, mad);

        List<OpSignature> clamp = new ArrayList<>();
        for (IrValueType t : GEN_TYPES) {
            clamp.add(OpSignature.of("val", t, "min", t, "max", t, t));
        }
        for (IrValueType t : VECTORS) {
            clamp.add(OpSignature.of("val", t, "min", FLOAT, "max", FLOAT, t));
        }
        register(MATH_CLAMP, clamp);

        // Logic accepts truthy numbers as well as booleans.
        for (BuiltinOp op : List.of(MATH_AND, MATH_OR, MATH_XOR)) {
            register(op, List.of(
                    OpSignature.of("a", BOOL, "b", BOOL, BOOL),
                    OpSignature.of("a", FLOAT, "b", FLOAT, BOOL)));
        }
        register(MATH_NOT, List.of(OpSignature.of("val", BOOL, BOOL), OpSignature.of("val", FLOAT, BOOL)));

        // Casts
        register(STATIC_CAST_INT, List.of(OpSignature.of("val", FLOAT, INT), OpSignature.of("val", BOOL, INT)));
        register(STATIC_CAST_UINT, List.of(OpSignature.of("val", FLOAT, INT), OpSignature.of("val", BOOL, INT)));
        register(STATIC_CAST_FLOAT, List.of(OpSignature.of("val", INT, FLOAT), OpSignature.of("val", BOOL, FLOAT)));
        register(STATIC_CAST_BOOL, List.of(OpSignature.of("val", INT, BOOL), OpSignature.of("val", BOOL, BOOL)));

        // Constructors
        register(BuiltinOp.FLOAT, List.of(OpSignature.of("val", FLOAT, FLOAT)));
        register(BuiltinOp.INT, List.of(OpSignature.of("val", INT, INT)));
        register(UINT, List.of(OpSignature.of("val", INT, INT)));
        register(BuiltinOp.BOOL, List.of(OpSignature.of("val", BOOL, BOOL)));
        register(BuiltinOp.STRING, List.of(OpSignature.of("val", STRING, STRING)));
        for (BuiltinOp op : List.of(BuiltinOp.FLOAT2, VEC2, INT2)) {
            register(op, List.of(components(FLOAT2, "x", "y")));
        }
        for (BuiltinOp op : List.of(BuiltinOp.FLOAT3, VEC3, INT3)) {
            register(op, List.of(components(FLOAT3, "x", "y", "z")));
        }
        for (BuiltinOp op : List.of(BuiltinOp.FLOAT4, VEC4, INT4)) {
            register(op, List.of(components(FLOAT4, "x", "y", "z", "w")));
        }
        register(BuiltinOp.FLOAT3X3, List.of(OpSignature.of(FLOAT3X3)));
        register(BuiltinOp.FLOAT4X4, List.of(OpSignature.of(FLOAT4X4)));

        // Vectors
        List<OpSignature> element = new ArrayList<>();
        List<OpSignature> swizzle = new ArrayList<>();
        List<OpSignature> dot = new ArrayList<>();
        List<OpSignature> length = new ArrayList<>();
        List<OpSignature> normalize = new ArrayList<>();
        List<OpSignature> mix = new ArrayList<>();
        for (IrValueType t : VECTORS) {
            element.add(OpSignature.of("vec", t, "index", INT, FLOAT));
            swizzle.add(OpSignature.of("vec", t, "channels", STRING, ANY));
            dot.add(OpSignature.of("a", t, "b", t, FLOAT));
            length.add(OpSignature.of("a", t, FLOAT));
            normalize.add(OpSignature.of("a", t, t));
            mix.add(OpSignature.of("a", t, "b", t, "t", FLOAT, t));
        }
        for (IrValueType t : VECTORS) {
            mix.add(OpSignature.of("a", t, "b", t, "t", t, t));
        }
        register(VEC_GET_ELEMENT, element);
        register(VEC_SWIZZLE, swizzle);
        register(VEC_DOT, dot);
        register(VEC_LENGTH, length);
        register(VEC_NORMALIZE, normalize);
        register(VEC_MIX, mix);

        // Matrices
        register(MAT_IDENTITY, List.of(OpSignature.of("size", INT, FLOAT4X4)));
        register(MAT_MUL, List.of(
                OpSignature.of("a", FLOAT4X4, "b", FLOAT4X4, FLOAT4X4),
                OpSignature.of("a", FLOAT3X3, "b", FLOAT3X3, FLOAT3X3),
                OpSignature.of("a", FLOAT4X4, "b", FLOAT4, FLOAT4),
                OpSignature.of("a", FLOAT3X3, "b", FLOAT3, FLOAT3),
                OpSignature.of("a", FLOAT4, "b", FLOAT4X4, FLOAT4),
                OpSignature.of("a", FLOAT3, "b", FLOAT3X3, FLOAT3)));

        // Variables
        register(CONST_GET, List.of(OpSignature.of("name", STRING, FLOAT)));
        register(LOOP_INDEX, List.of(OpSignature.of("loop", STRING, INT)));
        register(VAR_SET, List.of(OpSignature.of("var", STRING, "val", ANY, ANY)));
    }

    /** (T, T) for every scalar and vector T, then vector/scalar broadcasts unless the result is a comparison. */
    private static List<OpSignature> binary(boolean comparison) {
        List<OpSignature> variants = new ArrayList<>();
        for (IrValueType t : GEN_TYPES) {
            IrValueType out = comparison && t == FLOAT ? BOOL : t;
            variants.add(OpSignature.of("a", t, "b", t, out));
        }
        if (!comparison) {
            for (IrValueType t : VECTORS) {
                variants.add(OpSignature.of("a", t, "b", FLOAT, t));
                variants.add(OpSignature.of("a", FLOAT, "b", t, t));
            }
        }
        return variants;
    }

    private static List<OpSignature> unary(boolean classification) {
        List<OpSignature> variants = new ArrayList<>();
        for (IrValueType t : GEN_TYPES) {
            variants.add(OpSignature.of("val", t, classification && t == FLOAT ? BOOL : t));
        }
        return variants;
    }

    private static OpSignature components(IrValueType output, String... names) {
        Map<String, IrValueType> inputs = new LinkedHashMap<>();
        for (String name : names) {
            inputs.put(name, FLOAT);
        }
        return new OpSignature(inputs, output);
    }

    private static void register(BuiltinOp op, List<OpSignature> signatures) {
        if (SIGNATURES.containsKey(op)) {
            throw new IllegalStateException("Duplicate signature registration for op '" + op.id() + "'");
        }
        SIGNATURES.put(op, Collections.unmodifiableList(new ArrayList<>(signatures)));
    }
}
