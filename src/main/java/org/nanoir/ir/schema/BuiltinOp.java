package org.nanoir.ir.schema;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed catalog of operations a node's {@code op} may name.
 * <p>
 * This enumeration and the argument contracts in {@link OpSchemaRegistry} form the stable
 * contract shared by producers, the validator, the interpreter and external generators.
 */
public enum BuiltinOp {
    // --- Math ---
    MATH_ADD("math_add", Category.MATH),
    MATH_SUB("math_sub", Category.MATH),
    MATH_MUL("math_mul", Category.MATH),
    MATH_DIV("math_div", Category.MATH),
    MATH_MOD("math_mod", Category.MATH),
    MATH_POW("math_pow", Category.MATH),
    MATH_MIN("math_min", Category.MATH),
    MATH_MAX("math_max", Category.MATH),
    MATH_GT("math_gt", Category.MATH),
    MATH_LT("math_lt", Category.MATH),
    MATH_GE("math_ge", Category.MATH),
    MATH_LE("math_le", Category.MATH),
    MATH_EQ("math_eq", Category.MATH),
    MATH_NEQ("math_neq", Category.MATH),
    MATH_ATAN2("math_atan2", Category.MATH),
    MATH_AND("math_and", Category.MATH),
    MATH_OR("math_or", Category.MATH),
    MATH_XOR("math_xor", Category.MATH),
    MATH_DIV_SCALAR("math_div_scalar", Category.MATH),
    MATH_ABS("math_abs", Category.MATH),
    MATH_CEIL("math_ceil", Category.MATH),
    MATH_FLOOR("math_floor", Category.MATH),
    MATH_SQRT("math_sqrt", Category.MATH),
    MATH_EXP("math_exp", Category.MATH),
    MATH_LOG("math_log", Category.MATH),
    MATH_SIN("math_sin", Category.MATH),
    MATH_COS("math_cos", Category.MATH),
    MATH_TAN("math_tan", Category.MATH),
    MATH_ASIN("math_asin", Category.MATH),
    MATH_ACOS("math_acos", Category.MATH),
    MATH_ATAN("math_atan", Category.MATH),
    MATH_SINH("math_sinh", Category.MATH),
    MATH_COSH("math_cosh", Category.MATH),
    MATH_TANH("math_tanh", Category.MATH),
    MATH_ASINH("math_asinh", Category.MATH),
    MATH_ACOSH("math_acosh", Category.MATH),
    MATH_ATANH("math_atanh", Category.MATH),
    MATH_SIGN("math_sign", Category.MATH),
    MATH_FRACT("math_fract", Category.MATH),
    MATH_TRUNC("math_trunc", Category.MATH),
    MATH_ROUND("math_round", Category.MATH),
    MATH_IS_NAN("math_is_nan", Category.MATH),
    MATH_IS_INF("math_is_inf", Category.MATH),
    MATH_IS_FINITE("math_is_finite", Category.MATH),
    MATH_NOT("math_not", Category.MATH),
    MATH_FLUSH_SUBNORMAL("math_flush_subnormal", Category.MATH),
    MATH_MANTISSA("math_mantissa", Category.MATH),
    MATH_EXPONENT("math_exponent", Category.MATH),
    MATH_FREXP_MANTISSA("math_frexp_mantissa", Category.MATH),
    MATH_FREXP_EXPONENT("math_frexp_exponent", Category.MATH),
    MATH_LDEXP("math_ldexp", Category.MATH),
    MATH_MAD("math_mad", Category.MATH),
    MATH_CLAMP("math_clamp", Category.MATH),
    MATH_STEP("math_step", Category.MATH),
    MATH_SMOOTHSTEP("math_smoothstep", Category.MATH),
    MATH_MIX("math_mix", Category.MATH),
    MATH_PI("math_pi", Category.MATH),
    MATH_E("math_e", Category.MATH),

    // --- Cast ---
    STATIC_CAST_INT("static_cast_int", Category.CAST),
    STATIC_CAST_FLOAT("static_cast_float", Category.CAST),
    STATIC_CAST_BOOL("static_cast_bool", Category.CAST),
    STATIC_CAST_UINT("static_cast_uint", Category.CAST),

    // --- Vector ---
    VEC_DOT("vec_dot", Category.VECTOR),
    VEC_LENGTH("vec_length", Category.VECTOR),
    VEC_NORMALIZE("vec_normalize", Category.VECTOR),
    VEC_SWIZZLE("vec_swizzle", Category.VECTOR),
    VEC_MIX("vec_mix", Category.VECTOR),
    VEC_GET_ELEMENT("vec_get_element", Category.VECTOR),
    COLOR_MIX("color_mix", Category.VECTOR),

    // --- Constructor ---
    LITERAL("literal", Category.CONSTRUCTOR),
    FLOAT("float", Category.CONSTRUCTOR),
    INT("int", Category.CONSTRUCTOR),
    UINT("uint", Category.CONSTRUCTOR),
    BOOL("bool", Category.CONSTRUCTOR),
    STRING("string", Category.CONSTRUCTOR),
    FLOAT2("float2", Category.CONSTRUCTOR),
    FLOAT3("float3", Category.CONSTRUCTOR),
    FLOAT4("float4", Category.CONSTRUCTOR),
    VEC2("vec2", Category.CONSTRUCTOR),
    VEC3("vec3", Category.CONSTRUCTOR),
    VEC4("vec4", Category.CONSTRUCTOR),
    INT2("int2", Category.CONSTRUCTOR),
    INT3("int3", Category.CONSTRUCTOR),
    INT4("int4", Category.CONSTRUCTOR),

    // --- Matrix ---
    FLOAT3X3("float3x3", Category.MATRIX),
    FLOAT4X4("float4x4", Category.MATRIX),
    MAT_IDENTITY("mat_identity", Category.MATRIX),
    MAT_MUL("mat_mul", Category.MATRIX),
    MAT_TRANSPOSE("mat_transpose", Category.MATRIX),
    MAT_INVERSE("mat_inverse", Category.MATRIX),
    MAT_EXTRACT("mat_extract", Category.MATRIX),

    // --- Quaternion ---
    QUAT("quat", Category.QUATERNION),
    QUAT_IDENTITY("quat_identity", Category.QUATERNION),
    QUAT_MUL("quat_mul", Category.QUATERNION),
    QUAT_SLERP("quat_slerp", Category.QUATERNION),
    QUAT_TO_FLOAT4X4("quat_to_float4x4", Category.QUATERNION),
    QUAT_ROTATE("quat_rotate", Category.QUATERNION),

    // --- Resource ---
    TEXTURE_SAMPLE("texture_sample", Category.RESOURCE),
    TEXTURE_LOAD("texture_load", Category.RESOURCE),
    TEXTURE_STORE("texture_store", Category.RESOURCE),
    BUFFER_LOAD("buffer_load", Category.RESOURCE),
    BUFFER_STORE("buffer_store", Category.RESOURCE),
    RESOURCE_GET_SIZE("resource_get_size", Category.RESOURCE),
    RESOURCE_GET_FORMAT("resource_get_format", Category.RESOURCE),

    // --- Atomic ---
    ATOMIC_LOAD("atomic_load", Category.ATOMIC),
    ATOMIC_STORE("atomic_store", Category.ATOMIC),
    ATOMIC_ADD("atomic_add", Category.ATOMIC),
    ATOMIC_SUB("atomic_sub", Category.ATOMIC),
    ATOMIC_MIN("atomic_min", Category.ATOMIC),
    ATOMIC_MAX("atomic_max", Category.ATOMIC),
    ATOMIC_EXCHANGE("atomic_exchange", Category.ATOMIC),

    // --- Structs & Arrays ---
    STRUCT_CONSTRUCT("struct_construct", Category.STRUCT_ARRAY),
    STRUCT_EXTRACT("struct_extract", Category.STRUCT_ARRAY),
    ARRAY_CONSTRUCT("array_construct", Category.STRUCT_ARRAY),
    ARRAY_SET("array_set", Category.STRUCT_ARRAY),
    ARRAY_EXTRACT("array_extract", Category.STRUCT_ARRAY),
    ARRAY_LENGTH("array_length", Category.STRUCT_ARRAY),

    // --- Variable ---
    VAR_SET("var_set", Category.VARIABLE),
    VAR_GET("var_get", Category.VARIABLE),
    CONST_GET("const_get", Category.VARIABLE),
    LOOP_INDEX("loop_index", Category.VARIABLE),
    BUILTIN_GET("builtin_get", Category.VARIABLE),

    // --- Flow ---
    FLOW_BRANCH("flow_branch", Category.FLOW),
    FLOW_LOOP("flow_loop", Category.FLOW),
    CALL_FUNC("call_func", Category.FLOW),
    FUNC_RETURN("func_return", Category.FLOW),

    // --- Command ---
    CMD_DRAW("cmd_draw", Category.COMMAND),
    CMD_DISPATCH("cmd_dispatch", Category.COMMAND),
    CMD_RESIZE_RESOURCE("cmd_resize_resource", Category.COMMAND),
    CMD_COPY_BUFFER("cmd_copy_buffer", Category.COMMAND),
    CMD_COPY_TEXTURE("cmd_copy_texture", Category.COMMAND);

    /**
     * Broad operation families, used for grouping only.
     */
    public enum Category {
        MATH, CAST, VECTOR, CONSTRUCTOR, MATRIX, QUATERNION, RESOURCE, ATOMIC,
        STRUCT_ARRAY, VARIABLE, FLOW, COMMAND
    }

    private static final Map<String, BuiltinOp> BY_ID = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(BuiltinOp::id, Function.identity())));

    private final String id;
    private final Category category;

    BuiltinOp(String id, Category category) {
        this.id = id;
        this.category = category;
    }

    public String id() {
        return id;
    }

    public Category category() {
        return category;
    }

    public static Optional<BuiltinOp> fromId(String id) {
        return Optional.ofNullable(BY_ID.get(id));
    }

    /**
     * Operations whose semantics are driven by the executor itself rather than by a
     * value-producing handler.
     *
     * @return {@code true} for branch, loop, call, return, dispatch and draw.
     */
    public boolean isControl() {
        return this == FLOW_BRANCH || this == FLOW_LOOP || this == CALL_FUNC
                || this == FUNC_RETURN || this == CMD_DISPATCH || this == CMD_DRAW;
    }

    @Override
    public String toString() {
        return id;
    }
}
