package org.nanoir.ir.schema;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Literal shapes an operation argument may accept when it is not a reference.
 */
public enum IrValueType {
    FLOAT("float"),
    INT("int"),
    BOOL("bool"),
    STRING("string"),
    FLOAT2("float2"),
    FLOAT3("float3"),
    FLOAT4("float4"),
    FLOAT3X3("float3x3"),
    FLOAT4X4("float4x4"),
    ARRAY("array"),
    STRUCT("struct"),
    ANY("any"),
    UNKNOWN("unknown");

    private final String id;

    IrValueType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Detects the literal shape of an authored value.
     * Integral numbers are {@link #INT} even when written with a fractional part of zero.
     *
     * @param value The authored value.
     * @return The detected shape.
     */
    public static IrValueType detect(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return (!Double.isInfinite(d) && d == Math.rint(d)) ? INT : FLOAT;
        }
        if (value instanceof Boolean) return BOOL;
        if (value instanceof String) return STRING;
        if (value instanceof double[] arr) return vectorShape(arr.length);
        if (value instanceof List<?> list) {
            boolean numeric = list.stream().allMatch(e -> e instanceof Number);
            return numeric ? vectorShape(list.size()) : ARRAY;
        }
        if (value instanceof Map<?, ?>) return STRUCT;
        return UNKNOWN;
    }

    /**
     * Maps a declared data type name to its shape. Integer vectors share the float vector
     * shapes; struct names are not known here and map to {@link #ANY}.
     *
     * @param typeName The declared type, e.g. {@code float3} or {@code array<float, 4>}.
     * @return The shape, {@link #ANY} if the name carries no usable shape.
     */
    public static IrValueType fromTypeName(String typeName) {
        if (typeName == null) return ANY;
        if (typeName.startsWith("array<") || typeName.endsWith("[]")) return ARRAY;
        return switch (typeName) {
            case "float", "f32" -> FLOAT;
            case "int", "i32", "uint", "u32" -> INT;
            case "bool", "boolean" -> BOOL;
            case "string" -> STRING;
            case "float2", "int2", "vec2", "vec2<f32>" -> FLOAT2;
            case "float3", "int3", "vec3", "vec3<f32>" -> FLOAT3;
            case "float4", "int4", "vec4", "vec4<f32>" -> FLOAT4;
            case "float3x3", "mat3x3<f32>" -> FLOAT3X3;
            case "float4x4", "mat4x4<f32>" -> FLOAT4X4;
            default -> ANY;
        };
    }

    /**
     * @return Whether this shape accepts any value during signature matching.
     */
    public boolean isWildcard() {
        return this == ANY || this == UNKNOWN;
    }

    private static IrValueType vectorShape(int length) {
        return switch (length) {
            case 2 -> FLOAT2;
            case 3 -> FLOAT3;
            case 4 -> FLOAT4;
            case 9 -> FLOAT3X3;
            case 16 -> FLOAT4X4;
            default -> ARRAY;
        };
    }

    /**
     * Checks a detected shape against an allowed set, applying the int-to-float coercion.
     *
     * @param detected The detected shape.
     * @param allowed  The accepted shapes.
     * @return {@code true} if accepted.
     */
    public static boolean matches(IrValueType detected, Set<IrValueType> allowed) {
        if (allowed.contains(detected)) return true;
        return detected == INT && allowed.contains(FLOAT);
    }

    public boolean isVector() {
        return this == FLOAT2 || this == FLOAT3 || this == FLOAT4;
    }

    public static String describe(Collection<IrValueType> types) {
        return types.stream().map(IrValueType::id).sorted().reduce((a, b) -> a + ", " + b).orElse("");
    }
}
