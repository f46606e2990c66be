package org.nanoir.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Conversions between authored values and the interpreter's runtime representation.
 * <p>
 * At runtime, scalars are {@link Double}, booleans {@link Boolean}, vectors and matrices
 * {@code double[]} (matrices column-major), arrays {@link List} and structs
 * {@link Map} with insertion-ordered keys.
 */
public final class Values {

    private Values() {
    }

    /**
     * Converts an authored or host value into the runtime representation.
     * Lists consisting only of numbers become vectors.
     *
     * @param value The value.
     * @return The runtime value.
     */
    public static Object normalize(Object value) {
        if (value instanceof Double || value instanceof Boolean || value instanceof String || value instanceof double[]) {
            return value;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof float[] f) {
            double[] out = new double[f.length];
            for (int i = 0; i < f.length; i++) out[i] = f[i];
            return out;
        }
        if (value instanceof int[] ints) {
            return Arrays.stream(ints).asDoubleStream().toArray();
        }
        if (value instanceof List<?> list) {
            if (!list.isEmpty() && list.stream().allMatch(e -> e instanceof Number)) {
                return list.stream().mapToDouble(e -> ((Number) e).doubleValue()).toArray();
            }
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(normalize(item));
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), normalize(e.getValue()));
            }
            return out;
        }
        return value;
    }

    /**
     * Deep-copies mutable runtime values so that stores never alias.
     *
     * @param value The runtime value.
     * @return An independent copy.
     */
    public static Object copy(Object value) {
        if (value instanceof double[] v) return v.clone();
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) out.add(copy(item));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) out.put(String.valueOf(e.getKey()), copy(e.getValue()));
            return out;
        }
        return value;
    }

    public static double toDouble(Object value, String what) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean b) return b ? 1.0 : 0.0;
        throw new InterpreterException("Expected a number for " + what + ", but got " + describe(value));
    }

    public static int toInt(Object value, String what) {
        return toInt32(toDouble(value, what));
    }

    /**
     * Converts to a 32-bit integer by truncation and wrap-around, matching the int
     * conversion of the shading targets. NaN and infinities become 0.
     *
     * @param d The number.
     * @return The 32-bit integer.
     */
    public static int toInt32(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return 0;
        double truncated = d < 0 ? Math.ceil(d) : Math.floor(d);
        return (int) (long) (truncated % 4294967296.0);
    }

    public static double[] toVector(Object value, String what) {
        if (value instanceof double[] v) return v;
        if (value instanceof List<?> list && list.stream().allMatch(e -> e instanceof Number)) {
            return list.stream().mapToDouble(e -> ((Number) e).doubleValue()).toArray();
        }
        throw new InterpreterException("Expected a vector for " + what + ", but got " + describe(value));
    }

    /**
     * Normalises a color to four channels. One channel is broadcast to RGB, two or three
     * channels are padded with zero, and a missing alpha becomes 1.
     *
     * @param value A scalar or vector color; {@code null} is transparent black.
     * @return A new RGBA array.
     */
    public static double[] toTexel(Object value) {
        if (value == null) return new double[4];
        if (value instanceof double[] v) {
            switch (v.length) {
                case 0:
                    return new double[4];
                case 1:
                    return new double[]{v[0], v[0], v[0], 1.0};
                case 2:
                    return new double[]{v[0], v[1], 0.0, 1.0};
                case 3:
                    return new double[]{v[0], v[1], v[2], 1.0};
                default:
                    return new double[]{v[0], v[1], v[2], v[3]};
            }
        }
        double d = toDouble(value, "texel");
        return new double[]{d, d, d, 1.0};
    }

    public static boolean truthy(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0 && !Double.isNaN(n.doubleValue());
        if (value instanceof String s) return !s.isEmpty();
        return value != null;
    }

    public static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    public static String describe(Object value) {
        if (value == null) return "nothing";
        if (value instanceof Number n) return "number " + n;
        if (value instanceof Boolean b) return "bool " + b;
        if (value instanceof String s) return "string '" + s + "'";
        if (value instanceof double[] v) return "vector of length " + v.length;
        if (value instanceof List<?> l) return "array of length " + l.size();
        if (value instanceof Map<?, ?>) return "struct";
        return value.getClass().getSimpleName();
    }

    /**
     * Returns the zero value of a declared data type.
     *
     * @param type          The data type name.
     * @param structMembers Looks up struct layouts; returns {@code null} for non-structs.
     * @return The default value.
     */
    public static Object defaultFor(String type, Function<String, Map<String, String>> structMembers) {
        if (type == null) return 0.0;
        switch (type) {
            case "float", "f32", "int", "i32", "uint", "u32":
                return 0.0;
            case "bool":
                return false;
            case "string":
                return "";
            case "float2", "int2", "vec2<f32>":
                return new double[2];
            case "float3", "int3", "vec3<f32>":
                return new double[3];
            case "float4", "int4", "vec4<f32>":
                return new double[4];
            case "float3x3", "mat3x3<f32>":
                return new double[9];
            case "float4x4", "mat4x4<f32>":
                return new double[16];
            default:
                break;
        }
        if (type.startsWith("array<") || type.endsWith("[]")) {
            return new ArrayList<>();
        }
        Map<String, String> members = structMembers.apply(type);
        if (members != null) {
            Map<String, Object> out = new LinkedHashMap<>();
            members.forEach((name, memberType) -> out.put(name, defaultFor(memberType, structMembers)));
            return out;
        }
        return 0.0;
    }
}
