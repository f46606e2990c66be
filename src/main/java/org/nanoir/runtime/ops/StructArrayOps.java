package org.nanoir.runtime.ops;

import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Struct and array construction and access. Structs are ordered maps; arrays are lists,
 * or {@code double[]} when every element is a number.
 */
final class StructArrayOps {

    private StructArrayOps() {
    }

    static void register() {
        OpRegistry.register(BuiltinOp.STRUCT_CONSTRUCT, (ctx, a) -> {
            Map<String, Object> out = new LinkedHashMap<>();
            if (a.get("values") instanceof Map<?, ?> values) {
                values.forEach((k, v) -> out.put(String.valueOf(k), Values.copy(v)));
                return out;
            }
            a.asMap().forEach((k, v) -> {
                if (!"type".equals(k)) out.put(k, Values.copy(v));
            });
            return out;
        });
        OpRegistry.register(BuiltinOp.STRUCT_EXTRACT, (ctx, a) -> {
            Object struct = a.require("struct");
            String field = a.getString("field");
            if (!(struct instanceof Map<?, ?> map)) {
                throw a.error("expected a struct, but got " + Values.describe(struct));
            }
            if (!map.containsKey(field)) {
                throw a.error("struct has no field '" + field + "'");
            }
            return map.get(field);
        });
        OpRegistry.register(BuiltinOp.ARRAY_CONSTRUCT, (ctx, a) -> {
            if (a.has("values")) {
                return new ArrayList<>(elements(a, a.require("values")));
            }
            int length = a.getInt("length", 0);
            if (length < 0) {
                throw a.error("negative array length " + length);
            }
            Object fill = a.has("fill") ? a.get("fill") : 0.0;
            List<Object> out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                out.add(Values.copy(fill));
            }
            return out;
        });
        OpRegistry.register(BuiltinOp.ARRAY_SET, (ctx, a) -> {
            String name = a.getString("array");
            Object array = ctx.getVar(name);
            int index = a.getInt("index");
            Object value = a.require("value");
            if (array instanceof double[] numbers) {
                checkIndex(a, index, numbers.length);
                numbers[index] = Values.toDouble(value, "element of array '" + name + "'");
            } else if (array instanceof List<?>) {
                @SuppressWarnings("unchecked")
                List<Object> list = (List<Object>) array;
                checkIndex(a, index, list.size());
                list.set(index, Values.copy(value));
            } else {
                throw a.error("variable '" + name + "' is not an array, but " + Values.describe(array));
            }
            return value;
        });
        OpRegistry.register(BuiltinOp.ARRAY_EXTRACT, (ctx, a) -> {
            Object array = a.require("array");
            int index = a.getInt("index");
            if (array instanceof double[] numbers) {
                checkIndex(a, index, numbers.length);
                return numbers[index];
            }
            List<?> list = elements(a, array);
            checkIndex(a, index, list.size());
            return list.get(index);
        });
        OpRegistry.register(BuiltinOp.ARRAY_LENGTH, (ctx, a) -> {
            Object array = a.require("array");
            if (array instanceof double[] numbers) {
                return (double) numbers.length;
            }
            return (double) elements(a, array).size();
        });
    }

    private static List<?> elements(OpArguments args, Object array) {
        if (array instanceof List<?> list) {
            return list;
        }
        if (array instanceof double[] numbers) {
            List<Object> out = new ArrayList<>(numbers.length);
            for (double d : numbers) out.add(d);
            return out;
        }
        throw args.error("expected an array, but got " + Values.describe(array));
    }

    private static void checkIndex(OpArguments args, int index, int length) {
        if (index < 0 || index >= length) {
            throw args.error("index " + index + " out of bounds for array of length " + length);
        }
    }
}
