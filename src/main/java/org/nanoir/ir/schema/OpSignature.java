package org.nanoir.ir.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One typed overload of an operation: argument shapes in declaration order and the result shape.
 *
 * @param inputs The argument name to shape mapping.
 * @param output The shape of the result.
 */
public record OpSignature(Map<String, IrValueType> inputs, IrValueType output) {

    public OpSignature {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static OpSignature of(IrValueType output) {
        return new OpSignature(Map.of(), output);
    }

    public static OpSignature of(String arg, IrValueType type, IrValueType output) {
        Map<String, IrValueType> inputs = new LinkedHashMap<>();
        inputs.put(arg, type);
        return new OpSignature(inputs, output);
    }

    public static OpSignature of(String a, IrValueType aType, String b, IrValueType bType, IrValueType output) {
        Map<String, IrValueType> inputs = new LinkedHashMap<>();
        inputs.put(a, aType);
        inputs.put(b, bType);
        return new OpSignature(inputs, output);
    }

    public static OpSignature of(String a, IrValueType aType, String b, IrValueType bType,
                                 String c, IrValueType cType, IrValueType output) {
        Map<String, IrValueType> inputs = new LinkedHashMap<>();
        inputs.put(a, aType);
        inputs.put(b, bType);
        inputs.put(c, cType);
        return new OpSignature(inputs, output);
    }
}
