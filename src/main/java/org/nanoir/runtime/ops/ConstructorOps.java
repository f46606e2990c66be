package org.nanoir.runtime.ops;

import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.Values;

import java.util.function.DoubleUnaryOperator;

/**
 * Literals, scalar constructors and vector constructors.
 * <p>
 * Vector constructors read {@code x}, {@code y}, {@code z} and {@code w} in order. A
 * component given as a vector contributes all of its elements, so {@code float4(xyz, w)}
 * can be written with {@code x} bound to a three-component vector.
 */
final class ConstructorOps {

    private static final String[] COMPONENTS = {"x", "y", "z", "w"};

    private ConstructorOps() {
    }

    static void register() {
        OpRegistry.register(BuiltinOp.LITERAL, (ctx, a) -> Values.copy(a.require("val")));
        OpRegistry.register(BuiltinOp.FLOAT, (ctx, a) -> a.getDouble("val"));
        OpRegistry.register(BuiltinOp.INT, (ctx, a) -> (double) a.getInt("val"));
        OpRegistry.register(BuiltinOp.UINT, (ctx, a) -> (double) Math.max(0, a.getInt("val")));
        OpRegistry.register(BuiltinOp.BOOL, (ctx, a) -> Values.truthy(a.require("val")));
        OpRegistry.register(BuiltinOp.STRING, (ctx, a) -> String.valueOf(a.require("val")));

        OpRegistry.registerFamily((ctx, a) -> vector(a, 2, x -> x), BuiltinOp.FLOAT2, BuiltinOp.VEC2);
        OpRegistry.registerFamily((ctx, a) -> vector(a, 3, x -> x), BuiltinOp.FLOAT3, BuiltinOp.VEC3);
        OpRegistry.registerFamily((ctx, a) -> vector(a, 4, x -> x), BuiltinOp.FLOAT4, BuiltinOp.VEC4);
        OpRegistry.register(BuiltinOp.INT2, (ctx, a) -> vector(a, 2, Values::toInt32));
        OpRegistry.register(BuiltinOp.INT3, (ctx, a) -> vector(a, 3, Values::toInt32));
        OpRegistry.register(BuiltinOp.INT4, (ctx, a) -> vector(a, 4, Values::toInt32));
    }

    private static double[] vector(OpArguments args, int size, DoubleUnaryOperator component) {
        double[] out = new double[size];
        int filled = 0;
        for (String key : COMPONENTS) {
            if (!args.has(key)) continue;
            Object value = args.get(key);
            double[] parts = value instanceof double[] v ? v : new double[]{Values.toDouble(value, "'" + key + "' of " + args.nodeId())};
            for (double part : parts) {
                if (filled == size) {
                    throw args.error("too many components for a " + size + "-component vector");
                }
                out[filled++] = component.applyAsDouble(part);
            }
        }
        if (filled != size) {
            throw args.error("expected " + size + " components, got " + filled);
        }
        return out;
    }
}
