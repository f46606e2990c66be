package org.nanoir.runtime.ops;

import org.nanoir.runtime.Values;

import static org.nanoir.ir.schema.BuiltinOp.STATIC_CAST_BOOL;
import static org.nanoir.ir.schema.BuiltinOp.STATIC_CAST_FLOAT;
import static org.nanoir.ir.schema.BuiltinOp.STATIC_CAST_INT;
import static org.nanoir.ir.schema.BuiltinOp.STATIC_CAST_UINT;

/**
 * Numeric conversions. Integer casts truncate toward zero through a 32-bit integer,
 * they never round.
 */
final class CastOps {

    private CastOps() {
    }

    static void register() {
        OpRegistry.register(STATIC_CAST_INT, (ctx, a) -> MathOps.unary(a, a.require("val"), x -> Values.toInt32(x)));
        OpRegistry.register(STATIC_CAST_UINT, (ctx, a) ->
                MathOps.unary(a, a.require("val"), x -> Math.max(0, Values.toInt32(x))));
        OpRegistry.register(STATIC_CAST_FLOAT, (ctx, a) -> MathOps.unary(a, a.require("val"), x -> x));
        OpRegistry.register(STATIC_CAST_BOOL, (ctx, a) -> {
            Object val = a.require("val");
            if (val instanceof double[]) {
                return MathOps.unary(a, val, x -> x != 0.0 ? 1.0 : 0.0);
            }
            return Values.toDouble(val, "operand of " + a.nodeId()) != 0.0;
        });
    }
}
