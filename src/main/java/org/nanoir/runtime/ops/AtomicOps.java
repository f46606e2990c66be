package org.nanoir.runtime.ops;

import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.ResourceState;
import org.nanoir.runtime.Values;

import java.util.function.IntBinaryOperator;

/**
 * Atomic counter operations on 32-bit signed integer slots.
 * <p>
 * Read-modify-write operations return the value the slot held before the update.
 * Execution is single-threaded, so atomicity holds trivially.
 */
final class AtomicOps {

    private AtomicOps() {
    }

    static void register() {
        OpRegistry.register(BuiltinOp.ATOMIC_LOAD, (ctx, a) -> {
            ResourceState counter = counter(ctx, a);
            return (double) current(counter, a);
        });
        OpRegistry.register(BuiltinOp.ATOMIC_STORE, (ctx, a) -> {
            ResourceState counter = counter(ctx, a);
            counter.set(slot(a, counter), (double) operand(a));
            return null;
        });
        OpRegistry.register(BuiltinOp.ATOMIC_ADD, (ctx, a) -> update(ctx, a, (old, v) -> old + v));
        OpRegistry.register(BuiltinOp.ATOMIC_SUB, (ctx, a) -> update(ctx, a, (old, v) -> old - v));
        OpRegistry.register(BuiltinOp.ATOMIC_MIN, (ctx, a) -> update(ctx, a, Math::min));
        OpRegistry.register(BuiltinOp.ATOMIC_MAX, (ctx, a) -> update(ctx, a, Math::max));
        OpRegistry.register(BuiltinOp.ATOMIC_EXCHANGE, (ctx, a) -> update(ctx, a, (old, v) -> v));
    }

    private static Object update(EvaluationContext ctx, OpArguments args, IntBinaryOperator operation) {
        ResourceState counter = counter(ctx, args);
        int index = slot(args, counter);
        int old = current(counter, args);
        // int arithmetic wraps like the 32-bit hardware counter
        counter.set(index, (double) operation.applyAsInt(old, operand(args)));
        return (double) old;
    }

    private static ResourceState counter(EvaluationContext ctx, OpArguments args) {
        return ctx.getResource(args.getString("counter"));
    }

    private static int slot(OpArguments args, ResourceState counter) {
        int index = args.getInt("index", 0);
        if (index < 0 || index >= counter.elementCount()) {
            throw args.error("counter slot " + index + " out of bounds for '" + counter.getId() + "' with "
                    + counter.elementCount() + " slots");
        }
        return index;
    }

    private static int current(ResourceState counter, OpArguments args) {
        Object value = counter.get(slot(args, counter));
        return value == null ? 0 : Values.toInt(value, "counter '" + counter.getId() + "'");
    }

    private static int operand(OpArguments args) {
        return Values.toInt32(args.getDouble("value"));
    }
}
