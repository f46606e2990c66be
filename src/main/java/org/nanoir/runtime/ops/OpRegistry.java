package org.nanoir.runtime.ops;

import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.InterpreterException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps every value-producing or side-effecting operation to its CPU handler.
 * <p>
 * Control operations ({@link BuiltinOp#isControl()}) are driven by the executor and have
 * no handler here. Every other operation must be registered exactly once.
 */
public final class OpRegistry {

    private static final Map<BuiltinOp, OpHandler> HANDLERS = new EnumMap<>(BuiltinOp.class);

    static {
        init();
    }

    private OpRegistry() {
        // Static registry
    }

    private static void init() {
        MathOps.register();
        CastOps.register();
        VectorOps.register();
        ConstructorOps.register();
        MatrixOps.register();
        QuaternionOps.register();
        ResourceOps.register();
        AtomicOps.register();
        StructArrayOps.register();
        VariableOps.register();
    }

    static void register(BuiltinOp op, OpHandler handler) {
        if (op.isControl()) {
            throw new IllegalStateException("Control op '" + op.id() + "' is executed by the executor, not a handler");
        }
        if (HANDLERS.putIfAbsent(op, handler) != null) {
            throw new IllegalStateException("Duplicate handler registration for op '" + op.id() + "'");
        }
    }

    static void registerFamily(OpHandler handler, BuiltinOp... ops) {
        for (BuiltinOp op : ops) {
            register(op, handler);
        }
    }

    public static Optional<OpHandler> find(BuiltinOp op) {
        return Optional.ofNullable(HANDLERS.get(op));
    }

    /**
     * Returns the handler of an operation.
     *
     * @param op The operation.
     * @return The handler.
     * @throws InterpreterException if the operation has no handler.
     */
    public static OpHandler get(BuiltinOp op) {
        OpHandler handler = HANDLERS.get(op);
        if (handler == null) {
            throw new InterpreterException("No handler registered for op '" + op.id() + "'");
        }
        return handler;
    }

    public static Set<BuiltinOp> registeredOps() {
        return Collections.unmodifiableSet(HANDLERS.keySet());
    }
}
