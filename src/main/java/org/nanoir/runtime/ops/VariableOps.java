package org.nanoir.runtime.ops;

import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.TextureFormat;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.InterpreterException;
import org.nanoir.runtime.Values;

import java.util.Optional;

/**
 * Variable, constant, loop index and builtin access.
 */
final class VariableOps {

    private static final String FORMAT_PREFIX = "TextureFormat.";

    private VariableOps() {
    }

    static void register() {
        OpRegistry.register(BuiltinOp.VAR_SET, (ctx, a) -> {
            String var = a.getString("var");
            checkAssignable(ctx, var);
            Object value = a.require("val");
            ctx.setVar(var, Values.copy(value));
            return value;
        });
        OpRegistry.register(BuiltinOp.VAR_GET, (ctx, a) -> ctx.getVar(a.getString("var")));
        OpRegistry.register(BuiltinOp.CONST_GET, (ctx, a) -> constant(a.getString("name")));
        OpRegistry.register(BuiltinOp.LOOP_INDEX, (ctx, a) -> (double) ctx.getLoopIndex(a.getString("loop")));
        OpRegistry.register(BuiltinOp.BUILTIN_GET, (ctx, a) -> ctx.getBuiltin(a.getString("name")));
    }

    /**
     * Only declared local variables and inputs of the running function can be assigned.
     * Frames that do not belong to a document function accept any name.
     */
    static void checkAssignable(EvaluationContext ctx, String var) {
        String function = ctx.currentFrame().getName();
        Optional<FunctionDef> def = ctx.getDocument().findFunction(function);
        if (def.isPresent() && !def.get().hasLocalVar(var) && !def.get().hasInput(var)) {
            throw new InterpreterException("Variable '" + var + "' is not declared in function '" + function + "'");
        }
    }

    /** Unknown constants read as 0. */
    static double constant(String name) {
        if (!name.startsWith(FORMAT_PREFIX)) {
            return 0.0;
        }
        return TextureFormat.fromConstantKey(name.substring(FORMAT_PREFIX.length()))
                .map(f -> (double) f.id())
                .orElse(0.0);
    }
}
