package org.nanoir.runtime.ops;

import org.nanoir.runtime.EvaluationContext;

/**
 * The CPU semantics of one operation.
 */
@FunctionalInterface
public interface OpHandler {

    /**
     * Executes the operation.
     *
     * @param ctx  The evaluation context.
     * @param args The node's arguments with every reference already resolved to a value.
     * @return The produced value, or {@code null} for pure side effects.
     */
    Object execute(EvaluationContext ctx, OpArguments args);
}
