package org.nanoir.ir.schema;

/**
 * What a reference-bearing argument points at.
 * <p>
 * {@link #DATA} values are pulled and evaluated. {@link #VARIABLE}, {@link #FUNCTION},
 * {@link #RESOURCE} and {@link #NODE} name their target and are passed through as ids.
 * {@link #EXEC} names the executable node that control flows to.
 */
public enum RefType {
    DATA,
    VARIABLE,
    FUNCTION,
    RESOURCE,
    NODE,
    EXEC;

    public boolean isNameOnly() {
        return this != DATA;
    }
}
