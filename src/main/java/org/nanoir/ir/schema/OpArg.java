package org.nanoir.ir.schema;

import java.util.EnumSet;
import java.util.Set;

/**
 * The contract of one named operation argument.
 *
 * @param name         The argument key on the node.
 * @param doc          Human readable description.
 * @param optional     The argument may be absent.
 * @param refable      A string value is a reference.
 * @param requiredRef  The value must be a string reference.
 * @param literalTypes Accepted literal shapes; empty means unconstrained.
 * @param refType      What a reference resolves to.
 * @param execPort     For {@link RefType#EXEC}: the output port the edge leaves from.
 */
public record OpArg(
        String name,
        String doc,
        boolean optional,
        boolean refable,
        boolean requiredRef,
        Set<IrValueType> literalTypes,
        RefType refType,
        String execPort
) {
    public OpArg {
        literalTypes = literalTypes.isEmpty() ? Set.of() : Set.copyOf(literalTypes);
    }

    /** A value that may be a literal or a data reference. */
    public static OpArg value(String name, String doc) {
        return new OpArg(name, doc, false, true, false, Set.of(), RefType.DATA, null);
    }

    /** A value that must be a literal of the given shapes. */
    public static OpArg literal(String name, String doc, IrValueType first, IrValueType... rest) {
        return new OpArg(name, doc, false, false, false, EnumSet.of(first, rest), RefType.DATA, null);
    }

    /** A value that must be a reference of the given kind. */
    public static OpArg ref(String name, String doc, RefType refType) {
        return new OpArg(name, doc, false, false, true, Set.of(), refType, null);
    }

    /** A legacy control-flow slot naming the node reached through {@code execPort}. */
    public static OpArg exec(String name, String doc, String execPort) {
        return new OpArg(name, doc, true, false, true, Set.of(), RefType.EXEC, execPort);
    }

    public OpArg withLiterals(IrValueType first, IrValueType... rest) {
        return new OpArg(name, doc, optional, refable, requiredRef, EnumSet.of(first, rest), refType, execPort);
    }

    public OpArg asOptional() {
        return new OpArg(name, doc, true, refable, requiredRef, literalTypes, refType, execPort);
    }

    public OpArg asRefable() {
        return new OpArg(name, doc, optional, true, requiredRef, literalTypes, refType, execPort);
    }

    public boolean isReferenceSlot() {
        return refable || requiredRef;
    }

    /**
     * Whether a string in this slot is passed through verbatim instead of being evaluated.
     *
     * @return {@code true} for name slots and plain string literals.
     */
    public boolean passesStringThrough() {
        if (isReferenceSlot()) {
            return refType.isNameOnly();
        }
        return true;
    }
}
