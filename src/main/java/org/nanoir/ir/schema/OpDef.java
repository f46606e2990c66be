package org.nanoir.ir.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The argument contract and execution class of an operation.
 *
 * @param doc        Human readable description.
 * @param args       Declared arguments in declaration order.
 * @param executable The operation has side effects and is ordered by execution edges.
 * @param dynamic    The argument set is open and validated against auxiliary context.
 */
public record OpDef(String doc, Map<String, OpArg> args, boolean executable, boolean dynamic) {

    public OpDef {
        args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static OpDef pure(String doc, OpArg... args) {
        return new OpDef(doc, toMap(List.of(args)), false, false);
    }

    public static OpDef executable(String doc, OpArg... args) {
        return new OpDef(doc, toMap(List.of(args)), true, false);
    }

    public OpDef asDynamic() {
        return new OpDef(doc, args, executable, true);
    }

    public Optional<OpArg> arg(String name) {
        return Optional.ofNullable(args.get(name));
    }

    public boolean declares(String key) {
        return args.containsKey(key);
    }

    private static Map<String, OpArg> toMap(List<OpArg> list) {
        Map<String, OpArg> map = new LinkedHashMap<>();
        for (OpArg a : list) {
            map.put(a.name(), a);
        }
        return map;
    }
}
