package org.nanoir.ir.validation;

import org.nanoir.ir.IRDocument;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;

import java.util.List;
import java.util.Set;

/**
 * Recognition of data type names used by inputs, ports, variables, struct members and buffers.
 */
final class DataTypes {

    static final Set<String> PRIMITIVES = Set.of(
            "float", "int", "bool", "float2", "float3", "float4", "float3x3", "float4x4",
            "int2", "int3", "int4", "texture2d", "sampler", "string");

    private DataTypes() {
    }

    static boolean isValid(IRDocument document, String type) {
        if (type == null) return false;
        if (PRIMITIVES.contains(type)) return true;
        if (document.findStruct(type).isPresent()) return true;
        return type.startsWith("array<") || type.endsWith("[]");
    }

    static void check(IRDocument document, String type, List<Object> path, String context, DiagnosticsEngine diagnostics) {
        if (!isValid(document, type)) {
            diagnostics.reportError(path, null,
                    context + ": Invalid data type '" + type + "'. Must be a primitive or defined struct.");
        }
    }
}
