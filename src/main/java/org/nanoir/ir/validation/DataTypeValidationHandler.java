package org.nanoir.ir.validation;

import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.StructDef;
import org.nanoir.ir.StructMember;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks every declared data type (document inputs, struct members, function ports and
 * local variables) and rejects recursive struct definitions.
 */
public class DataTypeValidationHandler implements IValidationHandler {

    @Override
    public void validate(IRDocument document, DiagnosticsEngine diagnostics) {
        for (int i = 0; i < document.inputs().size(); i++) {
            var input = document.inputs().get(i);
            DataTypes.check(document, input.type(), List.of("inputs", i, "type"), "Input '" + input.id() + "'", diagnostics);
        }

        Set<String> visited = new HashSet<>();
        for (StructDef struct : document.structs()) {
            checkStruct(document, struct.id(), visited, new HashSet<>(), diagnostics);
        }

        for (int f = 0; f < document.functions().size(); f++) {
            FunctionDef func = document.functions().get(f);
            for (int i = 0; i < func.inputs().size(); i++) {
                DataTypes.check(document, func.inputs().get(i).type(), List.of("functions", f, "inputs", i, "type"),
                        "Function '" + func.id() + "' input '" + func.inputs().get(i).id() + "'", diagnostics);
            }
            for (int i = 0; i < func.outputs().size(); i++) {
                DataTypes.check(document, func.outputs().get(i).type(), List.of("functions", f, "outputs", i, "type"),
                        "Function '" + func.id() + "' output '" + func.outputs().get(i).id() + "'", diagnostics);
            }
            for (int i = 0; i < func.localVars().size(); i++) {
                DataTypes.check(document, func.localVars().get(i).type(), List.of("functions", f, "localVars", i, "type"),
                        "Function '" + func.id() + "' variable '" + func.localVars().get(i).id() + "'", diagnostics);
            }
        }
    }

    private void checkStruct(IRDocument document, String structId, Set<String> visited, Set<String> stack,
                             DiagnosticsEngine diagnostics) {
        if (stack.contains(structId)) {
            diagnostics.reportError(List.of("structs"), null,
                    "Recursive struct definition detected: Cycle involving '" + structId + "'");
            return;
        }
        if (!visited.add(structId)) return;

        stack.add(structId);
        int index = document.structs().stream().map(StructDef::id).toList().indexOf(structId);
        StructDef def = document.structs().get(index);
        for (int m = 0; m < def.members().size(); m++) {
            StructMember member = def.members().get(m);
            DataTypes.check(document, member.type(), List.of("structs", index, "members", m, "type"),
                    "Struct '" + structId + "' member '" + member.name() + "'", diagnostics);
            if (document.findStruct(member.type()).isPresent()) {
                checkStruct(document, member.type(), visited, stack, diagnostics);
            }
        }
        stack.remove(structId);
    }
}
