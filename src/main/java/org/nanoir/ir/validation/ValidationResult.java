package org.nanoir.ir.validation;

import org.nanoir.ir.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of validating a document.
 *
 * @param diagnostics Every problem found, in discovery order.
 */
public record ValidationResult(List<Diagnostic> diagnostics) {

    public ValidationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isValid() {
        return errors().isEmpty();
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::message).collect(Collectors.toList());
    }
}
