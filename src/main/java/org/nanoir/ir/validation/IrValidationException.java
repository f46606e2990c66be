package org.nanoir.ir.validation;

import org.nanoir.ir.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a document that must be valid fails validation.
 * Carries the complete list of diagnostics of the failed pass.
 */
public class IrValidationException extends Exception {

    private final List<Diagnostic> diagnostics;

    public IrValidationException(List<Diagnostic> diagnostics) {
        super(buildMessage(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String buildMessage(List<Diagnostic> diagnostics) {
        return diagnostics.size() + " validation error(s):\n"
                + diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
