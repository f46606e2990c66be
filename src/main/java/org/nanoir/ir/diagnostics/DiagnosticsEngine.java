package org.nanoir.ir.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics found while checking a document.
 * <p>
 * Checks never throw; they report here and continue, so one pass surfaces every problem.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param path    The document path of the problem.
     * @param nodeId  The offending node id, or {@code null}.
     * @param message The error message.
     */
    public void reportError(List<Object> path, String nodeId, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, path, nodeId, message));
    }

    /**
     * Reports a warning.
     *
     * @param path    The document path of the problem.
     * @param nodeId  The offending node id, or {@code null}.
     * @param message The warning message.
     */
    public void reportWarning(List<Object> path, String nodeId, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, path, nodeId, message));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return Diagnostic.join(diagnostics);
    }
}
