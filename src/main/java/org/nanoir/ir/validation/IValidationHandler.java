package org.nanoir.ir.validation;

import org.nanoir.ir.IRDocument;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;

/**
 * A single check over a whole document. Handlers report problems and never throw.
 */
@FunctionalInterface
public interface IValidationHandler {
    /**
     * Validates one aspect of the document.
     * @param document The document to check.
     * @param diagnostics The engine for reporting errors.
     */
    void validate(IRDocument document, DiagnosticsEngine diagnostics);
}
