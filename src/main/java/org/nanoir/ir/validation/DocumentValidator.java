package org.nanoir.ir.validation;

import com.typesafe.config.Config;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.FunctionType;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Validates a whole {@link IRDocument} in one pass.
 * <p>
 * Document-level checks (entry point, id uniqueness) run first, followed by the registered
 * {@link IValidationHandler}s. All problems are accumulated; nothing is thrown unless the
 * caller asks for it through {@link #validateOrThrow(IRDocument)}.
 */
public class DocumentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentValidator.class);

    public static final List<String> DEFAULT_IMPLICIT_TARGETS = List.of("screen");

    private final List<IValidationHandler> handlers = new ArrayList<>();

    public DocumentValidator() {
        this(DEFAULT_IMPLICIT_TARGETS);
    }

    /**
     * Creates a validator.
     *
     * @param implicitTargets Ids accepted as references without being declared.
     */
    public DocumentValidator(Collection<String> implicitTargets) {
        handlers.add(new ResourceValidationHandler());
        handlers.add(new DataTypeValidationHandler());
        handlers.add(new FunctionValidationHandler(implicitTargets));
        handlers.add(new TypeInferenceHandler(implicitTargets));
    }

    /**
     * Creates a validator from the {@code nanoir.validation} configuration block.
     *
     * @param config The application configuration.
     * @return The validator.
     */
    public static DocumentValidator fromConfig(Config config) {
        String path = "nanoir.validation.implicit-targets";
        return new DocumentValidator(config.hasPath(path) ? config.getStringList(path) : DEFAULT_IMPLICIT_TARGETS);
    }

    /**
     * Validates a document.
     *
     * @param document The document.
     * @return Every diagnostic found.
     */
    public ValidationResult validate(IRDocument document) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        validateEntryPoint(document, diagnostics);
        checkUnique(document.resources(), r -> r.id(), "resources", "resource", diagnostics);
        checkUnique(document.functions(), FunctionDef::id, "functions", "function", diagnostics);
        checkUnique(document.inputs(), i -> i.id(), "inputs", "input", diagnostics);
        checkUnique(document.structs(), s -> s.id(), "structs", "struct", diagnostics);

        for (IValidationHandler handler : handlers) {
            handler.validate(document, diagnostics);
        }
        return new ValidationResult(diagnostics.getDiagnostics());
    }

    /**
     * Validates a document and fails if it has errors.
     *
     * @param document The document.
     * @throws IrValidationException if at least one error was found.
     */
    public void validateOrThrow(IRDocument document) throws IrValidationException {
        ValidationResult result = validate(document);
        if (!result.isValid()) {
            LOG.warn("Document '{}' failed validation with {} error(s)",
                    document.meta() != null ? document.meta().name() : "<unnamed>", result.errors().size());
            throw new IrValidationException(result.errors());
        }
    }

    private void validateEntryPoint(IRDocument document, DiagnosticsEngine diagnostics) {
        String entryPoint = document.entryPoint();
        if (entryPoint == null || entryPoint.isEmpty()) {
            diagnostics.reportError(List.of("entryPoint"), null, "Missing entry point");
            return;
        }
        Optional<FunctionDef> entry = document.findFunction(entryPoint);
        if (entry.isEmpty()) {
            diagnostics.reportError(List.of("entryPoint"), null, "Entry point '" + entryPoint + "' not found");
        } else if (entry.get().type() != FunctionType.CPU) {
            diagnostics.reportError(List.of("entryPoint"), null,
                    "Entry point '" + entryPoint + "' must be a cpu function");
        }
    }

    private <T> void checkUnique(List<T> items, Function<T, String> id, String collection, String kind,
                                 DiagnosticsEngine diagnostics) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            String value = id.apply(items.get(i));
            if (value != null && !seen.add(value)) {
                diagnostics.reportError(List.of(collection, i, "id"), null, "Duplicate " + kind + " id '" + value + "'");
            }
        }
    }
}
