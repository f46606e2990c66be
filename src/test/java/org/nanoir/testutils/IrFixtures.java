package org.nanoir.testutils;

import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.MetaData;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.StructDef;
import org.nanoir.ir.io.IrDocumentLoader;
import org.nanoir.ir.io.IrLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Builds small IR documents for tests and loads the JSON fixtures under {@code /ir}.
 */
public final class IrFixtures {

    private IrFixtures() {
    }

    public static IRDocument document(List<ResourceDef> resources, FunctionDef... functions) {
        return document(List.of(), resources, List.of(), functions);
    }

    /**
     * Creates a document whose entry point is the first function.
     */
    public static IRDocument document(List<InputDef> inputs, List<ResourceDef> resources, List<StructDef> structs,
                                      FunctionDef... functions) {
        return new IRDocument("1.0.0", MetaData.named("test"), functions[0].id(), inputs, resources, structs,
                List.of(functions));
    }

    public static IRDocument load(String name) {
        try (InputStream in = IrFixtures.class.getResourceAsStream("/ir/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: /ir/" + name);
            }
            return new IrDocumentLoader().load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (IrLoadException e) {
            throw new IllegalStateException("Fixture /ir/" + name + " is not a valid document", e);
        }
    }
}
