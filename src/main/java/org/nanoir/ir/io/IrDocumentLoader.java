package org.nanoir.ir.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.nanoir.ir.IRDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link IRDocument}s in their JSON wire format.
 * <p>
 * Unknown document-level keys are ignored. Unknown node keys are kept in the node's
 * property bag, since they carry operation arguments.
 */
public class IrDocumentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(IrDocumentLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    public IRDocument load(Path path) throws IrLoadException {
        try (InputStream in = Files.newInputStream(path)) {
            IRDocument document = objectMapper.readValue(in, IRDocument.class);
            LOG.info("Loaded IR document '{}' from {} ({} functions, {} resources)",
                    nameOf(document), path, document.functions().size(), document.resources().size());
            return document;
        } catch (IOException e) {
            throw new IrLoadException("Failed to load IR document from " + path + ": " + e.getMessage(), e);
        }
    }

    public IRDocument load(InputStream in) throws IrLoadException {
        try {
            IRDocument document = objectMapper.readValue(in, IRDocument.class);
            LOG.info("Loaded IR document '{}' ({} functions)", nameOf(document), document.functions().size());
            return document;
        } catch (IOException e) {
            throw new IrLoadException("Failed to load IR document: " + e.getMessage(), e);
        }
    }

    public IRDocument parse(String json) throws IrLoadException {
        try {
            return objectMapper.readValue(json, IRDocument.class);
        } catch (JsonProcessingException e) {
            throw new IrLoadException("Invalid IR document JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String write(IRDocument document) throws IrLoadException {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IrLoadException("Failed to serialize IR document: " + e.getOriginalMessage(), e);
        }
    }

    private static String nameOf(IRDocument document) {
        return document.meta() != null && document.meta().name() != null ? document.meta().name() : "<unnamed>";
    }
}
