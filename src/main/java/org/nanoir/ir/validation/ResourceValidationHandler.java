package org.nanoir.ir.validation;

import org.nanoir.ir.IRDocument;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.ResourceSize;
import org.nanoir.ir.ResourceType;
import org.nanoir.ir.SamplerDef;
import org.nanoir.ir.TextureFormat;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;

import java.util.List;
import java.util.Set;

/**
 * Checks resource declarations: texture formats and sampler modes, buffer element types,
 * atomic counter element types and size references.
 */
public class ResourceValidationHandler implements IValidationHandler {

    private static final Set<String> WRAP_MODES = Set.of(SamplerDef.WRAP_CLAMP, SamplerDef.WRAP_REPEAT, SamplerDef.WRAP_MIRROR);
    private static final Set<String> FILTER_MODES = Set.of(SamplerDef.FILTER_NEAREST, SamplerDef.FILTER_LINEAR);

    @Override
    public void validate(IRDocument document, DiagnosticsEngine diagnostics) {
        List<ResourceDef> resources = document.resources();
        for (int i = 0; i < resources.size(); i++) {
            ResourceDef res = resources.get(i);
            if (res.type() == null) {
                diagnostics.reportError(List.of("resources", i, "type"), null,
                        "Resource '" + res.id() + "' missing required 'type' property");
                continue;
            }
            switch (res.type()) {
                case TEXTURE2D -> validateTexture(res, i, diagnostics);
                case BUFFER -> validateBuffer(document, res, i, diagnostics);
                case ATOMIC_COUNTER -> validateCounter(res, i, diagnostics);
            }
            validateSize(document, res, i, diagnostics);
        }
    }

    private void validateTexture(ResourceDef res, int index, DiagnosticsEngine diagnostics) {
        if (res.format() == null) {
            diagnostics.reportError(List.of("resources", index, "format"), null,
                    "Texture resource '" + res.id() + "' missing required 'format' property");
        } else if (TextureFormat.fromWireName(res.format()).isEmpty()) {
            diagnostics.reportError(List.of("resources", index, "format"), null,
                    "Texture resource '" + res.id() + "' has invalid format '" + res.format() + "'");
        }
        SamplerDef sampler = res.sampler();
        if (sampler == null) return;
        if (sampler.wrap() != null && !WRAP_MODES.contains(sampler.wrap())) {
            diagnostics.reportError(List.of("resources", index, "sampler", "wrap"), null,
                    "Texture resource '" + res.id() + "' has invalid wrap mode '" + sampler.wrap() + "'");
        }
        if (sampler.filter() != null && !FILTER_MODES.contains(sampler.filter())) {
            diagnostics.reportError(List.of("resources", index, "sampler", "filter"), null,
                    "Texture resource '" + res.id() + "' has invalid filter mode '" + sampler.filter() + "'");
        }
    }

    private void validateBuffer(IRDocument document, ResourceDef res, int index, DiagnosticsEngine diagnostics) {
        if (res.dataType() == null) {
            diagnostics.reportError(List.of("resources", index, "dataType"), null,
                    "Buffer resource '" + res.id() + "' missing required 'dataType' property");
        } else {
            DataTypes.check(document, res.dataType(), List.of("resources", index, "dataType"),
                    "Buffer resource '" + res.id() + "'", diagnostics);
        }
    }

    private void validateCounter(ResourceDef res, int index, DiagnosticsEngine diagnostics) {
        if (res.dataType() != null && !"int".equals(res.dataType())) {
            diagnostics.reportError(List.of("resources", index, "dataType"), null,
                    "Atomic counter resource '" + res.id() + "' must have dataType 'int', but got '" + res.dataType() + "'");
        }
    }

    private void validateSize(IRDocument document, ResourceDef res, int index, DiagnosticsEngine diagnostics) {
        ResourceSize size = res.size();
        if (size.mode() == ResourceSize.Mode.REFERENCE && document.findResource(size.ref()).isEmpty()) {
            diagnostics.reportError(List.of("resources", index, "size", "ref"), null,
                    "Resource '" + res.id() + "' size references unknown resource '" + size.ref() + "'");
        }
    }
}
