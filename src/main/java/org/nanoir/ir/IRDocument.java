package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * The top-level IR container produced by an authoring tool.
 *
 * @param version    The document format version.
 * @param meta       Descriptive metadata.
 * @param entryPoint The id of the {@code cpu} function executed first.
 * @param inputs     Host-provided inputs.
 * @param resources  Textures, buffers and atomic counters.
 * @param structs    Shared struct layouts.
 * @param functions  All functions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IRDocument(
        @JsonProperty("version") String version,
        @JsonProperty("meta") MetaData meta,
        @JsonProperty("entryPoint") String entryPoint,
        @JsonProperty("inputs") List<InputDef> inputs,
        @JsonProperty("resources") List<ResourceDef> resources,
        @JsonProperty("structs") List<StructDef> structs,
        @JsonProperty("functions") List<FunctionDef> functions
) {
    public IRDocument {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        resources = resources == null ? List.of() : List.copyOf(resources);
        structs = structs == null ? List.of() : List.copyOf(structs);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public Optional<FunctionDef> findFunction(String id) {
        return functions.stream().filter(f -> f.id().equals(id)).findFirst();
    }

    public Optional<ResourceDef> findResource(String id) {
        return resources.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public Optional<InputDef> findInput(String id) {
        return inputs.stream().filter(i -> i.id().equals(id)).findFirst();
    }

    public Optional<StructDef> findStruct(String id) {
        return structs.stream().filter(s -> s.id().equals(id)).findFirst();
    }
}
