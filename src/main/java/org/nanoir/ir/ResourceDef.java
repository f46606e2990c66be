package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A document-level texture, buffer or atomic counter.
 *
 * @param id          The resource id.
 * @param type        The resource kind.
 * @param format      Texel format name (textures only); kept as authored.
 * @param dataType    Element type (buffers and counters).
 * @param structType  Optional inline element layout (buffers).
 * @param sampler     Optional sampling state (textures).
 * @param size        Sizing rule.
 * @param persistence Lifecycle policy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceDef(
        @JsonProperty("id") String id,
        @JsonProperty("type") ResourceType type,
        @JsonProperty("format") String format,
        @JsonProperty("dataType") String dataType,
        @JsonProperty("structType") List<StructMember> structType,
        @JsonProperty("sampler") SamplerDef sampler,
        @JsonProperty("size") ResourceSize size,
        @JsonProperty("persistence") Persistence persistence
) {
    public ResourceDef {
        structType = structType == null ? List.of() : List.copyOf(structType);
        persistence = persistence == null ? Persistence.defaults() : persistence;
        size = size == null ? ResourceSize.fixed(1) : size;
    }

    public static ResourceDef buffer(String id, String dataType, ResourceSize size) {
        return new ResourceDef(id, ResourceType.BUFFER, null, dataType, null, null, size, null);
    }

    public static ResourceDef texture(String id, String format, ResourceSize size) {
        return new ResourceDef(id, ResourceType.TEXTURE2D, format, null, null, null, size, null);
    }

    public static ResourceDef atomicCounter(String id, int count) {
        return new ResourceDef(id, ResourceType.ATOMIC_COUNTER, null, "int", null, null, ResourceSize.fixed(count), null);
    }

    public ResourceDef withPersistence(Persistence value) {
        return new ResourceDef(id, type, format, dataType, structType, sampler, size, value);
    }

    public ResourceDef withSampler(SamplerDef value) {
        return new ResourceDef(id, type, format, dataType, structType, value, size, persistence);
    }
}
