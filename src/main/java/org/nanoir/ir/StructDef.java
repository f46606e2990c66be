package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * A shared struct layout.
 *
 * @param id      The struct type name.
 * @param members The ordered members.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructDef(
        @JsonProperty("id") String id,
        @JsonProperty("members") List<StructMember> members
) {
    public StructDef {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public Optional<StructMember> member(String name) {
        return members.stream().filter(m -> m.name().equals(name)).findFirst();
    }
}
