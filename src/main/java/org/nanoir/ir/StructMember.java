package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named member of a {@link StructDef}.
 *
 * @param name    The member name.
 * @param type    The member data type.
 * @param builtin Optional stage builtin (e.g. {@code position}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructMember(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("builtin") String builtin
) {
    public static StructMember of(String name, String type) {
        return new StructMember(name, type, null);
    }
}
