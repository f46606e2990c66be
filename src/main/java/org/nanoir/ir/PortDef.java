package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A typed function input or output.
 *
 * @param id      The port id, visible as a variable inside the function.
 * @param type    The data type.
 * @param builtin Optional stage builtin bound to this port (e.g. {@code vertex_index}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PortDef(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("builtin") String builtin
) {
    public static PortDef of(String id, String type) {
        return new PortDef(id, type, null);
    }
}
