package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A function-local mutable variable.
 *
 * @param id           The variable id.
 * @param type         The data type, used for the default value.
 * @param initialValue Optional initial literal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VariableDef(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("initialValue") Object initialValue
) {
    public static VariableDef of(String id, String type) {
        return new VariableDef(id, type, null);
    }
}
