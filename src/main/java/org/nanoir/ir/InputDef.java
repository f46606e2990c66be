package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A host-provided document input (uniform).
 *
 * @param id           The input id.
 * @param type         The data type; {@code texture2d} inputs become resources.
 * @param label        Optional UI label.
 * @param defaultValue Optional value used when the host supplies none.
 * @param ui           Optional UI hints, kept opaque.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InputDef(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("label") String label,
        @JsonProperty("default") Object defaultValue,
        @JsonProperty("ui") Map<String, Object> ui
) {
    public static InputDef of(String id, String type) {
        return new InputDef(id, type, null, null, null);
    }

    public static InputDef withDefault(String id, String type, Object defaultValue) {
        return new InputDef(id, type, null, defaultValue, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
