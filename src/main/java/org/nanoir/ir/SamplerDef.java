package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Texture sampling state. Values are kept as authored so the validator can report
 * unknown modes; {@code null} means the default ({@code nearest} / {@code clamp}).
 *
 * @param filter {@code nearest} or {@code linear}.
 * @param wrap   {@code clamp}, {@code repeat} or {@code mirror}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SamplerDef(
        @JsonProperty("filter") String filter,
        @JsonProperty("wrap") String wrap
) {
    public static final String FILTER_NEAREST = "nearest";
    public static final String FILTER_LINEAR = "linear";
    public static final String WRAP_CLAMP = "clamp";
    public static final String WRAP_REPEAT = "repeat";
    public static final String WRAP_MIRROR = "mirror";

    public String filterOrDefault() {
        return filter == null ? FILTER_NEAREST : filter;
    }

    public String wrapOrDefault() {
        return wrap == null ? WRAP_CLAMP : wrap;
    }
}
