package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * How a resource obtains its dimensions.
 *
 * @param mode  The sizing mode.
 * @param value For {@code fixed}: an element count or {@code [width, height]}.
 * @param scale For {@code viewport}: optional scalar or {@code [sx, sy]} factor.
 * @param ref   For {@code reference}: the id of the resource whose size is mirrored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceSize(
        @JsonProperty("mode") Mode mode,
        @JsonProperty("value") Object value,
        @JsonProperty("scale") Object scale,
        @JsonProperty("ref") String ref
) {
    public enum Mode {
        @JsonProperty("fixed") FIXED,
        @JsonProperty("viewport") VIEWPORT,
        @JsonProperty("reference") REFERENCE,
        @JsonProperty("cpu_driven") CPU_DRIVEN
    }

    public static ResourceSize fixed(int count) {
        return new ResourceSize(Mode.FIXED, count, null, null);
    }

    public static ResourceSize fixed(int width, int height) {
        return new ResourceSize(Mode.FIXED, List.of(width, height), null, null);
    }

    public static ResourceSize viewport() {
        return new ResourceSize(Mode.VIEWPORT, null, null, null);
    }

    public static ResourceSize reference(String ref) {
        return new ResourceSize(Mode.REFERENCE, null, null, ref);
    }

    public static ResourceSize cpuDriven() {
        return new ResourceSize(Mode.CPU_DRIVEN, null, null, null);
    }

    /**
     * Returns the fixed 1-D element count, or -1 when the size is not a fixed scalar.
     *
     * @return The fixed scalar size or -1.
     */
    public int fixedScalar() {
        if (mode == Mode.FIXED && value instanceof Number n) {
            return n.intValue();
        }
        return -1;
    }
}
