package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cross-frame retention policy of a resource.
 * <p>
 * A resource with {@code retain = false} is refilled at the start of every frame, exactly
 * like one flagged {@code clearEveryFrame}. A document that omits {@code retain} retains.
 *
 * @param retain          Keep contents between frames.
 * @param clearOnResize   Refill with {@code clearValue} (or zero) when resized.
 * @param clearEveryFrame Refill at the start of every frame.
 * @param clearValue      Optional fill value; also applied at allocation.
 * @param cpuAccess       Host may read the contents back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Persistence(
        @JsonProperty("retain") boolean retain,
        @JsonProperty("clearOnResize") boolean clearOnResize,
        @JsonProperty("clearEveryFrame") boolean clearEveryFrame,
        @JsonProperty("clearValue") Object clearValue,
        @JsonProperty("cpuAccess") boolean cpuAccess
) {
    @JsonCreator
    static Persistence fromJson(
            @JsonProperty("retain") Boolean retain,
            @JsonProperty("clearOnResize") boolean clearOnResize,
            @JsonProperty("clearEveryFrame") boolean clearEveryFrame,
            @JsonProperty("clearValue") Object clearValue,
            @JsonProperty("cpuAccess") boolean cpuAccess) {
        return new Persistence(retain == null || retain, clearOnResize, clearEveryFrame, clearValue, cpuAccess);
    }

    public static Persistence defaults() {
        return new Persistence(true, false, false, null, true);
    }

    /**
     * @return Whether the resource is refilled when a frame begins.
     */
    public boolean clearsEachFrame() {
        return !retain || clearEveryFrame;
    }

    public Persistence withRetain(boolean value) {
        return new Persistence(value, clearOnResize, clearEveryFrame, clearValue, cpuAccess);
    }

    public Persistence withClearOnResize(boolean value) {
        return new Persistence(retain, value, clearEveryFrame, clearValue, cpuAccess);
    }

    public Persistence withClearValue(Object value) {
        return new Persistence(retain, clearOnResize, clearEveryFrame, value, cpuAccess);
    }

    public Persistence withClearEveryFrame(boolean value) {
        return new Persistence(retain, clearOnResize, value, clearValue, cpuAccess);
    }
}
