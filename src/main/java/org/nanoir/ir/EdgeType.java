package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Distinguishes value dependencies from ordering dependencies.
 */
public enum EdgeType {
    @JsonProperty("data") DATA,
    @JsonProperty("execution") EXECUTION;

    public String id() {
        return this == DATA ? "data" : "execution";
    }
}
