package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a function runs: on the host orchestrating commands, or as a shader stage.
 */
public enum FunctionType {
    @JsonProperty("cpu") CPU,
    @JsonProperty("shader") SHADER
}
