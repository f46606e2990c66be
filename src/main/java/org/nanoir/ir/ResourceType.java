package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The kind of storage a {@link ResourceDef} declares.
 */
public enum ResourceType {
    @JsonProperty("texture2d") TEXTURE2D,
    @JsonProperty("buffer") BUFFER,
    @JsonProperty("atomic_counter") ATOMIC_COUNTER
}
