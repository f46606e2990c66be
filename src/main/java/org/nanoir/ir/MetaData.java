package org.nanoir.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptive document metadata. Carries no semantics for validation or execution.
 *
 * @param name        The display name of the document.
 * @param author      The optional author.
 * @param description The optional description.
 * @param license     The optional license identifier.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetaData(
        @JsonProperty("name") String name,
        @JsonProperty("author") String author,
        @JsonProperty("description") String description,
        @JsonProperty("license") String license
) {
    public static MetaData named(String name) {
        return new MetaData(name, null, null, null);
    }
}
