package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Parameter pre-populated on the operation by the routing collaborator, such as the version
 * route parameter contributed by an external versioning add-on.
 *
 * @param name parameter name
 * @param in parameter location ("path", "query", "header")
 * @param required whether the parameter is required
 * @param type wire type of the value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresetParameter(
    @JsonProperty("name") String name,
    @JsonProperty("in") String in,
    @JsonProperty("required") boolean required,
    @JsonProperty("type") WireType type
) {
    /**
     * Compact constructor with validation.
     */
    public PresetParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(in, "in must not be null");
        if (type == null) {
            type = WireType.string();
        }
    }
}
