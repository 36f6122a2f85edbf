package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A labelled request example authored by the developer.
 *
 * @param value example request object
 * @param label label of the example (defaults to "Example")
 * @param summary short summary
 * @param description longer description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestExample(
    @JsonProperty("value") Object value,
    @JsonProperty("label") String label,
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description
) {
    /**
     * Compact constructor with validation.
     */
    public RequestExample {
        Objects.requireNonNull(value, "value must not be null");
        if (label == null || label.isBlank()) {
            label = "Example";
        }
    }

    public static RequestExample of(Object value) {
        return new RequestExample(value, null, null, null);
    }

    public static RequestExample of(Object value, String label) {
        return new RequestExample(value, label, null, null);
    }
}
