package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A response header declared by the developer for one status code.
 *
 * @param statusCode status code the header belongs to
 * @param headerName header name
 * @param description header documentation
 * @param example example value, also used to infer the header schema
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseHeader(
    @JsonProperty("statusCode") int statusCode,
    @JsonProperty("headerName") String headerName,
    @JsonProperty("description") String description,
    @JsonProperty("example") Object example
) {
    /**
     * Compact constructor with validation.
     */
    public ResponseHeader {
        Objects.requireNonNull(headerName, "headerName must not be null");
    }
}
