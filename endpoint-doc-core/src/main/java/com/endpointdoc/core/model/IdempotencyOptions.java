package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Idempotency configuration of an endpoint.
 *
 * @param headerName name of the idempotency key header
 * @param headerDescription documentation of the header
 * @param headerType wire type of the header value, string when absent
 * @param example example header value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdempotencyOptions(
    @JsonProperty("headerName") String headerName,
    @JsonProperty("headerDescription") String headerDescription,
    @JsonProperty("headerType") WireType headerType,
    @JsonProperty("example") Object example
) {
    public static final String DEFAULT_HEADER_NAME = "Idempotency-Key";

    /**
     * Compact constructor filling defaults.
     */
    public IdempotencyOptions {
        if (headerName == null || headerName.isBlank()) {
            headerName = DEFAULT_HEADER_NAME;
        }
    }

    public static IdempotencyOptions defaults() {
        return new IdempotencyOptions(null, null, null, null);
    }
}
