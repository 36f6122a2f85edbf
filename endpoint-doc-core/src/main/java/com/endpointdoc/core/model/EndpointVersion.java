package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Version numbers of an endpoint.
 *
 * @param current current version, 0 when unversioned
 * @param startingRelease release the endpoint first appears in
 * @param deprecatedAt release the endpoint is deprecated at, 0 when never
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointVersion(
    @JsonProperty("current") int current,
    @JsonProperty("startingRelease") int startingRelease,
    @JsonProperty("deprecatedAt") int deprecatedAt
) {
    public static EndpointVersion unversioned() {
        return new EndpointVersion(0, 0, 0);
    }

    public static EndpointVersion of(int current) {
        return new EndpointVersion(current, 0, 0);
    }
}
