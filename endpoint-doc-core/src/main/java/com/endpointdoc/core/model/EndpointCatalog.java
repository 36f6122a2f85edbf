package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root of a descriptor file: the ordered list of endpoints to document.
 *
 * @param endpoints endpoint descriptors in build order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointCatalog(
    @JsonProperty("endpoints") List<EndpointDescriptor> endpoints
) {
    public EndpointCatalog {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
    }
}
