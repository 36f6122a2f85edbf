package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Metadata marker of an endpoint managed by this library.
 *
 * <p>Descriptors without a definition are foreign and pass through the pipeline untouched.
 *
 * @param endpointType name of the endpoint type
 * @param version endpoint version numbers
 * @param summary developer-authored documentation, may be null
 * @param operationId explicit operation id, may be null
 * @param tagOverride explicit tag replacing the derived one, may be null
 * @param dontAutoTag whether the endpoint opts out of auto-tagging
 * @param deprecated whether the operation is marked deprecated
 * @param idempotency idempotency configuration, null when the endpoint is not idempotent
 * @param typeSummary documented summary of the endpoint type, used when the summary is silent
 * @param typeDescription documented description of the endpoint type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointDefinition(
    @JsonProperty("endpointType") String endpointType,
    @JsonProperty("version") EndpointVersion version,
    @JsonProperty("summary") EndpointSummary summary,
    @JsonProperty("operationId") String operationId,
    @JsonProperty("tagOverride") String tagOverride,
    @JsonProperty("dontAutoTag") boolean dontAutoTag,
    @JsonProperty("deprecated") boolean deprecated,
    @JsonProperty("idempotency") IdempotencyOptions idempotency,
    @JsonProperty("typeSummary") String typeSummary,
    @JsonProperty("typeDescription") String typeDescription
) {
    /**
     * Compact constructor with validation.
     */
    public EndpointDefinition {
        Objects.requireNonNull(endpointType, "endpointType must not be null");
        if (version == null) {
            version = EndpointVersion.unversioned();
        }
    }

    /**
     * Creates an unversioned definition without documentation.
     *
     * @param endpointType endpoint type name
     * @return definition
     */
    public static EndpointDefinition of(String endpointType) {
        return new EndpointDefinition(endpointType, null, null, null, null, false, false, null, null, null);
    }

    public EndpointDefinition withVersion(EndpointVersion version) {
        return new EndpointDefinition(endpointType, version, summary, operationId, tagOverride, dontAutoTag,
            deprecated, idempotency, typeSummary, typeDescription);
    }

    public EndpointDefinition withSummary(EndpointSummary summary) {
        return new EndpointDefinition(endpointType, version, summary, operationId, tagOverride, dontAutoTag,
            deprecated, idempotency, typeSummary, typeDescription);
    }

    public EndpointDefinition withTagOverride(String tagOverride) {
        return new EndpointDefinition(endpointType, version, summary, operationId, tagOverride, dontAutoTag,
            deprecated, idempotency, typeSummary, typeDescription);
    }

    public EndpointDefinition withIdempotency(IdempotencyOptions idempotency) {
        return new EndpointDefinition(endpointType, version, summary, operationId, tagOverride, dontAutoTag,
            deprecated, idempotency, typeSummary, typeDescription);
    }
}
