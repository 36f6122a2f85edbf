package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Developer-authored documentation of one endpoint.
 *
 * @param summary one-line summary
 * @param description longer description
 * @param params field name to description
 * @param requestExamples labelled request examples in declaration order
 * @param responses status code to response description
 * @param responseParams status code to (field name to description)
 * @param responseExamples status code to example response object
 * @param responseHeaders declared response headers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointSummary(
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description,
    @JsonProperty("params") Map<String, String> params,
    @JsonProperty("requestExamples") List<RequestExample> requestExamples,
    @JsonProperty("responses") Map<Integer, String> responses,
    @JsonProperty("responseParams") Map<Integer, Map<String, String>> responseParams,
    @JsonProperty("responseExamples") Map<Integer, Object> responseExamples,
    @JsonProperty("responseHeaders") List<ResponseHeader> responseHeaders
) {
    /**
     * Compact constructor replacing absent collections with empty ones.
     */
    public EndpointSummary {
        if (params == null) {
            params = Map.of();
        }
        requestExamples = requestExamples == null ? List.of() : List.copyOf(requestExamples);
        if (responses == null) {
            responses = Map.of();
        }
        if (responseParams == null) {
            responseParams = Map.of();
        }
        if (responseExamples == null) {
            responseExamples = Map.of();
        }
        responseHeaders = responseHeaders == null ? List.of() : List.copyOf(responseHeaders);
    }

    /**
     * Creates a summary carrying only free text.
     *
     * @param summary one-line summary
     * @param description longer description
     * @return endpoint summary
     */
    public static EndpointSummary of(String summary, String description) {
        return new EndpointSummary(summary, description, null, null, null, null, null, null);
    }

    public EndpointSummary withParams(Map<String, String> params) {
        return new EndpointSummary(summary, description, params, requestExamples, responses,
            responseParams, responseExamples, responseHeaders);
    }

    public EndpointSummary withRequestExamples(List<RequestExample> requestExamples) {
        return new EndpointSummary(summary, description, params, requestExamples, responses,
            responseParams, responseExamples, responseHeaders);
    }

    public EndpointSummary withResponses(Map<Integer, String> responses) {
        return new EndpointSummary(summary, description, params, requestExamples, responses,
            responseParams, responseExamples, responseHeaders);
    }

    public EndpointSummary withResponseParams(Map<Integer, Map<String, String>> responseParams) {
        return new EndpointSummary(summary, description, params, requestExamples, responses,
            responseParams, responseExamples, responseHeaders);
    }

    public EndpointSummary withResponseExamples(Map<Integer, Object> responseExamples) {
        return new EndpointSummary(summary, description, params, requestExamples, responses,
            responseParams, responseExamples, responseHeaders);
    }

    public EndpointSummary withResponseHeaders(List<ResponseHeader> responseHeaders) {
        return new EndpointSummary(summary, description, params, requestExamples, responses,
            responseParams, responseExamples, responseHeaders);
    }
}
