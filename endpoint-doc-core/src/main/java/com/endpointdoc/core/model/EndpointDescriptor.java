package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable description of one HTTP endpoint as supplied by the routing collaborator.
 *
 * @param routeTemplate route template, possibly carrying constraints ({@code orders/{id:int}})
 * @param verb HTTP verb
 * @param consumes request content types, first one used for the seeded body
 * @param requestShape reflected request type, null when the endpoint takes no request
 * @param responseTypes declared response types in declaration order
 * @param presetParameters parameters pre-populated by an external routing add-on
 * @param definition metadata marker, null for foreign endpoints
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointDescriptor(
    @JsonProperty("routeTemplate") String routeTemplate,
    @JsonProperty("verb") String verb,
    @JsonProperty("consumes") List<String> consumes,
    @JsonProperty("requestShape") TypeShape requestShape,
    @JsonProperty("responseTypes") List<ResponseTypeMetadata> responseTypes,
    @JsonProperty("presetParameters") List<PresetParameter> presetParameters,
    @JsonProperty("definition") EndpointDefinition definition
) {
    /**
     * Compact constructor with validation.
     */
    public EndpointDescriptor {
        Objects.requireNonNull(routeTemplate, "routeTemplate must not be null");
        Objects.requireNonNull(verb, "verb must not be null");
        verb = verb.trim().toUpperCase(Locale.ROOT);
        consumes = consumes == null || consumes.isEmpty() ? List.of(ResponseTypeMetadata.JSON) : List.copyOf(consumes);
        responseTypes = responseTypes == null ? List.of() : List.copyOf(responseTypes);
        presetParameters = presetParameters == null ? List.of() : List.copyOf(presetParameters);
    }

    /**
     * Returns whether the endpoint carries the recognized metadata marker.
     *
     * @return true if managed by this library
     */
    @JsonIgnore
    public boolean isManaged() {
        return definition != null;
    }

    @JsonIgnore
    public boolean isGet() {
        return "GET".equals(verb);
    }

    /**
     * Returns a short identifier for log messages.
     *
     * @return verb and route
     */
    @JsonIgnore
    public String displayName() {
        return verb + " " + routeTemplate;
    }

    public static Builder builder(String verb, String routeTemplate) {
        return new Builder(verb, routeTemplate);
    }

    /**
     * Fluent builder for {@link EndpointDescriptor}.
     */
    public static final class Builder {
        private final String verb;
        private final String routeTemplate;
        private List<String> consumes;
        private TypeShape requestShape;
        private List<ResponseTypeMetadata> responseTypes;
        private List<PresetParameter> presetParameters;
        private EndpointDefinition definition;

        private Builder(String verb, String routeTemplate) {
            this.verb = verb;
            this.routeTemplate = routeTemplate;
        }

        public Builder consumes(String... consumes) {
            this.consumes = List.of(consumes);
            return this;
        }

        public Builder request(TypeShape requestShape) {
            this.requestShape = requestShape;
            return this;
        }

        public Builder responses(ResponseTypeMetadata... responseTypes) {
            this.responseTypes = List.of(responseTypes);
            return this;
        }

        public Builder presetParameters(PresetParameter... presetParameters) {
            this.presetParameters = List.of(presetParameters);
            return this;
        }

        public Builder definition(EndpointDefinition definition) {
            this.definition = definition;
            return this;
        }

        public EndpointDescriptor build() {
            return new EndpointDescriptor(routeTemplate, verb, consumes, requestShape, responseTypes,
                presetParameters, definition);
        }
    }
}
