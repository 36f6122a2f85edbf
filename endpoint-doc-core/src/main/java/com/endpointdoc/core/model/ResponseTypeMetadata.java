package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declared response type for one status code.
 *
 * @param statusCode HTTP status code
 * @param type response shape, null for responses without an object body
 * @param valueType non-object body type such as a byte array, used when {@code type} is null
 * @param contentTypes content types the response is produced as
 * @param example example attached to the declaration itself
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseTypeMetadata(
    @JsonProperty("statusCode") int statusCode,
    @JsonProperty("type") TypeShape type,
    @JsonProperty("valueType") WireType valueType,
    @JsonProperty("contentTypes") List<String> contentTypes,
    @JsonProperty("example") Object example
) {
    /**
     * Default response content type.
     */
    public static final String JSON = "application/json";

    /**
     * Compact constructor with validation.
     */
    public ResponseTypeMetadata {
        contentTypes = contentTypes == null || contentTypes.isEmpty() ? List.of(JSON) : List.copyOf(contentTypes);
    }

    /**
     * Returns whether the response carries a body.
     *
     * @return true if an object or value type is declared
     */
    @JsonIgnore
    public boolean hasBody() {
        return type != null || valueType != null;
    }

    public ResponseTypeMetadata withContentTypes(String... contentTypes) {
        return new ResponseTypeMetadata(statusCode, type, valueType, List.of(contentTypes), example);
    }

    public ResponseTypeMetadata withExample(Object example) {
        return new ResponseTypeMetadata(statusCode, type, valueType, contentTypes, example);
    }

    public static ResponseTypeMetadata of(int statusCode, TypeShape type) {
        return new ResponseTypeMetadata(statusCode, type, null, null, null);
    }

    public static ResponseTypeMetadata ofValue(int statusCode, WireType valueType) {
        return new ResponseTypeMetadata(statusCode, null, valueType, null, null);
    }

    public static ResponseTypeMetadata empty(int statusCode) {
        return new ResponseTypeMetadata(statusCode, null, null, null, null);
    }
}
