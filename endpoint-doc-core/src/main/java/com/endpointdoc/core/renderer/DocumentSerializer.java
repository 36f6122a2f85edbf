package com.endpointdoc.core.renderer;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Yaml;
import io.swagger.v3.oas.models.OpenAPI;

/**
 * Serializes OpenAPI documents with swagger-core's preconfigured mappers.
 */
public final class DocumentSerializer {

    /**
     * Base name of rendered document files.
     */
    public static final String DEFAULT_BASE_NAME = "openapi";

    private DocumentSerializer() {
        // Utility class
    }

    /**
     * Serializes a document.
     *
     * @param openApi document
     * @param format wire format
     * @return pretty-printed document
     * @throws IllegalStateException if serialization fails
     */
    public static String serialize(OpenAPI openApi, DocumentFormat format) {
        try {
            return switch (format) {
                case JSON -> Json.pretty().writeValueAsString(openApi);
                case YAML -> Yaml.pretty().writeValueAsString(openApi);
            };
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document as " + format, e);
        }
    }

    /**
     * Serializes a document into a renderable file named {@code openapi.<ext>}.
     *
     * @param openApi document
     * @param format wire format
     * @return rendered document
     */
    public static RenderedDocument render(OpenAPI openApi, DocumentFormat format) {
        return new RenderedDocument(DEFAULT_BASE_NAME + "." + format.extension(), serialize(openApi, format), format);
    }
}
