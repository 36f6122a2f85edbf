package com.endpointdoc.core.config;

/**
 * Specification dialect the document is assembled for.
 *
 * <p>The legacy dialect has no file-in-body support, so file fields are moved into
 * {@code formData} parameters and array response examples are written as strings.
 *
 * <p>Only those two rules change. The result is always an OpenAPI 3 document object and is
 * serialized as such; {@code SWAGGER_2} does not produce a Swagger 2.0 file.
 */
public enum SpecDialect {
    OPENAPI_3,
    SWAGGER_2
}
