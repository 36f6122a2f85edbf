package com.endpointdoc.core.processor;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.operation.OperationDescription;
import com.endpointdoc.core.schema.SchemaRegistry;
import com.endpointdoc.core.schema.ShapeSchemaGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Context passed to operation processors.
 *
 * @param descriptor immutable endpoint descriptor
 * @param operation operation under construction, owned by this run
 * @param registry component schemas shared by the whole document
 * @param schemas generator registering shapes into {@code registry}
 * @param options documentation policy
 * @param exampleMapper mapper serializing user examples with the naming convention
 */
public record OperationContext(
    EndpointDescriptor descriptor,
    OperationDescription operation,
    SchemaRegistry registry,
    ShapeSchemaGenerator schemas,
    DocumentOptions options,
    ObjectMapper exampleMapper
) {
    /**
     * Compact constructor with validation.
     */
    public OperationContext {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(schemas, "schemas must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(exampleMapper, "exampleMapper must not be null");
    }
}
