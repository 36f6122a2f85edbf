package com.endpointdoc.core.document;

import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.model.PresetParameter;
import com.endpointdoc.core.model.ResponseTypeMetadata;
import com.endpointdoc.core.model.TypeShape;
import com.endpointdoc.core.operation.OperationDescription;
import com.endpointdoc.core.schema.ShapeSchemaGenerator;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Produces the initial operation of an endpoint, before any post-processing.
 *
 * <p>The seeded operation carries the raw route as path, the preset parameters, the request
 * body under the first consumed content type and one response per declared status under its
 * first content type. The operation processors correct and complete it.
 */
public class OperationSeeder {

    private final ShapeSchemaGenerator schemas;

    public OperationSeeder(ShapeSchemaGenerator schemas) {
        this.schemas = schemas;
    }

    /**
     * Seeds the operation of an endpoint.
     *
     * @param descriptor endpoint descriptor
     * @return seeded operation
     * @throws IllegalArgumentException if the verb is not an HTTP method
     */
    public OperationDescription seed(EndpointDescriptor descriptor) {
        PathItem.HttpMethod method;
        try {
            method = PathItem.HttpMethod.valueOf(descriptor.verb().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP verb '" + descriptor.verb()
                + "' on route " + descriptor.routeTemplate(), e);
        }

        Operation operation = new Operation().responses(new ApiResponses());
        String template = descriptor.routeTemplate();
        OperationDescription description = new OperationDescription(
            template.startsWith("/") ? template : "/" + template, method, operation);

        for (PresetParameter preset : descriptor.presetParameters()) {
            operation.addParametersItem(new Parameter()
                .name(preset.name())
                .in(preset.in())
                .required(preset.required())
                .schema(schemas.schemaFor(preset.type())));
        }

        TypeShape requestShape = descriptor.requestShape();
        if (requestShape != null && !requestShape.emptyRequestMarker()) {
            Content content = new Content()
                .addMediaType(descriptor.consumes().get(0), new MediaType().schema(schemas.schemaForShape(requestShape)));
            operation.setRequestBody(new RequestBody().content(content));
            if (!requestShape.listLike()) {
                description.setRequestBodyName(requestShape.name());
            }
        }

        Map<Integer, ResponseTypeMetadata> byStatus = new LinkedHashMap<>();
        for (ResponseTypeMetadata meta : descriptor.responseTypes()) {
            byStatus.put(meta.statusCode(), meta);
        }
        for (ResponseTypeMetadata meta : byStatus.values()) {
            ApiResponse response = new ApiResponse();
            if (meta.hasBody()) {
                Schema<?> schema = meta.type() != null ? schemas.schemaForShape(meta.type()) : schemas.schemaFor(meta.valueType());
                response.setContent(new Content().addMediaType(meta.contentTypes().get(0), new MediaType().schema(schema)));
            }
            operation.getResponses().addApiResponse(String.valueOf(meta.statusCode()), response);
        }
        return description;
    }
}
