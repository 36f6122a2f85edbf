package com.endpointdoc.core.operation;

import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;

import java.util.Objects;

/**
 * The operation of one endpoint while it passes through the pipeline.
 *
 * <p>Owned by a single pipeline run; never shared between endpoints.
 */
public class OperationDescription {

    private String path;
    private final PathItem.HttpMethod method;
    private final Operation operation;
    private String requestBodyName;
    private VersionMarker versionMarker;

    public OperationDescription(String path, PathItem.HttpMethod method, Operation operation) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public PathItem.HttpMethod getMethod() {
        return method;
    }

    public Operation getOperation() {
        return operation;
    }

    /**
     * Returns the component name of the request body schema, if the body was seeded from a
     * named shape.
     *
     * @return component name or null
     */
    public String getRequestBodyName() {
        return requestBodyName;
    }

    public void setRequestBodyName(String requestBodyName) {
        this.requestBodyName = requestBodyName;
    }

    public VersionMarker getVersionMarker() {
        return versionMarker;
    }

    public void setVersionMarker(VersionMarker versionMarker) {
        this.versionMarker = versionMarker;
    }

    /**
     * Returns the request body content.
     *
     * @return content, or null when the operation has no body
     */
    public Content requestContent() {
        return operation.getRequestBody() != null ? operation.getRequestBody().getContent() : null;
    }
}
