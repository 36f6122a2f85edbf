package com.endpointdoc.core.operation;

/**
 * Thrown when a request shape exposes no publicly settable field.
 *
 * <p>Aborts the whole document build.
 */
public class UnsupportedRequestShapeException extends IllegalStateException {

    private final String endpointType;
    private final String shapeName;

    public UnsupportedRequestShapeException(String endpointType, String shapeName) {
        super("Request shapes without any publicly settable fields are not supported. "
            + "Offending endpoint: [" + endpointType + "] Offending request shape: [" + shapeName + "]");
        this.endpointType = endpointType;
        this.shapeName = shapeName;
    }

    public String getEndpointType() {
        return endpointType;
    }

    public String getShapeName() {
        return shapeName;
    }
}
