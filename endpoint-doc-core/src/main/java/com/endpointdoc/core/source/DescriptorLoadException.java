package com.endpointdoc.core.source;

/**
 * Thrown when an endpoint descriptor file cannot be read or parsed.
 */
public class DescriptorLoadException extends RuntimeException {

    public DescriptorLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public DescriptorLoadException(String message) {
        super(message);
    }
}
