package com.endpointdoc.core.renderer;

import java.util.Objects;

/**
 * A serialized document ready to be written.
 *
 * @param relativePath relative path for the file (e.g., "openapi.json")
 * @param content serialized document
 * @param format wire format of {@code content}
 */
public record RenderedDocument(
    String relativePath,
    String content,
    DocumentFormat format
) {
    /**
     * Compact constructor with validation.
     */
    public RenderedDocument {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }
}
