package com.endpointdoc.core.renderer;

/**
 * Writes a serialized document to an output destination.
 *
 * <p>Implementations should throw {@link IllegalStateException} when the destination cannot be
 * written.
 */
public interface DocumentRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders the document.
     *
     * @param document serialized document
     * @param target output directory and presentation flags
     * @throws IllegalStateException if the document cannot be written
     */
    void render(RenderedDocument document, RenderTarget target);
}
