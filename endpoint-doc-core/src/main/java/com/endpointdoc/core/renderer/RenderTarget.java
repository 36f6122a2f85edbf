package com.endpointdoc.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how a renderer emits a document.
 *
 * @param outputDirectory directory the document file is written to
 * @param printHeader whether stream renderers print a file header line before the document
 */
public record RenderTarget(
    Path outputDirectory,
    boolean printHeader
) {
    public RenderTarget {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    public static RenderTarget of(Path outputDirectory) {
        return new RenderTarget(outputDirectory, false);
    }

    public RenderTarget withHeader() {
        return new RenderTarget(outputDirectory, true);
    }
}
