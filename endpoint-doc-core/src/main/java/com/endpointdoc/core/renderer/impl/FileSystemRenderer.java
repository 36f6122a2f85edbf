package com.endpointdoc.core.renderer.impl;

import com.endpointdoc.core.renderer.DocumentRenderer;
import com.endpointdoc.core.renderer.RenderTarget;
import com.endpointdoc.core.renderer.RenderedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes the document to the filesystem.
 *
 * <p>Creates the output directory automatically and overwrites an existing file.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderedDocument document = DocumentSerializer.render(openApi, DocumentFormat.YAML);
 * new FileSystemRenderer().render(document, RenderTarget.of(Paths.get("docs/api")));
 * // Creates: docs/api/openapi.yaml
 * }</pre>
 */
public class FileSystemRenderer implements DocumentRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(RenderedDocument document, RenderTarget target) {
        Path targetPath = target.outputDirectory().resolve(document.relativePath());
        logger.debug("Writing document to: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, document.content());
            logger.info("Wrote document: {} ({} bytes)", targetPath, document.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write document: " + targetPath, e);
        }
    }
}
