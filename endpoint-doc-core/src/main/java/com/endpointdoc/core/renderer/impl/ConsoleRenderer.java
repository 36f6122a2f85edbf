package com.endpointdoc.core.renderer.impl;

import com.endpointdoc.core.renderer.DocumentRenderer;
import com.endpointdoc.core.renderer.RenderTarget;
import com.endpointdoc.core.renderer.RenderedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints the document to a stream, standard output by default.
 *
 * <p>When {@link RenderTarget#printHeader()} is set, a {@code # openapi.json (application/json)}
 * line precedes the document.
 */
public class ConsoleRenderer implements DocumentRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(RenderedDocument document, RenderTarget target) {
        logger.debug("Rendering {} to console", document.relativePath());

        if (target.printHeader()) {
            out.println("# " + document.relativePath() + " (" + document.format().contentType() + ")");
        }
        out.println(document.content());
        out.flush();
    }
}
