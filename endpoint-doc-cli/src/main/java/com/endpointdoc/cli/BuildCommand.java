package com.endpointdoc.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.endpointdoc.core.config.ConfigLoader;
import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.document.BuiltDocument;
import com.endpointdoc.core.document.DocumentBuilder;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.renderer.DocumentFormat;
import com.endpointdoc.core.renderer.DocumentRenderer;
import com.endpointdoc.core.renderer.DocumentSerializer;
import com.endpointdoc.core.renderer.RenderTarget;
import com.endpointdoc.core.renderer.RenderedDocument;
import com.endpointdoc.core.source.DescriptorLoader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to build an OpenAPI document from endpoint descriptors.
 *
 * <p>Orchestrates the full pipeline:
 * <ol>
 *   <li>Load the documentation policy from {@code endpointdoc.yaml}</li>
 *   <li>Load endpoint descriptors from a file or directory</li>
 *   <li>Run every endpoint through the operation processors</li>
 *   <li>Serialize the document and hand it to a renderer</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Write ./openapi.json
 * endpointdoc build endpoints/
 *
 * # Write docs/api/openapi.yaml using a custom policy
 * endpointdoc build endpoints/ -c api-policy.yaml -o docs/api --format yaml
 * }</pre>
 */
@Command(
    name = "build",
    description = "Build an OpenAPI document from endpoint descriptors",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Parameters(
        index = "0",
        description = "Descriptor file or directory (default: current directory)",
        defaultValue = "."
    )
    private Path descriptorPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: endpointdoc.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: current directory)"
    )
    private Path outputDir = Paths.get(".");

    @Option(
        names = {"-f", "--format"},
        description = "Document format: json or yaml (default: json)"
    )
    private String format = "json";

    @Option(
        names = {"--console"},
        description = "Print the document instead of writing a file"
    )
    private boolean console;

    @Override
    public Integer call() {
        try {
            DocumentFormat documentFormat = DocumentFormat.parse(format);
            DocumentOptions options = ConfigLoader.load(configPath);

            log.info("Building document from: {}", descriptorPath.toAbsolutePath());
            List<EndpointDescriptor> endpoints = new DescriptorLoader().load(descriptorPath);
            BuiltDocument document = buildDocument(options, endpoints);

            RenderedDocument rendered = DocumentSerializer.render(document.openApi(), documentFormat);
            DocumentRenderer renderer = findRenderer(console ? "console" : "filesystem");
            renderer.render(rendered, RenderTarget.of(outputDir));

            if (!console) {
                System.out.println("✓ Loaded " + endpoints.size() + " endpoints");
                System.out.println("✓ Documented " + document.operationCount() + " operations");
                System.out.println("✓ Wrote " + outputDir.resolve(rendered.relativePath()));
            }
            return 0;

        } catch (Exception e) {
            log.error("Build failed", e);
            System.err.println("✗ Build failed: " + e.getMessage());
            return 1;
        }
    }

    private BuiltDocument buildDocument(DocumentOptions options, List<EndpointDescriptor> endpoints) {
        DocumentBuilder builder = new DocumentBuilder(options);
        if (builder.getProcessors().isEmpty()) {
            log.warn("No operation processors found; operations are emitted as seeded");
        }
        return builder.build(endpoints);
    }

    /**
     * Finds a renderer registered via SPI.
     *
     * @param id renderer identifier
     * @return matching renderer
     * @throws IllegalStateException if no renderer has that id
     */
    static DocumentRenderer findRenderer(String id) {
        for (DocumentRenderer renderer : ServiceLoader.load(DocumentRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No renderer registered with id: " + id);
    }
}
