package com.endpointdoc.core.document;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.operation.OperationDescription;
import com.endpointdoc.core.operation.VersionMarker;
import com.endpointdoc.core.processor.OperationContext;
import com.endpointdoc.core.processor.OperationProcessor;
import com.endpointdoc.core.schema.SchemaRegistry;
import com.endpointdoc.core.schema.ShapeSchemaGenerator;
import com.endpointdoc.core.util.ExampleMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Builds an OpenAPI document from an ordered list of endpoint descriptors.
 *
 * <p>Endpoints are processed one at a time, in order: each is seeded, passed through every
 * {@link OperationProcessor} and attached to its path. A processor returning false drops the
 * operation. Any exception aborts the build, so no partial document is ever returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DocumentOptions options = ConfigLoader.load(Paths.get("endpointdoc.yaml"));
 * BuiltDocument document = new DocumentBuilder(options).build(endpoints);
 * }</pre>
 */
public class DocumentBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocumentBuilder.class);

    private final DocumentOptions options;
    private final List<OperationProcessor> processors;

    /**
     * Creates a builder using the processors registered via SPI.
     *
     * @param options documentation policy
     */
    public DocumentBuilder(DocumentOptions options) {
        this(options, discoverProcessors());
    }

    public DocumentBuilder(DocumentOptions options, List<OperationProcessor> processors) {
        this.options = options;
        this.processors = processors.stream()
            .sorted(Comparator.comparingInt(OperationProcessor::getOrder).thenComparing(OperationProcessor::getId))
            .toList();
    }

    /**
     * Loads all operation processors registered via SPI.
     *
     * @return processors in discovery order
     */
    public static List<OperationProcessor> discoverProcessors() {
        List<OperationProcessor> found = new ArrayList<>();
        ServiceLoader.load(OperationProcessor.class).forEach(found::add);
        log.debug("Discovered {} operation processors", found.size());
        return found;
    }

    public List<OperationProcessor> getProcessors() {
        return processors;
    }

    /**
     * Builds the document.
     *
     * @param endpoints endpoint descriptors in build order
     * @return finished document and version markers
     * @throws RuntimeException any processor failure, after logging it
     */
    public BuiltDocument build(List<EndpointDescriptor> endpoints) {
        OpenAPI openApi = new OpenAPI()
            .info(new Info().title(options.title()).version(options.documentVersion()))
            .components(new Components())
            .paths(new Paths());
        SchemaRegistry registry = new SchemaRegistry(openApi.getComponents());
        ShapeSchemaGenerator schemas = new ShapeSchemaGenerator(registry, options);
        ObjectMapper exampleMapper = ExampleMappers.create(options.namingConvention());
        OperationSeeder seeder = new OperationSeeder(schemas);
        List<VersionMarker> markers = new ArrayList<>();

        log.info("Building document '{}' from {} endpoints", options.title(), endpoints.size());

        for (EndpointDescriptor endpoint : endpoints) {
            OperationDescription operation = seeder.seed(endpoint);
            OperationContext context = new OperationContext(endpoint, operation, registry, schemas, options, exampleMapper);

            if (!runProcessors(context)) {
                log.debug("Operation excluded by processor: {}", endpoint.displayName());
                continue;
            }

            PathItem pathItem = openApi.getPaths().get(operation.getPath());
            if (pathItem == null) {
                pathItem = new PathItem();
                openApi.getPaths().addPathItem(operation.getPath(), pathItem);
            }
            pathItem.operation(operation.getMethod(), operation.getOperation());
            if (operation.getVersionMarker() != null) {
                markers.add(operation.getVersionMarker());
            }
        }

        BuiltDocument document = new BuiltDocument(openApi, markers);
        log.info("Built document with {} operations and {} component schemas",
            document.operationCount(), registry.names().size());
        return document;
    }

    private boolean runProcessors(OperationContext context) {
        for (OperationProcessor processor : processors) {
            try {
                if (!processor.process(context)) {
                    return false;
                }
            } catch (RuntimeException e) {
                log.error("Processor '{}' failed on endpoint {}: {}",
                    processor.getId(), context.descriptor().displayName(), e.getMessage());
                throw e;
            }
        }
        return true;
    }
}
