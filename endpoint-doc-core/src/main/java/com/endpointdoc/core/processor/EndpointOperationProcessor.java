package com.endpointdoc.core.processor;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.model.BindingKind;
import com.endpointdoc.core.model.EndpointDefinition;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.model.EndpointSummary;
import com.endpointdoc.core.model.EndpointVersion;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.RequestExample;
import com.endpointdoc.core.model.TypeShape;
import com.endpointdoc.core.operation.ExampleSynthesizer;
import com.endpointdoc.core.operation.OperationDescription;
import com.endpointdoc.core.operation.ParamDescription;
import com.endpointdoc.core.operation.ParamDescriptionCollector;
import com.endpointdoc.core.operation.ParameterClassifier;
import com.endpointdoc.core.operation.ParameterFactory;
import com.endpointdoc.core.operation.ResponseAssembler;
import com.endpointdoc.core.operation.RouteNormalizer;
import com.endpointdoc.core.operation.UnsupportedRequestShapeException;
import com.endpointdoc.core.operation.VersionMarker;
import com.endpointdoc.core.schema.ExampleSampler;
import com.endpointdoc.core.schema.SchemaGraph;
import com.endpointdoc.core.schema.SchemaPruner;
import com.endpointdoc.core.schema.SchemaRegistry;
import com.endpointdoc.core.schema.ShapeSchemaGenerator;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a seeded operation into the final operation of a managed endpoint.
 *
 * <p>Runs a fixed sequence:
 * <ol>
 *   <li>canonical path, operation id, tag and version marker</li>
 *   <li>request content-type propagation</li>
 *   <li>responses</li>
 *   <li>summary, description, deprecation</li>
 *   <li>rejection of request shapes without settable fields</li>
 *   <li>merged field descriptions</li>
 *   <li>parameter classification and body pruning</li>
 *   <li>parameter insertion</li>
 *   <li>body collapse and empty component removal</li>
 *   <li>body/form flattening</li>
 *   <li>request examples</li>
 * </ol>
 * Endpoints without an {@link EndpointDefinition} are left untouched.
 */
public class EndpointOperationProcessor implements OperationProcessor {

    private static final Logger log = LoggerFactory.getLogger(EndpointOperationProcessor.class);

    public static final String ID = "endpoint";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public int getOrder() {
        return 0;
    }

    @Override
    public boolean process(OperationContext context) {
        EndpointDescriptor descriptor = context.descriptor();
        if (!descriptor.isManaged()) {
            log.debug("Leaving foreign endpoint untouched: {}", descriptor.displayName());
            return true;
        }

        EndpointDefinition definition = descriptor.definition();
        DocumentOptions options = context.options();
        OperationDescription description = context.operation();
        Operation operation = description.getOperation();
        SchemaRegistry registry = context.registry();
        ShapeSchemaGenerator schemas = context.schemas();
        SchemaGraph graph = new SchemaGraph(registry);
        ExampleSampler sampler = new ExampleSampler(registry, context.exampleMapper());

        log.debug("Processing endpoint: {} ({})", descriptor.displayName(), definition.endpointType());

        normalizeRoute(description, definition, options);
        propagateRequestContentTypes(description, descriptor);

        new ResponseAssembler(registry, schemas, sampler, options, context.exampleMapper())
            .assemble(description, descriptor);

        EndpointSummary summary = definition.summary();
        operation.setSummary(summary != null && summary.summary() != null ? summary.summary() : definition.typeSummary());
        operation.setDescription(summary != null && summary.description() != null
            ? summary.description()
            : definition.typeDescription());
        if (definition.deprecated()) {
            operation.setDeprecated(true);
        }

        verifyRequestShape(descriptor, options);

        ParamDescriptionCollector collector = new ParamDescriptionCollector(graph, context.exampleMapper());
        Map<String, ParamDescription> descriptions = collector.collect(description.requestContent(), summary);
        collector.applyTo(description.requestContent(), descriptions);

        ParameterFactory factory = new ParameterFactory(schemas, sampler, options, context.exampleMapper(),
            descriptions, RouteNormalizer.constraintTypes(descriptor.routeTemplate(), options));
        ParameterClassifier.Classification classification =
            new ParameterClassifier(options, new SchemaPruner(registry), schemas, context.exampleMapper())
                .classify(descriptor, description, factory);

        insertParameters(operation, classification.parameters(), options);

        TypeShape shape = descriptor.requestShape();
        boolean listLike = shape != null && shape.listLike();
        boolean getWithoutBody = descriptor.isGet() && !options.enableGetRequestsWithBody();
        if (operation.getRequestBody() != null && !listLike
            && (getWithoutBody || graph.hasNoProperties(description.requestContent()))) {
            log.debug("Removing request body of {}", descriptor.displayName());
            operation.setRequestBody(null);
        }

        if (options.removeEmptyRequestSchema()) {
            List<String> removed = registry.removeEmptyObjectSchemas();
            if (!removed.isEmpty()) {
                log.debug("Removed empty component schemas: {}", removed);
            }
        }

        FieldShape flattened = flattenBody(description, classification.candidateFields(), factory, schemas, registry);

        List<RequestExample> examples = summary != null ? summary.requestExamples() : List.of();
        new ExampleSynthesizer(registry, context.exampleMapper(), options.namingConvention())
            .attach(description, examples, flattened, classification.removedFields());
        return true;
    }

    private void normalizeRoute(OperationDescription description, EndpointDefinition definition,
                                DocumentOptions options) {
        String path = RouteNormalizer.canonicalPath(description.getPath());
        description.setPath(path);

        EndpointVersion version = definition.version();
        String bareRoute = RouteNormalizer.bareRoute(path, version.current(), options);
        Operation operation = description.getOperation();
        if (definition.operationId() != null) {
            operation.setOperationId(definition.operationId());
        }
        RouteNormalizer.deriveTag(bareRoute, definition, options).ifPresent(operation::addTagsItem);
        description.setVersionMarker(new VersionMarker(description.getMethod().name(), bareRoute,
            version.current(), version.startingRelease(), version.deprecatedAt()));
    }

    private void propagateRequestContentTypes(OperationDescription description, EndpointDescriptor descriptor) {
        Content content = description.requestContent();
        if (content == null || content.isEmpty()) {
            return;
        }
        MediaType shared = content.values().iterator().next();
        content.clear();
        for (String contentType : descriptor.consumes()) {
            content.addMediaType(contentType, shared);
        }
    }

    private void verifyRequestShape(EndpointDescriptor descriptor, DocumentOptions options) {
        TypeShape shape = descriptor.requestShape();
        if (shape == null || shape.listLike() || shape.emptyRequestMarker() || options.allowEmptyRequestShapes()) {
            return;
        }
        if (shape.allFields().stream().noneMatch(FieldShape::settable)) {
            throw new UnsupportedRequestShapeException(descriptor.definition().endpointType(), shape.name());
        }
    }

    /**
     * Appends parameters keeping (location, name) unique; a later parameter replaces an earlier one.
     * Header names are compared case-insensitively. Collisions are expected when an external
     * versioning add-on pre-populates parameters and are only logged at debug level then.
     */
    private void insertParameters(Operation operation, List<Parameter> parameters, DocumentOptions options) {
        for (Parameter parameter : parameters) {
            List<Parameter> existing = operation.getParameters();
            if (existing != null && existing.removeIf(other -> sameParameter(other, parameter))) {
                if (options.usingExternalVersioning()) {
                    log.debug("Parameter '{}' in {} replaced a pre-populated parameter",
                        parameter.getName(), parameter.getIn());
                } else {
                    log.warn("Parameter '{}' in {} declared more than once; keeping the last one",
                        parameter.getName(), parameter.getIn());
                }
            }
            operation.addParametersItem(parameter);
        }
    }

    static boolean sameParameter(Parameter left, Parameter right) {
        if (!Objects.equals(left.getIn(), right.getIn())) {
            return false;
        }
        if ("header".equals(left.getIn()) && left.getName() != null) {
            return left.getName().equalsIgnoreCase(right.getName());
        }
        return Objects.equals(left.getName(), right.getName());
    }

    /**
     * Replaces the body with the schema of a {@code FROM_BODY} or {@code FROM_FORM} field.
     *
     * @return the field that now forms the body, or null
     */
    private FieldShape flattenBody(OperationDescription description, List<FieldShape> candidates,
                                   ParameterFactory factory, ShapeSchemaGenerator schemas, SchemaRegistry registry) {
        List<FieldShape> overrides = new ArrayList<>();
        candidates.stream().filter(f -> f.hasBinding(BindingKind.FROM_BODY)).findFirst().ifPresent(overrides::add);
        candidates.stream().filter(f -> f.hasBinding(BindingKind.FROM_FORM)).findFirst().ifPresent(overrides::add);

        FieldShape flattened = null;
        for (FieldShape field : overrides) {
            RequestBody body = description.getOperation().getRequestBody();
            if (body == null || body.getContent() == null || body.getContent().isEmpty()) {
                continue;
            }
            MediaType first = body.getContent().values().iterator().next();
            first.setSchema(schemas.schemaFor(field.type()));
            body.setRequired(true);
            body.setDescription(factory.descriptionOf(field.name()));

            String previous = description.getRequestBodyName();
            description.setRequestBodyName(field.name());
            registry.remove(previous);
            log.debug("Request body replaced by field '{}', removed component '{}'", field.name(), previous);
            flattened = field;
        }
        return flattened;
    }
}
