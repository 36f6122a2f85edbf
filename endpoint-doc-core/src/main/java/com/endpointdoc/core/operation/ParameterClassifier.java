package com.endpointdoc.core.operation;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.config.NamingConvention;
import com.endpointdoc.core.model.BindingKind;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.model.FieldBinding;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.IdempotencyOptions;
import com.endpointdoc.core.model.TypeShape;
import com.endpointdoc.core.schema.RemovedFields;
import com.endpointdoc.core.schema.SchemaPruner;
import com.endpointdoc.core.schema.ShapeSchemaGenerator;
import com.endpointdoc.core.util.ExampleMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides for every request field whether it binds from the route, the query string, a header,
 * the security context, a form, or stays in the body.
 *
 * <p>Fields are classified in stages: excluded fields, path, query, header/claim/permission,
 * legacy file uploads, then the synthesized idempotency header. A field claimed by one stage is
 * not seen by later ones. Every field moved out of the body is pruned from the body schema and
 * recorded in the returned {@link RemovedFields}.
 */
public class ParameterClassifier {

    private static final Logger log = LoggerFactory.getLogger(ParameterClassifier.class);

    /**
     * Header names that cannot be documented as parameters.
     */
    static final List<String> RESERVED_HEADERS = List.of("Accept", "Content-Type", "Authorization");

    private final DocumentOptions options;
    private final SchemaPruner pruner;
    private final ShapeSchemaGenerator generator;
    private final ObjectMapper mapper;

    public ParameterClassifier(DocumentOptions options, SchemaPruner pruner,
                               ShapeSchemaGenerator generator, ObjectMapper mapper) {
        this.options = options;
        this.pruner = pruner;
        this.generator = generator;
        this.mapper = mapper;
    }

    /**
     * Classifies the request fields of an endpoint.
     *
     * <p>May rewrite route tokens of the operation path into their naming-convention form.
     *
     * @param descriptor endpoint descriptor
     * @param operation operation under construction
     * @param factory parameter factory bound to the endpoint's merged descriptions
     * @return parameters to add, removed field names and the remaining candidate fields
     */
    public Classification classify(EndpointDescriptor descriptor, OperationDescription operation,
                                   ParameterFactory factory) {
        Content content = operation.requestContent();
        RemovedFields removed = new RemovedFields();
        TypeShape shape = descriptor.requestShape();
        List<FieldShape> candidates = shape == null || shape.listLike()
            ? new ArrayList<>()
            : new ArrayList<>(shape.allFields());
        Set<FieldShape> claimed = Collections.newSetFromMap(new IdentityHashMap<>());

        for (FieldShape field : List.copyOf(candidates)) {
            if (field.isExcludedFromDocs()) {
                prune(content, field, removed);
                candidates.remove(field);
            }
        }

        List<Parameter> pathParameters = classifyPath(operation, candidates, claimed, content, removed, factory);
        List<Parameter> queryParameters = classifyQuery(descriptor, candidates, claimed, pathParameters,
            content, removed, factory);
        List<Parameter> headerParameters = classifyHeaders(candidates, claimed, content, removed, factory);
        List<Parameter> formParameters = classifyLegacyFiles(candidates, claimed, content, removed, factory);

        List<Parameter> parameters = new ArrayList<>(pathParameters);
        parameters.addAll(queryParameters);
        parameters.addAll(headerParameters);
        parameters.addAll(formParameters);

        if (descriptor.definition().idempotency() != null) {
            parameters.add(idempotencyHeader(descriptor.definition().idempotency(), factory));
        }

        log.debug("Classified {}: {} parameters, removed from body: [{}]",
            descriptor.displayName(), parameters.size(), removed);
        return new Classification(parameters, removed, candidates);
    }

    private List<Parameter> classifyPath(OperationDescription operation, List<FieldShape> candidates,
                                         Set<FieldShape> claimed, Content content, RemovedFields removed,
                                         ParameterFactory factory) {
        NamingConvention naming = options.namingConvention();
        List<Parameter> parameters = new ArrayList<>();
        for (String token : RouteNormalizer.routeParameterNames(operation.getPath())) {
            Optional<FieldShape> match = candidates.stream()
                .filter(f -> !claimed.contains(f))
                .filter(f -> f.bindingName().equalsIgnoreCase(token))
                .findFirst();
            match.ifPresent(field -> {
                prune(content, field, removed);
                claimed.add(field);
            });
            operation.setPath(operation.getPath().replace("{" + token + "}", "{" + naming.apply(token) + "}"));
            parameters.add(factory.create(ParameterKind.PATH, match.orElse(null), token, true));
        }
        return parameters;
    }

    private List<Parameter> classifyQuery(EndpointDescriptor descriptor, List<FieldShape> candidates,
                                          Set<FieldShape> claimed, List<Parameter> pathParameters,
                                          Content content, RemovedFields removed, ParameterFactory factory) {
        boolean getWithoutBody = descriptor.isGet() && !options.enableGetRequestsWithBody();
        List<Parameter> parameters = new ArrayList<>();
        for (FieldShape field : candidates) {
            if (claimed.contains(field) || !isQueryParameter(field, pathParameters, getWithoutBody)) {
                continue;
            }
            prune(content, field, removed);
            claimed.add(field);
            parameters.add(factory.create(ParameterKind.QUERY, field, null, null));
        }
        return parameters;
    }

    private boolean isQueryParameter(FieldShape field, List<Parameter> pathParameters, boolean getWithoutBody) {
        if (field.hasBinding(BindingKind.FROM_HEADER)) {
            return false;
        }
        Optional<FieldBinding> securityBinding = securityBinding(field);
        if (securityBinding.isPresent() && excludesFromBody(securityBinding.get())) {
            if (field.hasBinding(BindingKind.QUERY_PARAM)) {
                log.warn("Field '{}' is bound from a required {} and also marked as query parameter; "
                    + "it is documented as security-bound only", field.name(), securityBinding.get().kind());
            }
            return false;
        }
        String name = field.binding(BindingKind.BIND_FROM)
            .map(FieldBinding::name)
            .filter(n -> n != null && !n.isBlank())
            .orElseGet(() -> options.namingConvention().apply(field.name()));
        boolean onRoute = pathParameters.stream().anyMatch(p -> p.getName().equalsIgnoreCase(name));
        return (getWithoutBody && !onRoute) || field.hasBinding(BindingKind.QUERY_PARAM);
    }

    private List<Parameter> classifyHeaders(List<FieldShape> candidates, Set<FieldShape> claimed,
                                            Content content, RemovedFields removed, ParameterFactory factory) {
        List<Parameter> parameters = new ArrayList<>();
        for (FieldShape field : candidates) {
            if (claimed.contains(field)) {
                continue;
            }
            Optional<FieldBinding> header = field.binding(BindingKind.FROM_HEADER);
            if (header.isPresent()) {
                FieldBinding binding = header.get();
                String headerName = binding.name() != null ? binding.name() : field.name();
                claimed.add(field);
                if (RESERVED_HEADERS.stream().anyMatch(r -> r.equalsIgnoreCase(headerName))) {
                    log.debug("Dropping field '{}' bound to reserved header '{}'", field.name(), headerName);
                    prune(content, field, removed);
                    continue;
                }
                parameters.add(factory.create(ParameterKind.HEADER, field, binding.name(), binding.required()));
                if (binding.required() || binding.removeFromSchema()) {
                    prune(content, field, removed);
                }
                continue;
            }
            Optional<FieldBinding> security = securityBinding(field);
            if (security.isPresent() && excludesFromBody(security.get())) {
                claimed.add(field);
                prune(content, field, removed);
            }
        }
        return parameters;
    }

    private List<Parameter> classifyLegacyFiles(List<FieldShape> candidates, Set<FieldShape> claimed,
                                                Content content, RemovedFields removed, ParameterFactory factory) {
        List<Parameter> parameters = new ArrayList<>();
        if (!options.isLegacyDialect()) {
            return parameters;
        }
        for (FieldShape field : List.copyOf(candidates)) {
            if (claimed.contains(field) || !field.type().file()) {
                continue;
            }
            prune(content, field, removed);
            candidates.remove(field);
            parameters.add(factory.create(ParameterKind.FORM_DATA, field, null, null));
        }
        return parameters;
    }

    private Parameter idempotencyHeader(IdempotencyOptions idempotency, ParameterFactory factory) {
        Parameter parameter = factory.create(ParameterKind.HEADER, null, idempotency.headerName(), true);
        parameter.setDescription(idempotency.headerDescription());
        if (idempotency.example() != null) {
            parameter.setExample(ExampleMappers.toPlain(mapper, idempotency.example()));
        }
        if (idempotency.headerType() != null) {
            parameter.setSchema(generator.schemaFor(idempotency.headerType()));
        }
        return parameter;
    }

    private void prune(Content content, FieldShape field, RemovedFields removed) {
        pruner.remove(content, options.namingConvention().wireName(field), removed);
    }

    private static Optional<FieldBinding> securityBinding(FieldShape field) {
        return field.binding(BindingKind.FROM_CLAIM).or(() -> field.binding(BindingKind.HAS_PERMISSION));
    }

    private static boolean excludesFromBody(FieldBinding binding) {
        return binding.required() || binding.removeFromSchema();
    }

    /**
     * Outcome of classifying one endpoint's request fields.
     *
     * @param parameters parameters in insertion order
     * @param removedFields wire names pruned from the body
     * @param candidateFields documented fields still considered for body flattening
     */
    public record Classification(
        List<Parameter> parameters,
        RemovedFields removedFields,
        List<FieldShape> candidateFields
    ) {
        public Classification {
            parameters = List.copyOf(parameters);
            candidateFields = List.copyOf(candidateFields);
        }
    }
}
