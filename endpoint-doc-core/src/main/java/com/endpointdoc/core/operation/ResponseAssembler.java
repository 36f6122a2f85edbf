package com.endpointdoc.core.operation;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.model.BindingKind;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.model.EndpointSummary;
import com.endpointdoc.core.model.FieldBinding;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.ResponseHeader;
import com.endpointdoc.core.model.ResponseTypeMetadata;
import com.endpointdoc.core.schema.ExampleSampler;
import com.endpointdoc.core.schema.SchemaGraph;
import com.endpointdoc.core.schema.SchemaRegistry;
import com.endpointdoc.core.schema.ShapeSchemaGenerator;
import com.endpointdoc.core.util.ExampleMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.BooleanSchema;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.NumberSchema;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completes the seeded responses of an operation with declared metadata and user documentation.
 */
public class ResponseAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResponseAssembler.class);

    /**
     * Reason phrases used when a response has no description.
     */
    static final Map<String, String> DEFAULT_DESCRIPTIONS = Map.ofEntries(
        Map.entry("200", "Success"),
        Map.entry("201", "Created"),
        Map.entry("202", "Accepted"),
        Map.entry("204", "No Content"),
        Map.entry("400", "Bad Request"),
        Map.entry("401", "Unauthorized"),
        Map.entry("403", "Forbidden"),
        Map.entry("404", "Not Found"),
        Map.entry("405", "Method Not Allowed"),
        Map.entry("406", "Not Acceptable"),
        Map.entry("429", "Too Many Requests"),
        Map.entry("500", "Server Error")
    );

    private final SchemaRegistry registry;
    private final SchemaGraph graph;
    private final ShapeSchemaGenerator generator;
    private final ExampleSampler sampler;
    private final DocumentOptions options;
    private final ObjectMapper mapper;

    public ResponseAssembler(SchemaRegistry registry, ShapeSchemaGenerator generator, ExampleSampler sampler,
                             DocumentOptions options, ObjectMapper mapper) {
        this.registry = registry;
        this.graph = new SchemaGraph(registry);
        this.generator = generator;
        this.sampler = sampler;
        this.options = options;
        this.mapper = mapper;
    }

    /**
     * Merges declared response metadata into the operation's responses, then applies response
     * and property descriptions.
     *
     * @param operation operation under construction
     * @param descriptor endpoint descriptor
     */
    public void assemble(OperationDescription operation, EndpointDescriptor descriptor) {
        ApiResponses responses = operation.getOperation().getResponses();
        if (responses == null || responses.isEmpty()) {
            return;
        }
        EndpointSummary summary = descriptor.definition().summary();
        Map<String, ResponseTypeMetadata> metadata = lastPerStatus(descriptor.responseTypes());

        for (Map.Entry<String, ApiResponse> entry : responses.entrySet()) {
            ResponseTypeMetadata meta = metadata.get(entry.getKey());
            if (meta != null) {
                mergeMetadata(entry.getValue(), meta, summary);
            }
        }
        for (Map.Entry<String, ApiResponse> entry : responses.entrySet()) {
            describe(entry.getKey(), entry.getValue(), metadata.get(entry.getKey()), summary);
        }
    }

    private static Map<String, ResponseTypeMetadata> lastPerStatus(List<ResponseTypeMetadata> declared) {
        Map<String, ResponseTypeMetadata> byStatus = new LinkedHashMap<>();
        for (ResponseTypeMetadata meta : declared) {
            byStatus.put(String.valueOf(meta.statusCode()), meta);
        }
        return byStatus;
    }

    private void mergeMetadata(ApiResponse response, ResponseTypeMetadata meta, EndpointSummary summary) {
        Content content = response.getContent();
        MediaType mediaType = content != null && !content.isEmpty() ? content.values().iterator().next() : null;

        Object example = responseExample(meta, summary);
        if (mediaType != null && example != null) {
            mediaType.setExample(example);
        }

        if (meta.type() != null) {
            for (FieldShape field : meta.type().allFields()) {
                field.binding(BindingKind.TO_HEADER).ifPresent(binding -> addFieldHeader(response, field, binding));
            }
        }
        if (summary != null) {
            for (ResponseHeader header : summary.responseHeaders()) {
                if (header.statusCode() == meta.statusCode()) {
                    response.addHeaderObject(header.headerName(), userHeader(header));
                }
            }
        }

        if (mediaType != null) {
            content.clear();
            for (String contentType : meta.contentTypes()) {
                content.addMediaType(contentType, mediaType);
            }
        }

        if (content != null) {
            Set<MediaType> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
            distinct.addAll(content.values());
            for (MediaType media : distinct) {
                if (options.useOneOfForPolymorphism()) {
                    flattenPolymorphism(media);
                }
                fixByteFormat(media);
            }
        }
    }

    private Object responseExample(ResponseTypeMetadata meta, EndpointSummary summary) {
        Object example = meta.example();
        if (example == null && summary != null) {
            example = summary.responseExamples().get(meta.statusCode());
        }
        if (example == null) {
            return null;
        }
        JsonNode tree = mapper.valueToTree(example);
        if (options.isLegacyDialect() && tree.isArray()) {
            try {
                return mapper.writeValueAsString(tree);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize response example", e);
            }
        }
        return ExampleMappers.toPlain(mapper, tree);
    }

    private void addFieldHeader(ApiResponse response, FieldShape field, FieldBinding binding) {
        String headerName = binding.name() != null ? binding.name() : options.namingConvention().apply(field.name());
        Schema<?> schema = generator.schemaFor(field.type());
        Object example = field.example() != null
            ? ExampleMappers.toPlain(mapper, field.example())
            : ExampleMappers.toPlain(mapper, sampler.sample(schema));
        Header header = new Header().description(field.description()).schema(schema);
        if (example != null) {
            header.setExample(example);
        }
        response.addHeaderObject(headerName, header);
    }

    private Header userHeader(ResponseHeader declared) {
        Header header = new Header().description(declared.description());
        if (declared.example() != null) {
            header.setExample(ExampleMappers.toPlain(mapper, declared.example()));
            header.setSchema(schemaOfValue(declared.example()));
        }
        return header;
    }

    /**
     * Infers a schema from the runtime type of an example value.
     */
    static Schema<?> schemaOfValue(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new IntegerSchema();
        }
        if (value instanceof Long || value instanceof BigInteger) {
            return new IntegerSchema().format("int64");
        }
        if (value instanceof Number) {
            return new NumberSchema().format(value instanceof BigDecimal ? null : "double");
        }
        if (value instanceof Boolean) {
            return new BooleanSchema();
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return new ArraySchema().items(new Schema<>());
        }
        if (value instanceof Map<?, ?>) {
            return new ObjectSchema();
        }
        return new StringSchema();
    }

    private void flattenPolymorphism(MediaType media) {
        Schema<?> schema = media.getSchema();
        Schema<?> actual = registry.resolve(schema);
        if (schema == null || actual == null || actual.getDiscriminator() == null
            || actual.getDiscriminator().getMapping() == null || actual.getDiscriminator().getMapping().isEmpty()
            || actual.getOneOf() == null || actual.getOneOf().isEmpty()) {
            return;
        }
        Schema<Object> flattened = new Schema<>();
        for (Schema<?> branch : actual.getOneOf()) {
            flattened.addOneOfItem(branch);
        }
        media.setSchema(flattened);
    }

    private static void fixByteFormat(MediaType media) {
        Schema<?> schema = media.getSchema();
        if (schema != null && "string".equals(schema.getType()) && "byte".equals(schema.getFormat())) {
            schema.setFormat("binary");
        }
    }

    private void describe(String status, ApiResponse response, ResponseTypeMetadata meta, EndpointSummary summary) {
        if (response.getDescription() != null && !response.getDescription().isBlank()) {
            return;
        }
        String reason = DEFAULT_DESCRIPTIONS.get(status);
        if (reason != null) {
            response.setDescription(reason);
        }
        if (summary == null) {
            return;
        }
        int statusCode;
        try {
            statusCode = Integer.parseInt(status);
        } catch (NumberFormatException e) {
            log.debug("Skipping user descriptions for non-numeric response key: {}", status);
            return;
        }
        String userDescription = summary.responses().get(statusCode);
        if (userDescription != null) {
            response.setDescription(userDescription);
        }

        Map<String, String> propertyDescriptions = summary.responseParams().get(statusCode);
        if (propertyDescriptions == null || response.getContent() == null) {
            return;
        }
        Map<String, String> fieldNamesByWireName = new HashMap<>();
        if (meta != null && meta.type() != null) {
            for (FieldShape field : meta.type().allFields()) {
                fieldNamesByWireName.put(options.namingConvention().wireName(field), field.name());
            }
        }
        for (Map.Entry<String, Schema> property : graph.allProperties(response.getContent()).entrySet()) {
            String fieldName = fieldNamesByWireName.getOrDefault(property.getKey(), property.getKey());
            String description = propertyDescriptions.get(fieldName);
            if (description == null) {
                description = propertyDescriptions.get(property.getKey());
            }
            if (description != null) {
                property.getValue().setDescription(description);
            }
        }
    }
}
