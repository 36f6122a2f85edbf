package com.endpointdoc.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swagger.v3.oas.models.media.Schema;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a sample JSON value from a schema, for parameters that have neither a declared
 * example nor a default.
 */
public class ExampleSampler {

    private static final int MAX_DEPTH = 5;
    private static final String ZERO_UUID = "00000000-0000-0000-0000-000000000000";

    private final SchemaRegistry registry;
    private final SchemaGraph graph;
    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ExampleSampler(SchemaRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
        this.graph = new SchemaGraph(registry);
    }

    /**
     * Creates a sample for a schema.
     *
     * @param schema schema or reference
     * @return sample value, a null node when nothing can be sampled
     */
    public JsonNode sample(Schema<?> schema) {
        return sample(schema, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private JsonNode sample(Schema<?> schema, int depth, Set<Schema<?>> path) {
        Schema<?> actual = registry.resolve(schema);
        if (actual == null || depth > MAX_DEPTH || !path.add(actual)) {
            return nodes.nullNode();
        }
        try {
            if (actual.getExample() != null) {
                return mapper.valueToTree(actual.getExample());
            }
            List<?> values = actual.getEnum();
            if (values != null && !values.isEmpty()) {
                return nodes.textNode(String.valueOf(values.get(0)));
            }
            if (actual.getAllOf() != null && actual.getProperties() == null && actual.getAllOf().size() == 1) {
                return sample(actual.getAllOf().get(0), depth + 1, path);
            }
            String type = actual.getType();
            if (type == null && (actual.getProperties() != null || actual.getAllOf() != null)) {
                type = "object";
            }
            if (type == null) {
                return nodes.nullNode();
            }
            return switch (type) {
                case "object" -> sampleObject(actual, depth, path);
                case "array" -> {
                    ArrayNode array = nodes.arrayNode();
                    JsonNode item = sample(actual.getItems(), depth + 1, path);
                    if (!item.isNull()) {
                        array.add(item);
                    }
                    yield array;
                }
                case "integer" -> nodes.numberNode(0);
                case "number" -> nodes.numberNode(0.0d);
                case "boolean" -> nodes.booleanNode(false);
                case "string" -> nodes.textNode(sampleString(actual.getFormat()));
                default -> nodes.nullNode();
            };
        } finally {
            path.remove(actual);
        }
    }

    private ObjectNode sampleObject(Schema<?> schema, int depth, Set<Schema<?>> path) {
        ObjectNode object = nodes.objectNode();
        for (Map.Entry<String, Schema> property : graph.allProperties(schema).entrySet()) {
            object.set(property.getKey(), sample(property.getValue(), depth + 1, path));
        }
        return object;
    }

    private static String sampleString(String format) {
        if (format == null) {
            return "string";
        }
        return switch (format) {
            case "uuid" -> ZERO_UUID;
            case "date-time" -> "2000-01-01T00:00:00Z";
            case "date" -> "2000-01-01";
            case "binary", "byte" -> "";
            default -> "string";
        };
    }
}
