package com.endpointdoc.core.operation;

import com.endpointdoc.core.config.NamingConvention;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.RequestExample;
import com.endpointdoc.core.schema.RemovedFields;
import com.endpointdoc.core.schema.SchemaRegistry;
import com.endpointdoc.core.util.ExampleMappers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swagger.v3.oas.models.examples.Example;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.RequestBody;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches user-authored request examples to the final request body.
 *
 * <p>A single example becomes the body schema's {@code example}. Several become named examples
 * of the first media type; labels occurring more than once are numbered {@code " 1"},
 * {@code " 2"}, ... in encounter order. Numbering starts at one for the first member of a
 * duplicated group, not at two for the second. Example values never show a field pruned from the body.
 */
public class ExampleSynthesizer {

    private final SchemaRegistry registry;
    private final ObjectMapper mapper;
    private final NamingConvention naming;

    public ExampleSynthesizer(SchemaRegistry registry, ObjectMapper mapper, NamingConvention naming) {
        this.registry = registry;
        this.mapper = mapper;
        this.naming = naming;
    }

    /**
     * Attaches examples to the request body, if the operation still has one.
     *
     * @param operation operation under construction
     * @param examples request examples in declaration order
     * @param flattenedField field whose value replaced the body, null when not flattened
     * @param removed names pruned from the body
     */
    public void attach(OperationDescription operation, List<RequestExample> examples,
                       FieldShape flattenedField, RemovedFields removed) {
        RequestBody body = operation.getOperation().getRequestBody();
        if (examples.isEmpty() || body == null || body.getContent() == null || body.getContent().isEmpty()) {
            return;
        }
        Content content = body.getContent();
        MediaType first = content.values().iterator().next();

        if (examples.size() == 1) {
            Schema<?> schema = registry.resolve(first.getSchema());
            if (schema != null) {
                schema.setExample(project(examples.get(0).value(), flattenedField, removed));
            }
            return;
        }

        List<String> labels = labels(examples);
        for (int i = 0; i < examples.size(); i++) {
            RequestExample example = examples.get(i);
            first.addExamples(labels.get(i), new Example()
                .summary(example.summary())
                .description(example.description())
                .value(project(example.value(), flattenedField, removed)));
        }
    }

    /**
     * Computes unique labels: labels used more than once get a {@code " n"} suffix counting from
     * one within their group, so two "Small" examples read "Small 1" and "Small 2". Numbers that
     * would repeat a label declared elsewhere are skipped.
     *
     * @param examples request examples
     * @return labels in example order
     */
    static List<String> labels(List<RequestExample> examples) {
        Map<String, Integer> occurrences = new HashMap<>();
        for (RequestExample example : examples) {
            occurrences.merge(example.label(), 1, Integer::sum);
        }
        Set<String> taken = new HashSet<>();
        occurrences.forEach((label, count) -> {
            if (count == 1) {
                taken.add(label);
            }
        });

        Map<String, Integer> counters = new HashMap<>();
        List<String> labels = new ArrayList<>(examples.size());
        for (RequestExample example : examples) {
            String label = example.label();
            if (occurrences.get(label) > 1) {
                String numbered;
                do {
                    numbered = label + " " + counters.merge(label, 1, Integer::sum);
                } while (!taken.add(numbered));
                label = numbered;
            }
            labels.add(label);
        }
        return labels;
    }

    /**
     * Serializes an example value the way it appears in the final body.
     *
     * @param value example object
     * @param flattenedField field whose value replaced the body, may be null
     * @param removed names pruned from the body
     * @return plain example value
     */
    Object project(Object value, FieldShape flattenedField, RemovedFields removed) {
        JsonNode tree = mapper.valueToTree(value);
        if (flattenedField != null && tree.isObject()) {
            JsonNode inner = fieldIgnoringCase(tree, flattenedField.name(), naming.wireName(flattenedField));
            if (inner != null && !inner.isNull()) {
                tree = inner;
            }
        }
        if (tree.isObject()) {
            ObjectNode object = (ObjectNode) tree.deepCopy();
            List<String> pruned = new ArrayList<>();
            object.fieldNames().forEachRemaining(name -> {
                if (removed.contains(name)) {
                    pruned.add(name);
                }
            });
            object.remove(pruned);
            tree = object;
        }
        return ExampleMappers.toPlain(mapper, tree);
    }

    private static JsonNode fieldIgnoringCase(JsonNode object, String... names) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = object.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            fields.put(entry.getKey(), entry.getValue());
        }
        for (String name : names) {
            for (Map.Entry<String, JsonNode> entry : fields.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }
}
