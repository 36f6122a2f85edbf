package com.endpointdoc.core.operation;

import com.endpointdoc.core.model.EndpointSummary;
import com.endpointdoc.core.model.RequestExample;
import com.endpointdoc.core.schema.SchemaGraph;
import com.endpointdoc.core.util.ExampleMappers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.Schema;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the description and example of every request field from three sources, later ones
 * winning where they supply a value:
 * <ol>
 *   <li>the body schema's own property descriptions and examples</li>
 *   <li>the summary's per-field descriptions</li>
 *   <li>the values of the first request example</li>
 * </ol>
 * Keys are compared case-insensitively.
 */
public class ParamDescriptionCollector {

    private final SchemaGraph graph;
    private final ObjectMapper mapper;

    public ParamDescriptionCollector(SchemaGraph graph, ObjectMapper mapper) {
        this.graph = graph;
        this.mapper = mapper;
    }

    /**
     * Collects merged descriptions.
     *
     * @param content request body content, may be null
     * @param summary endpoint summary, may be null
     * @return field name to merged description, case-insensitive
     */
    public Map<String, ParamDescription> collect(Content content, EndpointSummary summary) {
        Map<String, ParamDescription> descriptions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        graph.allProperties(content).forEach((key, property) -> descriptions.put(key, new ParamDescription(
            property.getDescription(),
            property.getExample() != null ? mapper.valueToTree(property.getExample()) : null)));

        if (summary == null) {
            return descriptions;
        }
        summary.params().forEach((name, description) ->
            descriptions.computeIfAbsent(name, k -> new ParamDescription()).setDescription(description));

        if (!summary.requestExamples().isEmpty()) {
            RequestExample first = summary.requestExamples().get(0);
            JsonNode example = mapper.valueToTree(first.value());
            if (example.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = example.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    descriptions.computeIfAbsent(field.getKey(), k -> new ParamDescription()).setExample(field.getValue());
                }
            }
        }
        return descriptions;
    }

    /**
     * Writes merged descriptions and examples back onto the body properties.
     *
     * @param content request body content, may be null
     * @param descriptions merged descriptions
     */
    public void applyTo(Content content, Map<String, ParamDescription> descriptions) {
        for (Map.Entry<String, Schema> property : graph.allProperties(content).entrySet()) {
            ParamDescription merged = descriptions.get(property.getKey());
            if (merged == null) {
                continue;
            }
            Schema<?> schema = property.getValue();
            schema.setDescription(merged.getDescription());
            if (merged.getExample() != null && !merged.getExample().isNull()) {
                schema.setExample(ExampleMappers.toPlain(mapper, merged.getExample()));
            }
        }
    }
}
