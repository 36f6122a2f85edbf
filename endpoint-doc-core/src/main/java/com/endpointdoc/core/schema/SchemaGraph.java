package com.endpointdoc.core.schema;

import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Traversal over the composition edges of a schema: {@code $ref} into the registry and
 * {@code allOf} members.
 *
 * <p>Every traversal keeps an identity-based visited set, so self-referencing models terminate.
 */
public class SchemaGraph {

    private final SchemaRegistry registry;

    public SchemaGraph(SchemaRegistry registry) {
        this.registry = registry;
    }

    /**
     * Collects every node reachable from a schema, the resolved schema first.
     *
     * @param schema start node, may be null
     * @return reachable nodes in visit order
     */
    public List<Schema<?>> reachable(Schema<?> schema) {
        List<Schema<?>> nodes = new ArrayList<>();
        collect(schema, Collections.newSetFromMap(new IdentityHashMap<>()), nodes);
        return nodes;
    }

    private void collect(Schema<?> schema, Set<Schema<?>> visited, List<Schema<?>> nodes) {
        Schema<?> actual = registry.resolve(schema);
        if (actual == null || !visited.add(actual)) {
            return;
        }
        nodes.add(actual);
        if (actual.getAllOf() != null) {
            for (Schema<?> member : actual.getAllOf()) {
                collect(member, visited, nodes);
            }
        }
    }

    /**
     * Returns the properties of a schema including those reached through {@code allOf} and
     * references. The first node declaring a key wins.
     *
     * @param schema schema or reference
     * @return property key to property schema
     */
    public Map<String, Schema> allProperties(Schema<?> schema) {
        Map<String, Schema> properties = new LinkedHashMap<>();
        for (Schema<?> node : reachable(schema)) {
            if (node.getProperties() != null) {
                node.getProperties().forEach(properties::putIfAbsent);
            }
        }
        return properties;
    }

    /**
     * Returns the properties of every content entry.
     *
     * @param content body or response content, may be null
     * @return property key to property schema across all media types
     */
    public Map<String, Schema> allProperties(Content content) {
        Map<String, Schema> properties = new LinkedHashMap<>();
        if (content == null) {
            return properties;
        }
        for (MediaType mediaType : content.values()) {
            if (mediaType != null && mediaType.getSchema() != null) {
                allProperties(mediaType.getSchema()).forEach(properties::putIfAbsent);
            }
        }
        return properties;
    }

    /**
     * Returns whether no content entry exposes any property.
     *
     * @param content body content
     * @return true if every media type schema is property-less
     */
    public boolean hasNoProperties(Content content) {
        return allProperties(content).isEmpty();
    }
}
