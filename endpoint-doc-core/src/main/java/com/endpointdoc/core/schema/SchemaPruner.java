package com.endpointdoc.core.schema;

import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes properties from request body schemas.
 *
 * <p>Removal resolves references and cascades through every {@code allOf} member and inherited
 * schema, dropping the key from each node's properties and required list. Removing an absent
 * key is a no-op.
 */
public class SchemaPruner {

    private static final Logger log = LoggerFactory.getLogger(SchemaPruner.class);

    private final SchemaGraph graph;

    public SchemaPruner(SchemaRegistry registry) {
        this.graph = new SchemaGraph(registry);
    }

    /**
     * Removes a wire name from every media type of a body and records it.
     *
     * @param content body content, may be null
     * @param wireName property key after the naming convention
     * @param removed accumulator of pruned names
     */
    public void remove(Content content, String wireName, RemovedFields removed) {
        removed.add(wireName);
        if (content == null) {
            return;
        }
        for (MediaType mediaType : content.values()) {
            if (mediaType == null || mediaType.getSchema() == null) {
                continue;
            }
            String key = matchingKey(mediaType.getSchema(), wireName);
            if (key != null) {
                removeKey(mediaType.getSchema(), key);
            }
        }
    }

    private String matchingKey(Schema<?> schema, String wireName) {
        return graph.allProperties(schema).keySet().stream()
            .filter(key -> key.equalsIgnoreCase(wireName))
            .findFirst()
            .orElse(null);
    }

    private void removeKey(Schema<?> schema, String key) {
        for (Schema<?> node : graph.reachable(schema)) {
            if (node.getProperties() != null && node.getProperties().remove(key) != null) {
                log.trace("Removed property '{}' from schema node", key);
            }
            if (node.getRequired() != null && node.getRequired().remove(key) && node.getRequired().isEmpty()) {
                node.setRequired(null);
            }
        }
    }
}
