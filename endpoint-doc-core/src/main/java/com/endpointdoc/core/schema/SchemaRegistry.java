package com.endpointdoc.core.schema;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.media.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named component schemas shared by every operation of a document.
 *
 * <p>Backed directly by {@code components.schemas} of the document under construction. Schemas
 * are added by the generator and removed by key; a registered schema instance is never replaced
 * wholesale, because other operations may hold {@code $ref}s to it.
 */
public class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    /**
     * Prefix of component schema references.
     */
    public static final String REF_PREFIX = Components.COMPONENTS_SCHEMAS_REF;

    private final Map<String, Schema> schemas;

    public SchemaRegistry(Components components) {
        if (components.getSchemas() == null) {
            components.setSchemas(new LinkedHashMap<>());
        }
        this.schemas = components.getSchemas();
    }

    public SchemaRegistry() {
        this(new Components());
    }

    public Schema<?> get(String name) {
        return schemas.get(name);
    }

    public boolean contains(String name) {
        return schemas.containsKey(name);
    }

    public void put(String name, Schema<?> schema) {
        schemas.put(name, schema);
    }

    /**
     * Removes a named schema.
     *
     * @param name component name, may be null
     * @return removed schema, or null if absent
     */
    public Schema<?> remove(String name) {
        if (name == null) {
            return null;
        }
        Schema<?> removed = schemas.remove(name);
        if (removed != null) {
            log.debug("Removed component schema: {}", name);
        }
        return removed;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(schemas.keySet());
    }

    /**
     * Follows a {@code $ref} chain to the schema that carries the content.
     *
     * <p>Dangling and cyclic references resolve to the last schema reached.
     *
     * @param schema schema or reference, may be null
     * @return actual schema, or null if {@code schema} is null
     */
    public Schema<?> resolve(Schema<?> schema) {
        Schema<?> current = schema;
        Map<Schema<?>, Boolean> seen = new IdentityHashMap<>();
        while (current != null && current.get$ref() != null && seen.put(current, Boolean.TRUE) == null) {
            Schema<?> target = schemas.get(nameOf(current.get$ref()));
            if (target == null) {
                return current;
            }
            current = target;
        }
        return current;
    }

    /**
     * Deletes every named object schema that has no properties left, counting properties reached
     * through {@code allOf} and references.
     *
     * @return names of the removed schemas
     */
    public List<String> removeEmptyObjectSchemas() {
        SchemaGraph graph = new SchemaGraph(this);
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, Schema> entry : new ArrayList<>(schemas.entrySet())) {
            Schema<?> schema = entry.getValue();
            if ("object".equals(schema.getType()) && graph.allProperties(schema).isEmpty()) {
                removed.add(entry.getKey());
            }
        }
        removed.forEach(this::remove);
        return removed;
    }

    /**
     * Creates a reference to a named component.
     *
     * @param name component name
     * @return reference schema
     */
    public static Schema<?> refTo(String name) {
        return new Schema<>().$ref(REF_PREFIX + name);
    }

    /**
     * Extracts the component name from a reference.
     *
     * @param ref reference such as {@code #/components/schemas/Order}
     * @return component name
     */
    public static String nameOf(String ref) {
        return ref.substring(ref.lastIndexOf('/') + 1);
    }
}
