package com.endpointdoc.core.schema;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SchemaRegistry}.
 */
class SchemaRegistryTest {

    private Components components;
    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        components = new Components();
        registry = new SchemaRegistry(components);
    }

    @Test
    void put_writesThroughToComponents() {
        registry.put("Order", new ObjectSchema());

        assertThat(components.getSchemas()).containsKey("Order");
        assertThat(registry.contains("Order")).isTrue();
    }

    @Test
    void resolve_followsReferenceChain() {
        StringSchema target = new StringSchema();
        registry.put("Code", target);
        registry.put("Alias", SchemaRegistry.refTo("Code"));

        assertThat(registry.resolve(SchemaRegistry.refTo("Alias"))).isSameAs(target);
    }

    @Test
    void resolve_danglingReference_returnsReference() {
        Schema<?> ref = SchemaRegistry.refTo("Missing");

        assertThat(registry.resolve(ref)).isSameAs(ref);
        assertThat(registry.resolve(null)).isNull();
    }

    @Test
    void resolve_cyclicReferences_terminates() {
        registry.put("A", SchemaRegistry.refTo("B"));
        registry.put("B", SchemaRegistry.refTo("A"));

        assertThat(registry.resolve(SchemaRegistry.refTo("A"))).isNotNull();
    }

    @Test
    void remove_nullOrAbsent_isNoOp() {
        assertThat(registry.remove(null)).isNull();
        assertThat(registry.remove("Nothing")).isNull();
    }

    @Test
    void removeEmptyObjectSchemas_removesOnlyPropertylessObjects() {
        registry.put("Empty", new ObjectSchema());
        registry.put("Filled", new ObjectSchema().addProperty("id", new StringSchema()));
        registry.put("Status", new StringSchema());

        assertThat(registry.removeEmptyObjectSchemas()).containsExactly("Empty");
        assertThat(registry.names()).containsExactly("Filled", "Status");
    }

    @Test
    void nameOf_extractsComponentName() {
        assertThat(SchemaRegistry.nameOf("#/components/schemas/Order")).isEqualTo("Order");
    }
}
