package com.endpointdoc.core.schema;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.TypeShape;
import com.endpointdoc.core.model.WireType;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SchemaPruner}.
 */
class SchemaPrunerTest {

    private SchemaRegistry registry;
    private ShapeSchemaGenerator generator;
    private SchemaPruner pruner;
    private RemovedFields removed;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry();
        generator = new ShapeSchemaGenerator(registry, DocumentOptions.defaults());
        pruner = new SchemaPruner(registry);
        removed = new RemovedFields();
    }

    private Content bodyOf(TypeShape shape, String... contentTypes) {
        Schema<?> schema = generator.schemaForShape(shape);
        MediaType shared = new MediaType().schema(schema);
        Content content = new Content();
        for (String contentType : contentTypes) {
            content.addMediaType(contentType, shared);
        }
        return content;
    }

    @Test
    void remove_existingField_dropsPropertyAndRequiredEntry() {
        Content content = bodyOf(TypeShape.of("Order",
            FieldShape.of("Id", WireType.integer()),
            FieldShape.of("Note", WireType.string())), "application/json");

        pruner.remove(content, "id", removed);

        Schema<?> order = registry.get("Order");
        assertThat(order.getProperties()).containsOnlyKeys("note");
        assertThat(order.getRequired()).containsExactly("note");
        assertThat(removed.names()).containsExactly("id");
    }

    @Test
    void remove_lastRequiredField_clearsRequiredList() {
        Content content = bodyOf(TypeShape.of("Ping", FieldShape.of("Id", WireType.integer())), "application/json");

        pruner.remove(content, "id", removed);

        assertThat(registry.get("Ping").getRequired()).isNull();
        assertThat(registry.get("Ping").getProperties()).isEmpty();
    }

    @Test
    void remove_inheritedField_cascadesIntoBase() {
        TypeShape base = TypeShape.of("Entity",
            FieldShape.of("TenantId", WireType.uuid()),
            FieldShape.of("Version", WireType.integer()));
        TypeShape derived = TypeShape.of("Invoice", FieldShape.of("Total", WireType.number())).withBase(base);
        Content content = bodyOf(derived, "application/json");

        pruner.remove(content, "tenantId", removed);

        assertThat(registry.get("Entity").getProperties()).containsOnlyKeys("version");
        assertThat(registry.get("Entity").getRequired()).containsExactly("version");
        assertThat(new SchemaGraph(registry).allProperties(content)).containsOnlyKeys("version", "total");
    }

    @Test
    void remove_matchesKeyIgnoringCase() {
        Content content = bodyOf(TypeShape.of("Search",
            FieldShape.of("PageSize", WireType.integer()).withWireName("PAGESIZE")), "application/json");

        pruner.remove(content, "pageSize", removed);

        assertThat(registry.get("Search").getProperties()).isEmpty();
    }

    @Test
    void remove_appliesToEveryContentType() {
        Schema<?> jsonSchema = generator.schemaForShape(TypeShape.of("A", FieldShape.of("X", WireType.string())));
        Schema<?> xmlSchema = generator.schemaForShape(TypeShape.of("B", FieldShape.of("X", WireType.string())));
        Content content = new Content()
            .addMediaType("application/json", new MediaType().schema(jsonSchema))
            .addMediaType("application/xml", new MediaType().schema(xmlSchema));

        pruner.remove(content, "x", removed);

        assertThat(registry.get("A").getProperties()).isEmpty();
        assertThat(registry.get("B").getProperties()).isEmpty();
    }

    @Test
    void remove_isIdempotent() {
        Content content = bodyOf(TypeShape.of("Order",
            FieldShape.of("Id", WireType.integer()),
            FieldShape.of("Note", WireType.string())), "application/json");

        pruner.remove(content, "id", removed);
        pruner.remove(content, "id", removed);
        pruner.remove(content, "absent", removed);

        assertThat(registry.get("Order").getProperties()).containsOnlyKeys("note");
        assertThat(removed.names()).containsExactly("id", "absent");
    }

    @Test
    void remove_nullContent_onlyRecordsName() {
        pruner.remove(null, "id", removed);

        assertThat(removed.contains("ID")).isTrue();
    }
}
