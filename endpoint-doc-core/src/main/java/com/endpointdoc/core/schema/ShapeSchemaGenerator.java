package com.endpointdoc.core.schema;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.config.NamingConvention;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.TypeShape;
import com.endpointdoc.core.model.WireType;
import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.Discriminator;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates JSON-Schema nodes for reflected shapes and registers named components.
 *
 * <p>Object shapes become components referenced through {@code $ref}. A shape with a base type
 * is composed as {@code allOf: [$ref base, {own properties}]}. A polymorphic base carries a
 * discriminator mapping to its subtypes and, when {@link DocumentOptions#useOneOfForPolymorphism()}
 * is set, a {@code oneOf} over them.
 *
 * <p>Every field is emitted, hidden and ignored ones included; the operation processor removes
 * them like any other classified-out field.
 */
public class ShapeSchemaGenerator {

    private static final Logger log = LoggerFactory.getLogger(ShapeSchemaGenerator.class);

    private final SchemaRegistry registry;
    private final DocumentOptions options;

    public ShapeSchemaGenerator(SchemaRegistry registry, DocumentOptions options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Returns the schema of a wire type, registering referenced components.
     *
     * @param type wire type
     * @return inline schema or reference
     */
    public Schema<?> schemaFor(WireType type) {
        if (type.shape() != null) {
            return schemaForShape(type.shape());
        }
        if ("array".equals(type.type())) {
            return new ArraySchema().items(type.items() != null ? schemaFor(type.items()) : new Schema<>());
        }
        if (type.isNamedEnum()) {
            if (!registry.contains(type.enumName())) {
                StringSchema enumSchema = new StringSchema();
                enumSchema.setEnum(new ArrayList<>(type.enumValues()));
                registry.put(type.enumName(), enumSchema);
            }
            return SchemaRegistry.refTo(type.enumName());
        }
        Schema<Object> schema = new Schema<>().type(type.type()).format(type.format());
        if (!type.enumValues().isEmpty()) {
            schema.setEnum(new ArrayList<>(type.enumValues()));
        }
        return schema;
    }

    /**
     * Returns the schema used wherever a shape appears: an array for list-like shapes, a
     * reference to the registered component otherwise.
     *
     * @param shape reflected shape
     * @return schema
     */
    public Schema<?> schemaForShape(TypeShape shape) {
        if (shape.listLike()) {
            Schema<?> items = shape.elementShape() != null ? schemaForShape(shape.elementShape()) : new ObjectSchema();
            return new ArraySchema().items(items);
        }
        register(shape);
        return SchemaRegistry.refTo(shape.name());
    }

    /**
     * Registers the component of a shape, and of every shape it references, unless already
     * present.
     *
     * @param shape object shape
     */
    public void register(TypeShape shape) {
        if (registry.contains(shape.name())) {
            return;
        }
        // registered before filling so recursive references terminate
        Schema<Object> component = shape.base() != null ? new Schema<>() : new ObjectSchema();
        registry.put(shape.name(), component);
        log.debug("Registering component schema: {}", shape.name());

        if (shape.summary() != null) {
            component.setDescription(shape.summary());
        }
        if (shape.base() != null) {
            register(shape.base());
            ObjectSchema own = new ObjectSchema();
            addFields(own, shape.fields());
            component.addAllOfItem(SchemaRegistry.refTo(shape.base().name()));
            component.addAllOfItem(own);
        } else {
            addFields(component, shape.fields());
        }

        if (shape.isPolymorphic()) {
            Discriminator discriminator = new Discriminator().propertyName(shape.discriminator());
            for (TypeShape subType : shape.subTypes()) {
                register(subType);
                discriminator.mapping(subType.name(), SchemaRegistry.REF_PREFIX + subType.name());
                if (options.useOneOfForPolymorphism()) {
                    component.addOneOfItem(SchemaRegistry.refTo(subType.name()));
                }
            }
            component.setDiscriminator(discriminator);
        }
    }

    private void addFields(Schema<?> target, List<FieldShape> fields) {
        NamingConvention naming = options.namingConvention();
        for (FieldShape field : fields) {
            String key = naming.wireName(field);
            target.addProperty(key, propertySchema(field));
            if (!field.nullable() && field.constructorDefault() == null) {
                target.addRequiredItem(key);
            }
        }
    }

    private Schema<?> propertySchema(FieldShape field) {
        Schema<?> schema = schemaFor(field.type());
        boolean annotated = field.description() != null || field.example() != null
            || field.defaultValue() != null || field.nullable();
        if (annotated && schema.get$ref() != null) {
            // siblings of $ref are ignored by readers
            Schema<Object> wrapper = new Schema<>();
            wrapper.addAllOfItem(schema);
            schema = wrapper;
        }
        if (field.description() != null) {
            schema.setDescription(field.description());
        }
        if (field.example() != null) {
            schema.setExample(field.example());
        }
        Object defaultValue = field.defaultValue() != null ? field.defaultValue() : field.constructorDefault();
        if (defaultValue != null) {
            schema.setDefault(defaultValue);
        }
        if (field.nullable()) {
            schema.setNullable(true);
        }
        return schema;
    }
}
