package com.endpointdoc.core.operation;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.model.BindingKind;
import com.endpointdoc.core.model.FieldBinding;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.WireType;
import com.endpointdoc.core.schema.ExampleSampler;
import com.endpointdoc.core.schema.ShapeSchemaGenerator;
import com.endpointdoc.core.util.ExampleMappers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;

import java.util.Map;

/**
 * Creates operation parameters from request fields.
 *
 * <p>Naming: a path or query name is converted with the naming convention; header names and
 * {@code BIND_FROM} aliases are used verbatim. A parameter is required when forced by the caller,
 * otherwise when its field has no constructor default and is not nullable.
 */
public class ParameterFactory {

    private final ShapeSchemaGenerator generator;
    private final ExampleSampler sampler;
    private final DocumentOptions options;
    private final ObjectMapper mapper;
    private final Map<String, ParamDescription> descriptions;
    private final Map<String, WireType> constraintTypes;

    public ParameterFactory(ShapeSchemaGenerator generator,
                            ExampleSampler sampler,
                            DocumentOptions options,
                            ObjectMapper mapper,
                            Map<String, ParamDescription> descriptions,
                            Map<String, WireType> constraintTypes) {
        this.generator = generator;
        this.sampler = sampler;
        this.options = options;
        this.mapper = mapper;
        this.descriptions = descriptions;
        this.constraintTypes = constraintTypes;
    }

    /**
     * Creates a parameter.
     *
     * @param kind parameter location
     * @param field backing field, null for synthesized parameters
     * @param explicitName explicit name (route token, header name), null to derive from the field
     * @param forceRequired requirement imposed by the caller, null to derive from the field
     * @return parameter
     */
    public Parameter create(ParameterKind kind, FieldShape field, String explicitName, Boolean forceRequired) {
        String name = parameterName(kind, field, explicitName);
        String lookupKey = field != null ? field.name() : name;

        WireType type = field != null
            ? field.type()
            : constraintTypes.getOrDefault(explicitName, constraintTypes.getOrDefault(name, WireType.string()));
        Schema<?> schema = generator.schemaFor(type);
        if (type.isNamedEnum() || (schema.get$ref() != null && field != null && hasDefault(field))) {
            schema = wrap(schema);
        }

        boolean required;
        if (forceRequired != null) {
            required = forceRequired;
        } else if (field == null || field.constructorDefault() != null) {
            required = false;
        } else {
            required = !field.nullable();
        }

        if (!required && field != null && field.nullable() && schema.get$ref() == null) {
            schema.setNullable(true);
        }

        Object defaultValue = field != null ? defaultOf(field) : null;
        if (defaultValue != null) {
            schema.setDefault(defaultValue);
        }

        ParamDescription description = descriptions.get(lookupKey);
        Parameter parameter = new Parameter()
            .name(name)
            .in(kind.in())
            .required(required)
            .schema(schema);
        if (description != null && description.getDescription() != null) {
            parameter.setDescription(description.getDescription());
        }

        if (options.generateExamples()) {
            Object example = exampleOf(description, field, schema, required, defaultValue);
            if (example != null) {
                parameter.setExample(example);
            }
        }
        return parameter;
    }

    private String parameterName(ParameterKind kind, FieldShape field, String explicitName) {
        if (explicitName != null) {
            return kind == ParameterKind.PATH || kind == ParameterKind.QUERY
                ? options.namingConvention().apply(explicitName)
                : explicitName;
        }
        if (field == null) {
            throw new IllegalArgumentException("Parameter name is required when no field is given");
        }
        return field.binding(BindingKind.BIND_FROM)
            .map(FieldBinding::name)
            .filter(n -> n != null && !n.isBlank())
            .orElseGet(() -> options.namingConvention().apply(field.name()));
    }

    private Object exampleOf(ParamDescription description, FieldShape field, Schema<?> schema,
                             boolean required, Object defaultValue) {
        if (description != null && description.getExample() != null && !description.getExample().isNull()) {
            return ExampleMappers.toPlain(mapper, description.getExample());
        }
        if (field != null && field.example() != null) {
            return ExampleMappers.toPlain(mapper, field.example());
        }
        if (required && defaultValue == null) {
            JsonNode sample = sampler.sample(schema);
            // scalar samples carry no information beyond the schema itself
            if (sample.isContainerNode() && sample.size() > 0) {
                return ExampleMappers.toPlain(mapper, sample);
            }
        }
        return null;
    }

    private static boolean hasDefault(FieldShape field) {
        return defaultOf(field) != null;
    }

    private static Object defaultOf(FieldShape field) {
        return field.defaultValue() != null ? field.defaultValue() : field.constructorDefault();
    }

    private static Schema<?> wrap(Schema<?> reference) {
        Schema<Object> wrapper = new Schema<>();
        wrapper.addAllOfItem(reference);
        return wrapper;
    }

    /**
     * Returns the merged description of a field.
     *
     * @param fieldName reflected field name
     * @return description, or null
     */
    public String descriptionOf(String fieldName) {
        ParamDescription description = descriptions.get(fieldName);
        return description != null ? description.getDescription() : null;
    }
}
