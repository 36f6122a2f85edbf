package com.endpointdoc.core.util;

import com.endpointdoc.core.config.NamingConvention;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Factory and helpers for the Jackson mapper that serializes user-supplied examples.
 */
public final class ExampleMappers {

    private ExampleMappers() {
        // Utility class
    }

    /**
     * Creates a mapper whose property names follow the naming convention, so example keys line
     * up with schema property keys.
     *
     * @param naming wire-level naming convention
     * @return configured mapper
     */
    public static ObjectMapper create(NamingConvention naming) {
        ObjectMapper mapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.ALWAYS);
        if (naming.strategy() != null) {
            mapper.setPropertyNamingStrategy(naming.strategy());
        }
        return mapper;
    }

    /**
     * Converts an example object into plain maps, lists and scalars.
     *
     * @param mapper example mapper
     * @param value example object or JSON tree, may be null
     * @return plain value, or null
     */
    public static Object toPlain(ObjectMapper mapper, Object value) {
        if (value == null) {
            return null;
        }
        return mapper.convertValue(value, Object.class);
    }
}
