package com.endpointdoc.core.config;

import com.endpointdoc.core.model.FieldShape;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;

/**
 * Wire-level naming convention applied to reflected field names.
 *
 * <p>The same convention drives schema property keys, parameter names and the Jackson
 * mapper that serializes user examples, so keys produced by any of them line up.
 */
public enum NamingConvention {
    AS_IS(null),
    CAMEL_CASE(PropertyNamingStrategies.LOWER_CAMEL_CASE),
    PASCAL_CASE(PropertyNamingStrategies.UPPER_CAMEL_CASE),
    SNAKE_CASE(PropertyNamingStrategies.SNAKE_CASE),
    KEBAB_CASE(PropertyNamingStrategies.KEBAB_CASE);

    private final PropertyNamingStrategy strategy;

    NamingConvention(PropertyNamingStrategy strategy) {
        this.strategy = strategy;
    }

    /**
     * Returns the Jackson strategy backing this convention.
     *
     * @return naming strategy, or null for {@link #AS_IS}
     */
    public PropertyNamingStrategy strategy() {
        return strategy;
    }

    /**
     * Converts a reflected field name into its wire-level form.
     *
     * @param name reflected name
     * @return converted name; null and empty names are returned unchanged
     */
    public String apply(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return switch (this) {
            case AS_IS -> name;
            // Jackson's lower camel strategy is a pass-through for bean names
            case CAMEL_CASE -> Character.toLowerCase(name.charAt(0)) + name.substring(1);
            default -> ((PropertyNamingStrategies.NamingBase) strategy).translate(name);
        };
    }

    /**
     * Returns the wire-level name of a field: its explicit wire name, else its converted name.
     *
     * @param field reflected field
     * @return schema property key of the field
     */
    public String wireName(FieldShape field) {
        return field.wireName() != null ? field.wireName() : apply(field.name());
    }
}
