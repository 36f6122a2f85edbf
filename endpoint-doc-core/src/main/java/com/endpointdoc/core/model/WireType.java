package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Wire-level type of a reflected field.
 *
 * <p>Primitive types carry a JSON type and optional format. Arrays carry an item type,
 * objects a reference to another reflected {@link TypeShape}. Enumerations with an
 * {@code enumName} become shared named schemas.
 *
 * @param type JSON type ("string", "integer", "number", "boolean", "array", "object")
 * @param format optional format ("int32", "uuid", "binary", ...)
 * @param items item type for arrays
 * @param shape referenced shape for objects
 * @param file whether the value is an uploaded file
 * @param enumName name of the enumeration, if any
 * @param enumValues allowed values of the enumeration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WireType(
    @JsonProperty("type") String type,
    @JsonProperty("format") String format,
    @JsonProperty("items") WireType items,
    @JsonProperty("shape") TypeShape shape,
    @JsonProperty("file") boolean file,
    @JsonProperty("enumName") String enumName,
    @JsonProperty("enumValues") List<String> enumValues
) {
    /**
     * Compact constructor with validation.
     */
    public WireType {
        if (type == null) {
            type = shape != null ? "object" : items != null ? "array" : "string";
        }
        if (enumValues == null) {
            enumValues = List.of();
        }
    }

    public static WireType of(String type, String format) {
        return new WireType(type, format, null, null, false, null, null);
    }

    public static WireType string() {
        return of("string", null);
    }

    public static WireType integer() {
        return of("integer", "int32");
    }

    public static WireType int64() {
        return of("integer", "int64");
    }

    public static WireType number() {
        return of("number", "double");
    }

    public static WireType bool() {
        return of("boolean", null);
    }

    public static WireType uuid() {
        return of("string", "uuid");
    }

    public static WireType dateTime() {
        return of("string", "date-time");
    }

    /**
     * Byte array as reported by reflection (base64 string).
     */
    public static WireType bytes() {
        return of("string", "byte");
    }

    public static WireType fileUpload() {
        return new WireType("string", "binary", null, null, true, null, null);
    }

    public static WireType arrayOf(WireType items) {
        Objects.requireNonNull(items, "items must not be null");
        return new WireType("array", null, items, null, false, null, null);
    }

    public static WireType object(TypeShape shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        return new WireType("object", null, null, shape, false, null, null);
    }

    public static WireType enumeration(String enumName, List<String> values) {
        return new WireType("string", null, null, null, false, enumName, values);
    }

    /**
     * Parses a {@code type[/format]} hint such as {@code integer/int64}.
     *
     * @param hint type hint
     * @return parsed wire type, string when the hint is blank
     */
    public static WireType parse(String hint) {
        if (hint == null || hint.isBlank()) {
            return string();
        }
        int slash = hint.indexOf('/');
        if (slash < 0) {
            return of(hint.trim(), null);
        }
        return of(hint.substring(0, slash).trim(), hint.substring(slash + 1).trim());
    }

    /**
     * Returns whether this is a named enumeration.
     *
     * @return true if values are declared under an enumeration name
     */
    public boolean isNamedEnum() {
        return enumName != null && !enumValues.isEmpty();
    }
}
