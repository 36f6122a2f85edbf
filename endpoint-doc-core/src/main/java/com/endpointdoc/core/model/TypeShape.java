package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A reflected request or response type.
 *
 * <p>Inheritance is expressed through {@code base}; polymorphism through {@code subTypes}
 * discriminated by the {@code discriminator} property. List-like shapes describe collections
 * of {@code elementShape}.
 *
 * @param name type name, used as the named schema key
 * @param listLike whether the type is a collection
 * @param emptyRequestMarker whether this is the designated "no request" marker type
 * @param elementShape element type of list-like shapes
 * @param base base type, if any
 * @param discriminator discriminator property of a polymorphic base type
 * @param subTypes polymorphic subtypes
 * @param fields declared fields, excluding inherited ones
 * @param summary documented summary of the type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeShape(
    @JsonProperty("name") String name,
    @JsonProperty("listLike") boolean listLike,
    @JsonProperty("emptyRequestMarker") boolean emptyRequestMarker,
    @JsonProperty("elementShape") TypeShape elementShape,
    @JsonProperty("base") TypeShape base,
    @JsonProperty("discriminator") String discriminator,
    @JsonProperty("subTypes") List<TypeShape> subTypes,
    @JsonProperty("fields") List<FieldShape> fields,
    @JsonProperty("summary") String summary
) {
    /**
     * Compact constructor with validation.
     */
    public TypeShape {
        Objects.requireNonNull(name, "name must not be null");
        subTypes = subTypes == null ? List.of() : List.copyOf(subTypes);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * Creates a plain object shape.
     *
     * @param name type name
     * @param fields declared fields
     * @return shape
     */
    public static TypeShape of(String name, FieldShape... fields) {
        return new TypeShape(name, false, false, null, null, null, List.of(), Arrays.asList(fields), null);
    }

    /**
     * Creates a list-like shape of the given element type.
     *
     * @param name type name
     * @param elementShape element type
     * @return shape
     */
    public static TypeShape listOf(String name, TypeShape elementShape) {
        return new TypeShape(name, true, false, elementShape, null, null, List.of(), List.of(), null);
    }

    /**
     * Creates the designated empty request marker shape.
     *
     * @param name type name
     * @return shape
     */
    public static TypeShape emptyRequest(String name) {
        return new TypeShape(name, false, true, null, null, null, List.of(), List.of(), null);
    }

    public TypeShape withBase(TypeShape base) {
        return new TypeShape(name, listLike, emptyRequestMarker, elementShape, base, discriminator, subTypes, fields, summary);
    }

    public TypeShape withSubTypes(String discriminator, TypeShape... subTypes) {
        return new TypeShape(name, listLike, emptyRequestMarker, elementShape, base, discriminator,
            Arrays.asList(subTypes), fields, summary);
    }

    /**
     * Returns declared and inherited fields, base fields first.
     *
     * <p>A field redeclared by a subtype replaces the inherited one.
     *
     * @return all fields
     */
    public List<FieldShape> allFields() {
        Map<String, FieldShape> byName = new LinkedHashMap<>();
        if (base != null) {
            for (FieldShape field : base.allFields()) {
                byName.put(field.name(), field);
            }
        }
        for (FieldShape field : fields) {
            byName.put(field.name(), field);
        }
        return new ArrayList<>(byName.values());
    }

    /**
     * Returns whether the shape is polymorphic.
     *
     * @return true if subtypes and a discriminator are declared
     */
    public boolean isPolymorphic() {
        return discriminator != null && !subTypes.isEmpty();
    }
}
