package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A reflected field of a request or response shape.
 *
 * @param name reflected field name
 * @param wireName explicit wire-level name, overriding the naming convention
 * @param type wire type
 * @param nullable whether the field accepts null
 * @param settable whether the field is publicly settable (defaults to true)
 * @param constructorDefault default value supplied by the constructor, null when none
 * @param defaultValue declared default value, null when none
 * @param ignored whether the serializer always ignores the field
 * @param hidden whether the field is hidden from documentation
 * @param description documentation of the field
 * @param example declared example value
 * @param bindings binding annotations in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldShape(
    @JsonProperty("name") String name,
    @JsonProperty("wireName") String wireName,
    @JsonProperty("type") WireType type,
    @JsonProperty("nullable") boolean nullable,
    @JsonProperty("settable") Boolean settable,
    @JsonProperty("constructorDefault") Object constructorDefault,
    @JsonProperty("defaultValue") Object defaultValue,
    @JsonProperty("ignored") boolean ignored,
    @JsonProperty("hidden") boolean hidden,
    @JsonProperty("description") String description,
    @JsonProperty("example") Object example,
    @JsonProperty("bindings") List<FieldBinding> bindings
) {
    /**
     * Compact constructor with validation.
     */
    public FieldShape {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null) {
            type = WireType.string();
        }
        if (settable == null) {
            settable = true;
        }
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }

    /**
     * Creates a settable, non-nullable field without annotations.
     *
     * @param name field name
     * @param type wire type
     * @return field shape
     */
    public static FieldShape of(String name, WireType type) {
        return new FieldShape(name, null, type, false, true, null, null, false, false, null, null, List.of());
    }

    public FieldShape withBinding(FieldBinding binding) {
        List<FieldBinding> all = new ArrayList<>(bindings);
        all.add(binding);
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, all);
    }

    public FieldShape withNullable(boolean nullable) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    public FieldShape withDescription(String description) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    public FieldShape withExample(Object example) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    public FieldShape withWireName(String wireName) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    public FieldShape withConstructorDefault(Object constructorDefault) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    public FieldShape withDefaultValue(Object defaultValue) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    public FieldShape withHidden(boolean hidden) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    public FieldShape withSettable(boolean settable) {
        return new FieldShape(name, wireName, type, nullable, settable, constructorDefault, defaultValue,
            ignored, hidden, description, example, bindings);
    }

    /**
     * Returns the first binding of the given kind.
     *
     * @param kind binding kind
     * @return binding, or empty if the field has none of that kind
     */
    public Optional<FieldBinding> binding(BindingKind kind) {
        return bindings.stream().filter(b -> b.kind() == kind).findFirst();
    }

    /**
     * Returns whether the field carries a binding of the given kind.
     *
     * @param kind binding kind
     * @return true if present
     */
    public boolean hasBinding(BindingKind kind) {
        return binding(kind).isPresent();
    }

    /**
     * Returns the name used for route matching: the {@code BIND_FROM} alias or the field name.
     *
     * @return binding name
     */
    public String bindingName() {
        return binding(BindingKind.BIND_FROM)
            .map(FieldBinding::name)
            .filter(n -> n != null && !n.isBlank())
            .orElse(name);
    }

    /**
     * Returns whether the field is excluded from documentation before classification.
     *
     * @return true if ignored, hidden or not publicly settable
     */
    public boolean isExcludedFromDocs() {
        return ignored || hidden || !settable;
    }
}
