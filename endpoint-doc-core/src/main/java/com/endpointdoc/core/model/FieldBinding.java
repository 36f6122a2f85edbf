package com.endpointdoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One binding annotation on a reflected field.
 *
 * @param kind binding kind
 * @param name bound name (header name, claim type, alias); null means the field name
 * @param required whether the binding must be satisfied
 * @param removeFromSchema whether the field is removed from the body schema even when optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldBinding(
    @JsonProperty("kind") BindingKind kind,
    @JsonProperty("name") String name,
    @JsonProperty("required") boolean required,
    @JsonProperty("removeFromSchema") boolean removeFromSchema
) {
    /**
     * Compact constructor with validation.
     */
    public FieldBinding {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static FieldBinding of(BindingKind kind) {
        return new FieldBinding(kind, null, false, false);
    }

    public static FieldBinding bindFrom(String name) {
        return new FieldBinding(BindingKind.BIND_FROM, name, false, false);
    }

    public static FieldBinding header(String name, boolean required) {
        return new FieldBinding(BindingKind.FROM_HEADER, name, required, false);
    }

    public static FieldBinding claim(String claimType, boolean required) {
        return new FieldBinding(BindingKind.FROM_CLAIM, claimType, required, false);
    }

    public static FieldBinding permission(String permission, boolean required) {
        return new FieldBinding(BindingKind.HAS_PERMISSION, permission, required, false);
    }

    public static FieldBinding toHeader(String name) {
        return new FieldBinding(BindingKind.TO_HEADER, name, false, false);
    }
}
