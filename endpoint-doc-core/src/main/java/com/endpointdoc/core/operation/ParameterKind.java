package com.endpointdoc.core.operation;

/**
 * Location of an operation parameter.
 */
public enum ParameterKind {
    PATH("path"),
    QUERY("query"),
    HEADER("header"),
    /**
     * Form field; only emitted in the legacy dialect.
     */
    FORM_DATA("formData");

    private final String in;

    ParameterKind(String in) {
        this.in = in;
    }

    /**
     * Returns the value of the parameter's {@code in} attribute.
     *
     * @return location name
     */
    public String in() {
        return in;
    }
}
