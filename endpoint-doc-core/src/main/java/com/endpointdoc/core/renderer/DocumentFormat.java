package com.endpointdoc.core.renderer;

import java.util.Locale;

/**
 * Wire format of a rendered document.
 */
public enum DocumentFormat {
    JSON("json", "application/json"),
    YAML("yaml", "application/yaml");

    private final String extension;
    private final String contentType;

    DocumentFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Parses a format name, ignoring case.
     *
     * @param value "json", "yaml" or "yml"
     * @return format
     * @throws IllegalArgumentException for unknown names
     */
    public static DocumentFormat parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "yaml", "yml" -> YAML;
            default -> throw new IllegalArgumentException("Unknown document format: " + value);
        };
    }
}
