package com.endpointdoc.core.operation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Description and example of one request field, merged from several sources.
 */
public class ParamDescription {

    private String description;
    private JsonNode example;

    public ParamDescription() {
    }

    public ParamDescription(String description, JsonNode example) {
        this.description = description;
        this.example = example;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public JsonNode getExample() {
        return example;
    }

    public void setExample(JsonNode example) {
        this.example = example;
    }
}
