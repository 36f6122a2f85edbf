package com.endpointdoc.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global documentation policy shared by every pipeline run.
 *
 * <p>Loaded from {@code endpointdoc.yaml} by {@link ConfigLoader}. Every stage receives this
 * value explicitly; nothing reads policy from static state.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * title: "Orders API"
 * documentVersion: "2.1.0"
 * dialect: OPENAPI_3
 * autoTagPathSegmentIndex: 2
 * tagCase: TITLE_CASE
 * tagStripSymbols: true
 * namingConvention: CAMEL_CASE
 * endpointRoutePrefix: "api"
 * versioningPrefix: "v"
 * removeEmptyRequestSchema: true
 * routeConstraints:
 *   short: "integer/int32"
 * }</pre>
 *
 * @param title document title
 * @param documentVersion document version
 * @param dialect specification dialect
 * @param autoTagPathSegmentIndex 1-based bare-route segment used as tag; 0 disables auto-tagging
 * @param tagCase case transform applied to derived tags
 * @param tagStripSymbols whether non-alphanumeric characters are stripped from tags
 * @param enableGetRequestsWithBody whether GET requests keep a request body
 * @param useOneOfForPolymorphism whether polymorphic response schemas are flattened into {@code oneOf}
 * @param removeEmptyRequestSchema whether named object schemas left without properties are deleted
 * @param allowEmptyRequestShapes whether request shapes without settable fields are tolerated
 * @param generateExamples whether parameter examples are generated
 * @param namingConvention wire-level naming convention
 * @param endpointRoutePrefix global route prefix removed when computing bare routes
 * @param versioningPrefix prefix of version route segments (e.g. "v" in "/v2")
 * @param usingExternalVersioning whether an external versioning add-on pre-populates parameters
 * @param routeConstraints route constraint name to "type[/format]" hint, merged over the defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentOptions(
    @JsonProperty("title") String title,
    @JsonProperty("documentVersion") String documentVersion,
    @JsonProperty("dialect") SpecDialect dialect,
    @JsonProperty("autoTagPathSegmentIndex") Integer autoTagPathSegmentIndex,
    @JsonProperty("tagCase") TagCase tagCase,
    @JsonProperty("tagStripSymbols") boolean tagStripSymbols,
    @JsonProperty("enableGetRequestsWithBody") boolean enableGetRequestsWithBody,
    @JsonProperty("useOneOfForPolymorphism") boolean useOneOfForPolymorphism,
    @JsonProperty("removeEmptyRequestSchema") boolean removeEmptyRequestSchema,
    @JsonProperty("allowEmptyRequestShapes") boolean allowEmptyRequestShapes,
    @JsonProperty("generateExamples") Boolean generateExamples,
    @JsonProperty("namingConvention") NamingConvention namingConvention,
    @JsonProperty("endpointRoutePrefix") String endpointRoutePrefix,
    @JsonProperty("versioningPrefix") String versioningPrefix,
    @JsonProperty("usingExternalVersioning") boolean usingExternalVersioning,
    @JsonProperty("routeConstraints") Map<String, String> routeConstraints
) {
    /**
     * Route constraint hints known out of the box.
     */
    public static final Map<String, String> DEFAULT_ROUTE_CONSTRAINTS = Map.of(
        "int", "integer/int32",
        "long", "integer/int64",
        "bool", "boolean",
        "guid", "string/uuid",
        "decimal", "number/double",
        "double", "number/double",
        "float", "number/float",
        "datetime", "string/date-time"
    );

    /**
     * Compact constructor filling defaults for absent values.
     */
    public DocumentOptions {
        if (title == null) {
            title = "API";
        }
        if (documentVersion == null) {
            documentVersion = "1.0.0";
        }
        if (dialect == null) {
            dialect = SpecDialect.OPENAPI_3;
        }
        if (autoTagPathSegmentIndex == null) {
            autoTagPathSegmentIndex = 1;
        }
        if (tagCase == null) {
            tagCase = TagCase.TITLE_CASE;
        }
        if (generateExamples == null) {
            generateExamples = true;
        }
        if (namingConvention == null) {
            namingConvention = NamingConvention.CAMEL_CASE;
        }
        if (versioningPrefix == null) {
            versioningPrefix = "v";
        }
        Map<String, String> constraints = new LinkedHashMap<>(DEFAULT_ROUTE_CONSTRAINTS);
        if (routeConstraints != null) {
            constraints.putAll(routeConstraints);
        }
        routeConstraints = Map.copyOf(constraints);
    }

    /**
     * Creates the default policy.
     *
     * @return default options
     */
    public static DocumentOptions defaults() {
        return builder().build();
    }

    /**
     * Starts a builder seeded with default values.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder seeded with this policy's values.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        return new Builder()
            .title(title)
            .documentVersion(documentVersion)
            .dialect(dialect)
            .autoTagPathSegmentIndex(autoTagPathSegmentIndex)
            .tagCase(tagCase)
            .tagStripSymbols(tagStripSymbols)
            .enableGetRequestsWithBody(enableGetRequestsWithBody)
            .useOneOfForPolymorphism(useOneOfForPolymorphism)
            .removeEmptyRequestSchema(removeEmptyRequestSchema)
            .allowEmptyRequestShapes(allowEmptyRequestShapes)
            .generateExamples(generateExamples)
            .namingConvention(namingConvention)
            .endpointRoutePrefix(endpointRoutePrefix)
            .versioningPrefix(versioningPrefix)
            .usingExternalVersioning(usingExternalVersioning)
            .routeConstraints(routeConstraints);
    }

    /**
     * Returns whether the legacy (Swagger 2) dialect is active.
     *
     * @return true for {@link SpecDialect#SWAGGER_2}
     */
    public boolean isLegacyDialect() {
        return dialect == SpecDialect.SWAGGER_2;
    }

    /**
     * Fluent builder for {@link DocumentOptions}.
     */
    public static final class Builder {
        private String title;
        private String documentVersion;
        private SpecDialect dialect;
        private Integer autoTagPathSegmentIndex;
        private TagCase tagCase;
        private boolean tagStripSymbols;
        private boolean enableGetRequestsWithBody;
        private boolean useOneOfForPolymorphism;
        private boolean removeEmptyRequestSchema;
        private boolean allowEmptyRequestShapes;
        private Boolean generateExamples;
        private NamingConvention namingConvention;
        private String endpointRoutePrefix;
        private String versioningPrefix;
        private boolean usingExternalVersioning;
        private Map<String, String> routeConstraints;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder documentVersion(String documentVersion) {
            this.documentVersion = documentVersion;
            return this;
        }

        public Builder dialect(SpecDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder autoTagPathSegmentIndex(Integer autoTagPathSegmentIndex) {
            this.autoTagPathSegmentIndex = autoTagPathSegmentIndex;
            return this;
        }

        public Builder tagCase(TagCase tagCase) {
            this.tagCase = tagCase;
            return this;
        }

        public Builder tagStripSymbols(boolean tagStripSymbols) {
            this.tagStripSymbols = tagStripSymbols;
            return this;
        }

        public Builder enableGetRequestsWithBody(boolean enableGetRequestsWithBody) {
            this.enableGetRequestsWithBody = enableGetRequestsWithBody;
            return this;
        }

        public Builder useOneOfForPolymorphism(boolean useOneOfForPolymorphism) {
            this.useOneOfForPolymorphism = useOneOfForPolymorphism;
            return this;
        }

        public Builder removeEmptyRequestSchema(boolean removeEmptyRequestSchema) {
            this.removeEmptyRequestSchema = removeEmptyRequestSchema;
            return this;
        }

        public Builder allowEmptyRequestShapes(boolean allowEmptyRequestShapes) {
            this.allowEmptyRequestShapes = allowEmptyRequestShapes;
            return this;
        }

        public Builder generateExamples(Boolean generateExamples) {
            this.generateExamples = generateExamples;
            return this;
        }

        public Builder namingConvention(NamingConvention namingConvention) {
            this.namingConvention = namingConvention;
            return this;
        }

        public Builder endpointRoutePrefix(String endpointRoutePrefix) {
            this.endpointRoutePrefix = endpointRoutePrefix;
            return this;
        }

        public Builder versioningPrefix(String versioningPrefix) {
            this.versioningPrefix = versioningPrefix;
            return this;
        }

        public Builder usingExternalVersioning(boolean usingExternalVersioning) {
            this.usingExternalVersioning = usingExternalVersioning;
            return this;
        }

        public Builder routeConstraints(Map<String, String> routeConstraints) {
            this.routeConstraints = routeConstraints;
            return this;
        }

        public DocumentOptions build() {
            return new DocumentOptions(
                title,
                documentVersion,
                dialect,
                autoTagPathSegmentIndex,
                tagCase,
                tagStripSymbols,
                enableGetRequestsWithBody,
                useOneOfForPolymorphism,
                removeEmptyRequestSchema,
                allowEmptyRequestShapes,
                generateExamples,
                namingConvention,
                endpointRoutePrefix,
                versioningPrefix,
                usingExternalVersioning,
                routeConstraints
            );
        }
    }
}
