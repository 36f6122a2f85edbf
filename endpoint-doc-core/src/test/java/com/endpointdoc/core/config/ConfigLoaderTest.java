package com.endpointdoc.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsOptions() throws IOException {
        Path configFile = tempDir.resolve("endpointdoc.yaml");
        Files.writeString(configFile, """
            title: "Orders API"
            documentVersion: "2.1.0"
            dialect: SWAGGER_2
            autoTagPathSegmentIndex: 2
            tagCase: LOWER_CASE
            tagStripSymbols: true
            enableGetRequestsWithBody: true
            useOneOfForPolymorphism: true
            removeEmptyRequestSchema: true
            namingConvention: SNAKE_CASE
            endpointRoutePrefix: "api"
            versioningPrefix: "ver"
            routeConstraints:
              short: "integer/int32"
            """);

        DocumentOptions options = ConfigLoader.load(configFile);

        assertThat(options.title()).isEqualTo("Orders API");
        assertThat(options.documentVersion()).isEqualTo("2.1.0");
        assertThat(options.dialect()).isEqualTo(SpecDialect.SWAGGER_2);
        assertThat(options.isLegacyDialect()).isTrue();
        assertThat(options.autoTagPathSegmentIndex()).isEqualTo(2);
        assertThat(options.tagCase()).isEqualTo(TagCase.LOWER_CASE);
        assertThat(options.tagStripSymbols()).isTrue();
        assertThat(options.enableGetRequestsWithBody()).isTrue();
        assertThat(options.useOneOfForPolymorphism()).isTrue();
        assertThat(options.removeEmptyRequestSchema()).isTrue();
        assertThat(options.namingConvention()).isEqualTo(NamingConvention.SNAKE_CASE);
        assertThat(options.endpointRoutePrefix()).isEqualTo("api");
        assertThat(options.versioningPrefix()).isEqualTo("ver");
        assertThat(options.routeConstraints())
            .containsEntry("short", "integer/int32")
            .containsEntry("int", "integer/int32");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("endpointdoc.yaml");
        Files.writeString(configFile, """
            title: "Minimal"
            """);

        DocumentOptions options = ConfigLoader.load(configFile);

        assertThat(options.title()).isEqualTo("Minimal");
        assertThat(options.documentVersion()).isEqualTo("1.0.0");
        assertThat(options.dialect()).isEqualTo(SpecDialect.OPENAPI_3);
        assertThat(options.autoTagPathSegmentIndex()).isEqualTo(1);
        assertThat(options.tagCase()).isEqualTo(TagCase.TITLE_CASE);
        assertThat(options.generateExamples()).isTrue();
        assertThat(options.namingConvention()).isEqualTo(NamingConvention.CAMEL_CASE);
        assertThat(options.versioningPrefix()).isEqualTo("v");
        assertThat(options.endpointRoutePrefix()).isNull();
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("endpointdoc.yaml");
        Files.writeString(configFile, """
            title: "Lenient"
            somethingElse: 42
            """);

        DocumentOptions options = ConfigLoader.load(configFile);

        assertThat(options.title()).isEqualTo("Lenient");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        DocumentOptions options = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(options).isEqualTo(DocumentOptions.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("endpointdoc.yaml");
        Files.writeString(configFile, "");

        DocumentOptions options = ConfigLoader.load(configFile);

        assertThat(options).isEqualTo(DocumentOptions.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("endpointdoc.yaml");
        Files.writeString(configFile, """
            title: [unterminated
            """);

        DocumentOptions options = ConfigLoader.load(configFile);

        assertThat(options).isEqualTo(DocumentOptions.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        DocumentOptions options = ConfigLoader.load(tempDir);

        assertThat(options).isEqualTo(DocumentOptions.defaults());
    }
}
