package com.endpointdoc.cli;

import com.endpointdoc.EndpointDocCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for the {@code endpointdoc} command line.
 */
class EndpointDocCLITest {

    @TempDir
    Path tempDir;

    private Path descriptors;
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        descriptors = tempDir.resolve("endpoints.yaml");
        Files.writeString(descriptors, """
            endpoints:
              - routeTemplate: "api/orders/{id:int}"
                verb: get
                requestShape:
                  name: GetOrderRequest
                  fields:
                    - name: Id
                      type: { type: integer, format: int32 }
                responseTypes:
                  - statusCode: 200
                    contentTypes: [ "application/json" ]
                definition:
                  endpointType: GetOrderEndpoint
            """);

        config = tempDir.resolve("endpointdoc.yaml");
        Files.writeString(config, """
            title: "Orders API"
            endpointRoutePrefix: "api"
            """);
    }

    @Test
    void build_defaultFormat_writesJsonDocument() throws IOException {
        Path output = tempDir.resolve("out");

        int exitCode = execute("build", descriptors.toString(), "-c", config.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        Path document = output.resolve("openapi.json");
        assertThat(document).exists();
        assertThat(Files.readString(document))
            .contains("\"title\" : \"Orders API\"")
            .contains("/orders/{id}");
    }

    @Test
    void build_yamlFormat_writesYamlDocument() {
        Path output = tempDir.resolve("out");

        int exitCode = execute("build", descriptors.toString(), "-c", config.toString(),
            "-o", output.toString(), "--format", "yaml");

        assertThat(exitCode).isZero();
        assertThat(output.resolve("openapi.yaml")).exists();
        assertThat(output.resolve("openapi.json")).doesNotExist();
    }

    @Test
    void build_unknownFormat_fails() {
        int exitCode = execute("build", descriptors.toString(), "-c", config.toString(),
            "-o", tempDir.resolve("out").toString(), "--format", "xml");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void build_missingDescriptors_fails() {
        int exitCode = execute("build", tempDir.resolve("missing.yaml").toString(), "-c", config.toString(),
            "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("out").resolve("openapi.json")).doesNotExist();
    }

    @Test
    void build_missingConfig_usesDefaults() {
        Path output = tempDir.resolve("out");

        int exitCode = execute("build", descriptors.toString(), "-c", tempDir.resolve("absent.yaml").toString(),
            "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(output.resolve("openapi.json")).exists();
    }

    @Test
    void validate_validDescriptors_succeeds() {
        int exitCode = execute("validate", descriptors.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void validate_requestShapeWithoutSettableFields_fails() throws IOException {
        Path invalid = tempDir.resolve("jobs.yaml");
        Files.writeString(invalid, """
            endpoints:
              - routeTemplate: "/jobs"
                verb: post
                requestShape:
                  name: StartJob
                  fields:
                    - name: Started
                      type: { type: string, format: date-time }
                      settable: false
                definition:
                  endpointType: StartJobEndpoint
            """);

        int exitCode = execute("validate", invalid.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void list_processors_succeeds() {
        assertThat(execute("list", "processors")).isZero();
    }

    @Test
    void list_renderers_succeeds() {
        assertThat(execute("list", "renderers")).isZero();
    }

    @Test
    void list_unknownType_fails() {
        assertThat(execute("list", "scanners")).isEqualTo(1);
    }

    @Test
    void findRenderer_unknownId_throws() {
        assertThatThrownBy(() -> BuildCommand.findRenderer("pdf"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("pdf");
    }

    private int execute(String... args) {
        return EndpointDocCLI.commandLine().execute(args);
    }
}
