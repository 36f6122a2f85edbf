package com.endpointdoc.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.endpointdoc.core.config.ConfigLoader;
import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.document.BuiltDocument;
import com.endpointdoc.core.document.DocumentBuilder;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.operation.UnsupportedRequestShapeException;
import com.endpointdoc.core.source.DescriptorLoadException;
import com.endpointdoc.core.source.DescriptorLoader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check that descriptors can be documented without writing anything.
 *
 * <p>Runs the full pipeline and reports the first fatal error, such as a request shape with no
 * settable fields.
 */
@Command(
    name = "validate",
    description = "Validate endpoint descriptors against the documentation policy",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Descriptor file or directory", defaultValue = ".")
    private Path descriptorPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: endpointdoc.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        log.info("Validating descriptors: {}", descriptorPath);
        try {
            DocumentOptions options = ConfigLoader.load(configPath);
            List<EndpointDescriptor> endpoints = new DescriptorLoader().load(descriptorPath);
            BuiltDocument document = new DocumentBuilder(options).build(endpoints);

            System.out.println("✓ " + endpoints.size() + " endpoints, "
                + document.operationCount() + " operations, "
                + document.versionMarkers().size() + " version markers");
            System.out.println("✓ Descriptors are valid");
            return 0;
        } catch (DescriptorLoadException e) {
            System.err.println("✗ Cannot load descriptors: " + e.getMessage());
            return 1;
        } catch (UnsupportedRequestShapeException e) {
            System.err.println("✗ Endpoint " + e.getEndpointType() + " has an unsupported request shape: "
                + e.getShapeName());
            return 1;
        } catch (RuntimeException e) {
            log.debug("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
