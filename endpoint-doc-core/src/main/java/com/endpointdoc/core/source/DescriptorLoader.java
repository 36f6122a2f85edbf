package com.endpointdoc.core.source;

import com.endpointdoc.core.model.EndpointCatalog;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Loads endpoint descriptors exported by the routing collaborator.
 *
 * <p>A descriptor file holds an {@link EndpointCatalog}. Files ending in {@code .json} are read as
 * JSON, everything else as YAML. A directory is loaded file by file in name order, so the endpoint
 * order of the resulting document is stable between runs.
 */
public class DescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorLoader.class);

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public DescriptorLoader() {
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
        this.jsonMapper = configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads every endpoint declared in a file or directory.
     *
     * @param source descriptor file, or directory of descriptor files
     * @return endpoints in file order
     * @throws DescriptorLoadException if the source is missing or a file cannot be parsed
     */
    public List<EndpointDescriptor> load(Path source) {
        if (!Files.exists(source)) {
            throw new DescriptorLoadException("Descriptor source not found: " + source);
        }
        if (Files.isDirectory(source)) {
            List<EndpointDescriptor> all = new ArrayList<>();
            for (Path file : descriptorFiles(source)) {
                all.addAll(loadFile(file));
            }
            log.info("Loaded {} endpoint descriptors from directory: {}", all.size(), source);
            return all;
        }
        return loadFile(source);
    }

    private List<Path> descriptorFiles(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(DescriptorLoader::isDescriptorFile)
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new DescriptorLoadException("Failed to list descriptor directory: " + directory, e);
        }
    }

    private static boolean isDescriptorFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private List<EndpointDescriptor> loadFile(Path file) {
        ObjectMapper mapper = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
            ? jsonMapper
            : yamlMapper;
        try {
            log.debug("Loading endpoint descriptors from: {}", file);
            String text = Files.readString(file);
            EndpointCatalog catalog = text.isBlank() ? null : mapper.readValue(text, EndpointCatalog.class);
            if (catalog == null) {
                log.warn("Descriptor file is empty: {}", file);
                return List.of();
            }
            log.debug("Loaded {} endpoints from {}", catalog.endpoints().size(), file);
            return catalog.endpoints();
        } catch (IOException e) {
            throw new DescriptorLoadException("Failed to parse descriptor file: " + file, e);
        }
    }
}
