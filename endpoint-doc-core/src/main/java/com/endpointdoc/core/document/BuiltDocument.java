package com.endpointdoc.core.document;

import com.endpointdoc.core.operation.VersionMarker;
import io.swagger.v3.oas.models.OpenAPI;

import java.util.List;
import java.util.Objects;

/**
 * Result of a document build.
 *
 * @param openApi finished document
 * @param versionMarkers version markers of every managed operation, in build order
 */
public record BuiltDocument(OpenAPI openApi, List<VersionMarker> versionMarkers) {

    public BuiltDocument {
        Objects.requireNonNull(openApi, "openApi must not be null");
        versionMarkers = versionMarkers == null ? List.of() : List.copyOf(versionMarkers);
    }

    /**
     * Counts the operations of the document.
     *
     * @return number of operations across all paths
     */
    public int operationCount() {
        if (openApi.getPaths() == null) {
            return 0;
        }
        return openApi.getPaths().values().stream()
            .mapToInt(item -> item.readOperations().size())
            .sum();
    }
}
