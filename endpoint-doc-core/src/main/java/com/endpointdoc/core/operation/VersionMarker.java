package com.endpointdoc.core.operation;

/**
 * Version information of one operation, consumed by cross-endpoint version deduplication.
 *
 * @param method HTTP verb
 * @param bareRoute route without prefix and version segments
 * @param current current version
 * @param startingRelease starting release version
 * @param deprecatedAt release the endpoint is deprecated at
 */
public record VersionMarker(String method, String bareRoute, int current, int startingRelease, int deprecatedAt) {

    /**
     * Renders the marker in its compact tag form, {@code |GET:/orders|1|0|0}.
     *
     * @return marker tag
     */
    public String toTag() {
        return "|" + method + ":" + bareRoute + "|" + current + "|" + startingRelease + "|" + deprecatedAt;
    }
}
