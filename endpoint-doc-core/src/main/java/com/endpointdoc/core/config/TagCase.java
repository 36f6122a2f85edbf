package com.endpointdoc.core.config;

/**
 * Case transform applied to automatically derived operation tags.
 */
public enum TagCase {
    /** Keep the route segment as written */
    NONE,
    /** Capitalize the first letter of every word, lower-case the rest */
    TITLE_CASE,
    /** Lower-case the whole tag */
    LOWER_CASE
}
