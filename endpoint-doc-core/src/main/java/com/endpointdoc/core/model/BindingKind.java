package com.endpointdoc.core.model;

/**
 * Closed set of binding annotations a reflected field can carry.
 */
public enum BindingKind {
    /** Renames the field for binding purposes */
    BIND_FROM,
    /** Binds the field from a request header */
    FROM_HEADER,
    /** Binds the field from a security claim */
    FROM_CLAIM,
    /** Binds the field from a permission check */
    HAS_PERMISSION,
    /** Exposes the field as a query parameter regardless of verb */
    QUERY_PARAM,
    /** Makes the field the entire request body */
    FROM_BODY,
    /** Makes the field the entire form body */
    FROM_FORM,
    /** Exposes a response field as a response header */
    TO_HEADER
}
