package com.walkerbrain.portal.modules.query.domain;

/**
 * What a query returns. Each shape maps to its own cache TTL class.
 */
public enum QueryShape {
    /** distinct values feeding filter widgets */
    DICTIONARY,
    ROWS,
    COUNT,
    AGGREGATE
}
