package com.walkerbrain.portal.modules.query.domain;

public enum PredicateOperator {
    EQ,
    IN,
    GTE,
    LTE,
    LT,
    ILIKE,
    ANY_ILIKE,
    IS_NULL,
    IS_NOT_NULL,
    NOT_EMPTY,
    HAS_ELEMENT,
    MATCH_NONE
}
