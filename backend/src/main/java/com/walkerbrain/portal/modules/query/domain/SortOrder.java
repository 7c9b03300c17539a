package com.walkerbrain.portal.modules.query.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record SortOrder(String field, boolean descending) {

    public SortOrder {
        Objects.requireNonNull(field, "field");
    }

    public static SortOrder asc(String field) {
        return new SortOrder(field, false);
    }

    public static SortOrder desc(String field) {
        return new SortOrder(field, true);
    }

    public String canonical() {
        return (descending ? "-" : "+") + field;
    }

    public static String canonical(List<SortOrder> orders) {
        return orders.stream().map(SortOrder::canonical).collect(Collectors.joining(","));
    }
}
