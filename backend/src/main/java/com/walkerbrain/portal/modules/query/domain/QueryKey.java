package com.walkerbrain.portal.modules.query.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cache identity of a read. The canonical form starts with {@code source|} so that invalidating a table
 * name as a prefix drops every cached read over that table.
 *
 * @param source  table, view or procedure name
 * @param variant distinguishes loader-backed reads over the same source (e.g. "weekly-metrics:7")
 */
public record QueryKey(
        String source,
        QueryShape shape,
        String variant,
        List<String> columns,
        CompiledFilter filter,
        List<SortOrder> order,
        Integer limit,
        Integer offset
) {

    public QueryKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(shape, "shape");
        variant = variant == null ? "" : variant;
        columns = columns == null ? List.of() : List.copyOf(columns);
        filter = filter == null ? CompiledFilter.EMPTY : filter;
        order = order == null ? List.of() : List.copyOf(order);
    }

    public static Builder builder(String source, QueryShape shape) {
        return new Builder(source, shape);
    }

    public String canonical() {
        return source
                + "|" + shape.name()
                + "|" + variant
                + "|" + String.join(",", columns)
                + "|" + filter.canonical()
                + "|" + SortOrder.canonical(order)
                + "|" + (limit == null ? "" : limit)
                + "|" + (offset == null ? "" : offset);
    }

    /**
     * Same source and filter, reshaped as an exact count: no columns, order or pagination.
     */
    public QueryKey forCount() {
        return new QueryKey(source, QueryShape.COUNT, variant, List.of(), filter, List.of(), null, null);
    }

    public QueryKey withPage(int newLimit, int newOffset) {
        return new QueryKey(source, shape, variant, columns, filter, order, newLimit, newOffset);
    }

    public static final class Builder {

        private final String source;
        private final QueryShape shape;
        private String variant;
        private final List<String> columns = new ArrayList<>();
        private CompiledFilter filter = CompiledFilter.EMPTY;
        private final List<SortOrder> order = new ArrayList<>();
        private Integer limit;
        private Integer offset;

        private Builder(String source, QueryShape shape) {
            this.source = source;
            this.shape = shape;
        }

        public Builder variant(String variant) {
            this.variant = variant;
            return this;
        }

        public Builder columns(List<String> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder columns(String... columns) {
            return columns(List.of(columns));
        }

        public Builder filter(CompiledFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder orderBy(SortOrder... orders) {
            this.order.addAll(List.of(orders));
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public QueryKey build() {
            return new QueryKey(source, shape, variant, columns, filter, order, limit, offset);
        }
    }
}
