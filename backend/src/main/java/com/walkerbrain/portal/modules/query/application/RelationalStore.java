package com.walkerbrain.portal.modules.query.application;

import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;

/**
 * The relational store as seen by the query layer. Implementations throw Spring
 * {@link org.springframework.dao.DataAccessException}s; translation into {@link QueryException} happens
 * in {@link CachedQueryExecutor}.
 */
public interface RelationalStore {

    List<Map<String, Object>> select(SelectStatement statement);

    long count(String table, List<StorePredicate> predicates);

    int update(String table, Map<String, Object> data, List<StorePredicate> match);

    /**
     * Inserts {@code data} or, when a row with the same {@code conflictColumns} exists, overwrites its
     * remaining columns.
     */
    int upsert(String table, Map<String, Object> data, List<String> conflictColumns);

    /**
     * Calls a set-returning function with named arguments, in map iteration order.
     */
    List<Map<String, Object>> callProcedure(String name, Map<String, Object> params);

    record SelectStatement(
            String table,
            List<String> columns,
            List<StorePredicate> predicates,
            List<SortOrder> order,
            Integer limit,
            Integer offset,
            boolean distinct
    ) {
        public SelectStatement {
            columns = columns == null ? List.of() : List.copyOf(columns);
            predicates = predicates == null ? List.of() : List.copyOf(predicates);
            order = order == null ? List.of() : List.copyOf(order);
        }
    }
}
