package com.walkerbrain.portal.modules.query.infrastructure.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.application.SqlIdentifiers;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;

/**
 * Renders compiled predicates as a PostgreSQL WHERE clause. Identifiers are checked before they are
 * embedded; every value becomes a named bind parameter.
 */
final class SqlPredicateRenderer {

    private static final String LIKE_ESCAPE = " ESCAPE '\\'";

    private SqlPredicateRenderer() {
    }

    /**
     * @return {@code ""} when there is nothing to filter, otherwise a clause starting with {@code " WHERE "}
     */
    static String renderWhere(List<StorePredicate> predicates, Map<String, Object> params, String paramPrefix) {
        List<String> clauses = new ArrayList<>();
        for (StorePredicate predicate : predicates) {
            clauses.add(render(predicate, params, paramPrefix));
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    static String render(StorePredicate predicate, Map<String, Object> params, String paramPrefix) {
        String column = SqlIdentifiers.require(predicate.field());
        return switch (predicate.operator()) {
            case EQ -> column + " = :" + bind(params, paramPrefix, predicate.value());
            case IN -> column + " IN (:" + bind(params, paramPrefix, predicate.values()) + ")";
            case GTE -> column + " >= :" + bind(params, paramPrefix, predicate.value());
            case LTE -> column + " <= :" + bind(params, paramPrefix, predicate.value());
            case LT -> column + " < :" + bind(params, paramPrefix, predicate.value());
            case ILIKE -> column + " ILIKE :" + bind(params, paramPrefix, predicate.value()) + LIKE_ESCAPE;
            case ANY_ILIKE -> renderAnyLike(predicate, params, paramPrefix);
            case IS_NULL -> column + " IS NULL";
            case IS_NOT_NULL -> column + " IS NOT NULL";
            case NOT_EMPTY -> "(" + column + " IS NOT NULL AND " + column + " <> '')";
            case HAS_ELEMENT -> column + " @> jsonb_build_array(CAST(:"
                    + bind(params, paramPrefix, predicate.value()) + " AS text))";
            case MATCH_NONE -> "1 = 0";
        };
    }

    private static String renderAnyLike(StorePredicate predicate, Map<String, Object> params, String paramPrefix) {
        String param = bind(params, paramPrefix, predicate.value());
        List<String> alternatives = new ArrayList<>();
        for (String field : predicate.fields()) {
            alternatives.add(SqlIdentifiers.require(field) + " ILIKE :" + param + LIKE_ESCAPE);
        }
        return "(" + String.join(" OR ", alternatives) + ")";
    }

    private static String bind(Map<String, Object> params, String paramPrefix, Object value) {
        String name = paramPrefix + params.size();
        params.put(name, value);
        return name;
    }
}
