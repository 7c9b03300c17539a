package com.walkerbrain.portal.modules.query.infrastructure.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.QueryException;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.PredicateOperator;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;

import org.junit.jupiter.api.Test;

class SqlPredicateRendererTest {

    private final FilterCompiler compiler = new FilterCompiler();

    @Test
    void valuesAreBoundNeverInlined() {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = SqlPredicateRenderer.renderWhere(compiler.compile(List.of(
                FilterSpec.membership("case_type", List.of("Auto", "O'Brien")),
                FilterSpec.range("quality_score", 60, 90)
        )).predicates(), params, "p");

        assertThat(where).isEqualTo(" WHERE case_type IN (:p0) AND quality_score >= :p1 AND quality_score <= :p2");
        assertThat(where).doesNotContain("O'Brien");
        assertThat(params).containsEntry("p0", List.of("Auto", "O'Brien"))
                .containsEntry("p1", 60)
                .containsEntry("p2", 90);
    }

    @Test
    void textSearchAcrossColumnsSharesOneParameter() {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = SqlPredicateRenderer.renderWhere(compiler.compile(List.of(
                FilterSpec.textSearch(List.of("summary", "key_quote"), "denied")
        )).predicates(), params, "p");

        assertThat(where).isEqualTo(" WHERE (key_quote ILIKE :p0 ESCAPE '\\' OR summary ILIKE :p0 ESCAPE '\\')");
        assertThat(params).containsExactly(Map.entry("p0", "%denied%"));
    }

    @Test
    void emptyFilterRendersNothing() {
        assertThat(SqlPredicateRenderer.renderWhere(List.of(), new LinkedHashMap<>(), "p")).isEmpty();
    }

    @Test
    void presenceAndMatchNoneRenderWithoutParameters() {
        Map<String, Object> params = new LinkedHashMap<>();

        assertThat(SqlPredicateRenderer.render(
                StorePredicate.of("key_quote", PredicateOperator.NOT_EMPTY), params, "p"))
                .isEqualTo("(key_quote IS NOT NULL AND key_quote <> '')");
        assertThat(SqlPredicateRenderer.render(
                StorePredicate.of("case_type", PredicateOperator.MATCH_NONE), params, "p"))
                .isEqualTo("1 = 0");
        assertThat(params).isEmpty();
    }

    @Test
    void handBuiltPredicateWithIllegalColumnIsRejected() {
        StorePredicate predicate = StorePredicate.of("1=1 OR x", PredicateOperator.EQ, 1);

        assertThrows(QueryException.class,
                () -> SqlPredicateRenderer.render(predicate, new LinkedHashMap<>(), "p"));
    }

    @Test
    void hasElementUsesJsonbContainmentWithBoundElement() {
        Map<String, Object> params = new LinkedHashMap<>();

        String sql = SqlPredicateRenderer.render(
                StorePredicate.of("suggested_tags", PredicateOperator.HAS_ELEMENT, "slip-and-fall"), params, "p");

        assertThat(sql).isEqualTo("suggested_tags @> jsonb_build_array(CAST(:p0 AS text))");
        assertThat(params).containsExactly(Map.entry("p0", "slip-and-fall"));
    }
}
