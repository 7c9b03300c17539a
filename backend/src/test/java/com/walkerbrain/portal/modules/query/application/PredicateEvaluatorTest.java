package com.walkerbrain.portal.modules.query.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.ResultRow;

import org.junit.jupiter.api.Test;

class PredicateEvaluatorTest {

    private final FilterCompiler compiler = new FilterCompiler();
    private final PredicateEvaluator evaluator = new PredicateEvaluator();

    @Test
    void escapedPatternMatchesLiteralText() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.textSearch("summary", "100% (approved)")));

        assertThat(evaluator.matches(row("summary", "Claim was 100% (APPROVED) today"), filter)).isTrue();
        assertThat(evaluator.matches(row("summary", "Claim was 1000 approved"), filter)).isFalse();
    }

    @Test
    void underscoreIsNotAWildcardAfterEscaping() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.textSearch("summary", "a_b")));

        assertThat(evaluator.matches(row("summary", "xa_by"), filter)).isTrue();
        assertThat(evaluator.matches(row("summary", "xacby"), filter)).isFalse();
    }

    @Test
    void compiledPatternsStayWithinTheirBound() {
        for (int i = 0; i < PredicateEvaluator.PATTERN_CACHE_SIZE * 3; i++) {
            evaluator.likeMatches("search text " + i, "%text " + i + "%");
        }

        assertThat(evaluator.cachedPatterns()).isLessThanOrEqualTo(PredicateEvaluator.PATTERN_CACHE_SIZE);
    }

    @Test
    void membershipOverListColumnMatchesAnyElement() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.membership("suggested_tags", List.of("surgery"))));

        assertThat(evaluator.matches(row("suggested_tags", List.of("rear-end", "surgery")), filter)).isTrue();
        assertThat(evaluator.matches(row("suggested_tags", List.of("rear-end")), filter)).isFalse();
    }

    @Test
    void numericRangeComparesAcrossNumberTypes() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.range("quality_score", 70, 80)));

        assertThat(evaluator.matches(row("quality_score", 75L), filter)).isTrue();
        assertThat(evaluator.matches(row("quality_score", 80.0), filter)).isTrue();
        assertThat(evaluator.matches(row("quality_score", 81), filter)).isFalse();
    }

    @Test
    void matchNoneRejectsEveryRow() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.membership("content_intent", List.of())));

        assertThat(evaluator.matches(row("content_intent", "educate"), filter)).isFalse();
    }

    @Test
    void likeEscaperCoversFilterSyntaxCharacters() {
        assertThat(LikeEscaper.escape("a.b,c\\d")).isEqualTo("a\\.b\\,c\\\\d");
        assertThat(LikeEscaper.containsPattern("x")).isEqualTo("%x%");
    }

    @Test
    void hasElementMatchesWholeListElementsOnly() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.hasElement("suggested_tags", "surgery")));

        assertThat(evaluator.matches(row("suggested_tags", List.of("rear-end", "surgery")), filter)).isTrue();
        assertThat(evaluator.matches(row("suggested_tags", List.of("surgery-scheduled")), filter)).isFalse();
        assertThat(evaluator.matches(row("suggested_tags", "surgery"), filter)).isFalse();
    }

    private static ResultRow row(String column, Object value) {
        return new ResultRow(Map.of(column, value));
    }
}
