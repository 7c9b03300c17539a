package com.walkerbrain.portal.modules.query.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.PredicateOperator;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FilterCompilerTest {

    private final FilterCompiler compiler = new FilterCompiler();

    @Test
    @DisplayName("construction order and duplicate values do not change the canonical key")
    void canonicalKeyIsOrderIndependent() {
        CompiledFilter first = compiler.compile(List.of(
                FilterSpec.membership("case_type", List.of("Auto", "Premises")),
                FilterSpec.range("quality_score", 10, 90)
        ));
        CompiledFilter second = compiler.compile(List.of(
                FilterSpec.range("quality_score", 10, 90),
                FilterSpec.membership("case_type", List.of("Premises", "Auto", "Premises"))
        ));

        assertThat(first).isEqualTo(second);
        assertThat(first.canonical())
                .isEqualTo("case_type:IN:'Auto','Premises'&quality_score:GTE:10&quality_score:LTE:90");
    }

    @Test
    void emptyMembershipMatchesNothing() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.membership("case_type", List.of())));

        assertThat(filter.matchesNothing()).isTrue();
        assertThat(filter.predicates()).extracting(StorePredicate::operator)
                .containsExactly(PredicateOperator.MATCH_NONE);
    }

    @Test
    void missingMembershipListIsRejected() {
        FilterException ex = assertThrows(FilterException.class,
                () -> compiler.compile(List.of(new FilterSpec.Membership("case_type", null))));

        assertThat(ex.getReasonCode()).isEqualTo(FilterException.Reason.EMPTY_MEMBERSHIP);
    }

    @Test
    void nullEntriesInMembershipAreDropped() {
        CompiledFilter filter = compiler.compile(List.of(
                new FilterSpec.Membership("emotional_tone", Arrays.asList("Hopeful", null))));

        assertThat(filter.predicates()).singleElement()
                .satisfies(predicate -> assertThat(predicate.values()).containsExactly("Hopeful"));
    }

    @Test
    void invertedRangeIsRejectedBeforeClamping() {
        FilterException ex = assertThrows(FilterException.class,
                () -> compiler.compile(List.of(FilterSpec.range("quality_score", 150, 120))));

        assertThat(ex.getReasonCode()).isEqualTo(FilterException.Reason.OUT_OF_RANGE);
    }

    @Test
    void boundedFieldIsClampedToItsDomain() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.range("quality_score", -5, 150)));

        assertThat(filter.canonical()).isEqualTo("quality_score:GTE:0&quality_score:LTE:100");
    }

    @Test
    void exclusiveUpperBoundCompilesToLessThan() {
        CompiledFilter filter = compiler.compile(List.of(
                new FilterSpec.Range("analyzed_at", "2025-01-01T00:00Z", "2025-01-08T00:00Z", true)));

        assertThat(filter.predicates()).extracting(StorePredicate::operator)
                .containsExactly(PredicateOperator.GTE, PredicateOperator.LT);
    }

    @Test
    void startDayAfterEndDayIsRejected() {
        FilterException ex = assertThrows(FilterException.class, () -> compiler.compile(List.of(
                FilterSpec.calendarDays("analyzed_at", LocalDate.of(2025, 3, 8), LocalDate.of(2025, 3, 7)))));

        assertThat(ex.getReasonCode()).isEqualTo(FilterException.Reason.OUT_OF_RANGE);
    }

    @Test
    void singleCalendarDayIsAccepted() {
        CompiledFilter filter = compiler.compile(List.of(
                FilterSpec.calendarDays("analyzed_at", LocalDate.of(2025, 3, 7), LocalDate.of(2025, 3, 7))));

        assertThat(filter.predicates()).extracting(StorePredicate::operator)
                .containsExactly(PredicateOperator.GTE, PredicateOperator.LT);
    }

    @Test
    void sameTypeComparableBoundsAreOrdered() {
        assertThat(FilterCompiler.compare(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 2))).isNegative();
        assertThat(FilterCompiler.compare(3, 2.5)).isPositive();
    }

    @Test
    @DisplayName("LIKE wildcards and punctuation in search text are escaped")
    void textSearchEscapesSpecialCharacters() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.textSearch("summary", "100% (approved)")));

        StorePredicate predicate = filter.predicates().get(0);
        assertThat(predicate.operator()).isEqualTo(PredicateOperator.ILIKE);
        assertThat(predicate.value()).isEqualTo("%100\\% \\(approved\\)%");
    }

    @Test
    void multiFieldTextSearchSortsFields() {
        CompiledFilter filter = compiler.compile(List.of(
                FilterSpec.textSearch(List.of("summary", "key_quote", "primary_topic"), "surgery")));

        StorePredicate predicate = filter.predicates().get(0);
        assertThat(predicate.operator()).isEqualTo(PredicateOperator.ANY_ILIKE);
        assertThat(predicate.fields()).containsExactly("key_quote", "primary_topic", "summary");
    }

    @Test
    void blankSearchTextAddsNoPredicate() {
        assertThat(compiler.compile(List.of(FilterSpec.textSearch("summary", "   "))).isEmpty()).isTrue();
    }

    @Test
    void presenceCheckOnTextFieldAlsoExcludesEmptyStrings() {
        CompiledFilter quote = compiler.compile(List.of(FilterSpec.nullCheck("key_quote", true)));
        CompiledFilter score = compiler.compile(List.of(FilterSpec.nullCheck("quality_score", true)));

        assertThat(quote.predicates().get(0).operator()).isEqualTo(PredicateOperator.NOT_EMPTY);
        assertThat(score.predicates().get(0).operator()).isEqualTo(PredicateOperator.IS_NOT_NULL);
    }

    @Test
    void equalityWithNullBecomesIsNull() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.equality("outcome", null)));

        assertThat(filter.canonical()).isEqualTo("outcome:IS_NULL:");
    }

    @Test
    void illegalColumnNameIsRejected() {
        QueryException ex = assertThrows(QueryException.class,
                () -> compiler.compile(List.of(FilterSpec.equality("case_type; drop table app_user", "x"))));

        assertThat(ex.getReasonCode()).isEqualTo(QueryException.Reason.BAD_FILTER);
        assertThat(ex.isRetryable()).isFalse();
    }

    @Test
    void hasElementCompilesToTrimmedElementAndBlankElementIsNoFilter() {
        CompiledFilter filter = compiler.compile(List.of(FilterSpec.hasElement("suggested_tags", "  surgery ")));

        assertThat(filter.predicates()).containsExactly(
                StorePredicate.of("suggested_tags", PredicateOperator.HAS_ELEMENT, "surgery"));
        assertThat(compiler.compile(List.of(FilterSpec.hasElement("suggested_tags", " "))).predicates()).isEmpty();
    }
}
