package com.walkerbrain.portal.modules.query.application;

import java.math.BigDecimal;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.PredicateOperator;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;

import org.springframework.stereotype.Component;

/**
 * Compiles dashboard filters into store predicates and a canonical, order-independent key.
 *
 * <p>Membership within a field is an OR, a range is AND(gte, lte), and distinct predicates combine with
 * AND. Fields registered as bounded are clamped after the low/high check; text fields registered for
 * presence checks treat an empty string like a missing value.
 */
@Component
public class FilterCompiler {

    public record Bounds(BigDecimal min, BigDecimal max) {
    }

    static final Map<String, Bounds> DEFAULT_BOUNDS = Map.of(
            "quality_score", new Bounds(BigDecimal.ZERO, BigDecimal.valueOf(100))
    );

    static final Set<String> DEFAULT_TEXT_FIELDS = Set.of(
            "key_quote", "summary", "primary_topic", "transcript_original", "notes"
    );

    private final Map<String, Bounds> bounds;
    private final Set<String> textFields;

    public FilterCompiler() {
        this(DEFAULT_BOUNDS, DEFAULT_TEXT_FIELDS);
    }

    public FilterCompiler(Map<String, Bounds> bounds, Set<String> textFields) {
        this.bounds = Map.copyOf(bounds);
        this.textFields = Set.copyOf(textFields);
    }

    public CompiledFilter compile(Collection<? extends FilterSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return CompiledFilter.EMPTY;
        }
        List<StorePredicate> predicates = new ArrayList<>();
        for (FilterSpec spec : specs) {
            predicates.addAll(compileOne(Objects.requireNonNull(spec, "filter spec")));
        }
        List<StorePredicate> sorted = predicates.stream()
                .distinct()
                .sorted()
                .toList();
        String canonical = sorted.stream()
                .map(StorePredicate::canonical)
                .collect(Collectors.joining("&"));
        return new CompiledFilter(sorted, canonical);
    }

    private List<StorePredicate> compileOne(FilterSpec spec) {
        if (spec instanceof FilterSpec.Equality equality) {
            String field = SqlIdentifiers.require(equality.field());
            if (equality.value() == null) {
                return List.of(StorePredicate.of(field, PredicateOperator.IS_NULL));
            }
            return List.of(StorePredicate.of(field, PredicateOperator.EQ, equality.value()));
        }
        if (spec instanceof FilterSpec.Membership membership) {
            return List.of(compileMembership(membership));
        }
        if (spec instanceof FilterSpec.Range range) {
            return compileRange(range);
        }
        if (spec instanceof FilterSpec.TextSearch search) {
            return compileTextSearch(search);
        }
        if (spec instanceof FilterSpec.HasElement hasElement) {
            String field = SqlIdentifiers.require(hasElement.field());
            String element = hasElement.element() == null ? "" : hasElement.element().trim();
            if (element.isEmpty()) {
                return List.of();
            }
            return List.of(StorePredicate.of(field, PredicateOperator.HAS_ELEMENT, element));
        }
        if (spec instanceof FilterSpec.NullCheck nullCheck) {
            String field = SqlIdentifiers.require(nullCheck.field());
            if (!nullCheck.present()) {
                return List.of(StorePredicate.of(field, PredicateOperator.IS_NULL));
            }
            PredicateOperator operator = textFields.contains(field)
                    ? PredicateOperator.NOT_EMPTY
                    : PredicateOperator.IS_NOT_NULL;
            return List.of(StorePredicate.of(field, operator));
        }
        throw new IllegalArgumentException("Unsupported filter: " + spec.getClass().getSimpleName());
    }

    private StorePredicate compileMembership(FilterSpec.Membership membership) {
        String field = SqlIdentifiers.require(membership.field());
        if (membership.values() == null) {
            throw new FilterException(FilterException.Reason.EMPTY_MEMBERSHIP,
                    "No value list was supplied for " + field + ".");
        }
        List<Object> values = membership.values().stream()
                .filter(Objects::nonNull)
                .map(value -> (Object) value)
                .distinct()
                .sorted(Comparator.comparing(value -> String.valueOf(value)))
                .toList();
        if (values.isEmpty()) {
            return StorePredicate.of(field, PredicateOperator.MATCH_NONE);
        }
        return new StorePredicate(List.of(field), PredicateOperator.IN, values);
    }

    private List<StorePredicate> compileRange(FilterSpec.Range range) {
        String field = SqlIdentifiers.require(range.field());
        Object low = range.low();
        Object high = range.high();
        if (low != null && high != null) {
            int order = compare(low, high);
            // an exclusive upper bound equal to the lower bound leaves nothing to match
            if (order > 0 || (order == 0 && range.highExclusive())) {
                throw new FilterException(FilterException.Reason.OUT_OF_RANGE,
                        "The lower bound for " + field + " is above the upper bound.");
            }
        }

        Bounds fieldBounds = bounds.get(field);
        if (fieldBounds != null) {
            low = low == null ? null : clamp(low, fieldBounds);
            high = high == null ? null : clamp(high, fieldBounds);
        }

        List<StorePredicate> predicates = new ArrayList<>(2);
        if (low != null) {
            predicates.add(StorePredicate.of(field, PredicateOperator.GTE, low));
        }
        if (high != null) {
            PredicateOperator upper = range.highExclusive() ? PredicateOperator.LT : PredicateOperator.LTE;
            predicates.add(StorePredicate.of(field, upper, high));
        }
        return predicates;
    }

    private List<StorePredicate> compileTextSearch(FilterSpec.TextSearch search) {
        String text = search.text();
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> fields = search.fields().stream()
                .map(SqlIdentifiers::require)
                .distinct()
                .sorted()
                .toList();
        String pattern = LikeEscaper.containsPattern(text.trim());
        PredicateOperator operator = fields.size() == 1 ? PredicateOperator.ILIKE : PredicateOperator.ANY_ILIKE;
        return List.of(new StorePredicate(fields, operator, List.of(pattern)));
    }

    private static Object clamp(Object value, Bounds fieldBounds) {
        if (!(value instanceof Number number)) {
            throw new QueryException(QueryException.Reason.BAD_FILTER,
                    new IllegalArgumentException("Bounded field expects a number, got " + value));
        }
        BigDecimal decimal = new BigDecimal(number.toString());
        if (decimal.compareTo(fieldBounds.min()) < 0) {
            return sameKind(number, fieldBounds.min());
        }
        if (decimal.compareTo(fieldBounds.max()) > 0) {
            return sameKind(number, fieldBounds.max());
        }
        return value;
    }

    private static Number sameKind(Number original, BigDecimal bound) {
        if (original instanceof Integer || original instanceof Short || original instanceof Byte) {
            return bound.intValue();
        }
        if (original instanceof Long) {
            return bound.longValue();
        }
        return bound.doubleValue();
    }

    static int compare(Object low, Object high) {
        if (low instanceof Number lowNumber && high instanceof Number highNumber) {
            return new BigDecimal(lowNumber.toString()).compareTo(new BigDecimal(highNumber.toString()));
        }
        if (low instanceof Comparable<?> && low.getClass().equals(high.getClass())) {
            return compareSameType(low, high);
        }
        if (low instanceof Temporal || high instanceof Temporal || low instanceof String || high instanceof String) {
            // ISO-8601 text orders the same way as the instants it describes
            return low.toString().compareTo(high.toString());
        }
        throw new QueryException(QueryException.Reason.BAD_FILTER,
                new IllegalArgumentException("Range bounds are not comparable: " + low + ", " + high));
    }

    @SuppressWarnings("unchecked")
    private static int compareSameType(Object low, Object high) {
        Comparable<Object> comparable = (Comparable<Object>) low;
        return comparable.compareTo(high);
    }
}
