package com.walkerbrain.portal.modules.query.domain;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One filtering condition as chosen in the dashboard. Rebuilt for every request from the current UI state.
 */
public interface FilterSpec {

    /**
     * Column the condition applies to; for a multi-column text search, the first of them.
     */
    String field();

    static FilterSpec equality(String field, Object value) {
        return new Equality(field, value);
    }

    static FilterSpec membership(String field, Collection<?> values) {
        return new Membership(field, values == null ? null : List.copyOf(values));
    }

    static FilterSpec range(String field, Object low, Object high) {
        return new Range(field, low, high, false);
    }

    /**
     * Whole UTC days from {@code first} through {@code last}, as {@code [first 00:00, last + 1 day 00:00)}.
     * A first day after the last one compiles to an empty-or-inverted range and is rejected.
     */
    static FilterSpec calendarDays(String field, LocalDate first, LocalDate last) {
        return new Range(
                field,
                first == null ? null : first.atStartOfDay().atOffset(ZoneOffset.UTC),
                last == null ? null : last.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC),
                true
        );
    }

    static FilterSpec textSearch(String field, String text) {
        return new TextSearch(List.of(field), text);
    }

    static FilterSpec textSearch(List<String> fields, String text) {
        return new TextSearch(fields, text);
    }

    static FilterSpec hasElement(String field, String element) {
        return new HasElement(field, element);
    }

    static FilterSpec nullCheck(String field, boolean present) {
        return new NullCheck(field, present);
    }

    record Equality(String field, Object value) implements FilterSpec {
        public Equality {
            Objects.requireNonNull(field, "field");
        }
    }

    /**
     * A {@code null} value list is a caller bug; an empty list is a legitimate "nothing selected".
     */
    record Membership(String field, List<?> values) implements FilterSpec {
        public Membership {
            Objects.requireNonNull(field, "field");
        }
    }

    /**
     * Either bound may be {@code null} for an open range. {@code highExclusive} turns the upper bound into
     * a strict comparison, which back-to-back time windows need.
     */
    record Range(String field, Object low, Object high, boolean highExclusive) implements FilterSpec {
        public Range {
            Objects.requireNonNull(field, "field");
        }
    }

    record TextSearch(List<String> fields, String text) implements FilterSpec {
        public TextSearch {
            if (fields == null || fields.isEmpty()) {
                throw new IllegalArgumentException("text search needs at least one field");
            }
            fields = List.copyOf(fields);
        }

        @Override
        public String field() {
            return fields.get(0);
        }
    }

    /**
     * A JSON array column that holds {@code element} among its entries.
     */
    record HasElement(String field, String element) implements FilterSpec {
        public HasElement {
            Objects.requireNonNull(field, "field");
        }
    }

    record NullCheck(String field, boolean present) implements FilterSpec {
        public NullCheck {
            Objects.requireNonNull(field, "field");
        }
    }
}
