package com.walkerbrain.portal.modules.query.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A compiled condition handed to the relational store. {@link PredicateOperator#ANY_ILIKE} is the only
 * operator spanning several fields; LIKE patterns in {@code values} are already escaped.
 */
public record StorePredicate(List<String> fields, PredicateOperator operator, List<Object> values)
        implements Comparable<StorePredicate> {

    public StorePredicate {
        fields = List.copyOf(fields);
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static StorePredicate of(String field, PredicateOperator operator, Object... values) {
        return new StorePredicate(List.of(field), operator, List.of(values));
    }

    public String field() {
        return fields.get(0);
    }

    public Object value() {
        return values.isEmpty() ? null : values.get(0);
    }

    public String canonical() {
        String renderedValues = values.stream()
                .map(StorePredicate::renderValue)
                .collect(Collectors.joining(","));
        return String.join("+", fields) + ":" + operator.name() + ":" + renderedValues;
    }

    @Override
    public int compareTo(StorePredicate other) {
        int byField = String.join("+", fields).compareTo(String.join("+", other.fields));
        if (byField != 0) {
            return byField;
        }
        int byOperator = operator.name().compareTo(other.operator.name());
        if (byOperator != 0) {
            return byOperator;
        }
        return canonical().compareTo(other.canonical());
    }

    static String renderValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return "'" + text.replace("'", "''") + "'";
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
