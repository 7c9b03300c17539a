package com.walkerbrain.portal.modules.query.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A store row after normalisation: JSON-bearing columns hold parsed lists and maps, timestamps hold
 * {@link OffsetDateTime}. Accessors return {@code null} for absent columns.
 */
public final class ResultRow {

    private final Map<String, Object> values;

    public ResultRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String column) {
        return values.get(column) != null;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public Integer getInteger(String column) {
        Object value = values.get(column);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim()).intValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Long getLong(String column) {
        Object value = values.get(column);
        if (value instanceof Number number) {
            return number.longValue();
        }
        Integer parsed = getInteger(column);
        return parsed == null ? null : parsed.longValue();
    }

    public Double getDouble(String column) {
        Object value = values.get(column);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public boolean getBoolean(String column) {
        Object value = values.get(column);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public OffsetDateTime getOffsetDateTime(String column) {
        Object value = values.get(column);
        if (value instanceof OffsetDateTime timestamp) {
            return timestamp;
        }
        if (value instanceof String text && !text.isBlank()) {
            return OffsetDateTime.parse(text.trim());
        }
        return null;
    }

    public LocalDate getLocalDate(String column) {
        Object value = values.get(column);
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof OffsetDateTime timestamp) {
            return timestamp.toLocalDate();
        }
        if (value instanceof String text && text.length() >= 10) {
            return LocalDate.parse(text.substring(0, 10));
        }
        return null;
    }

    public List<String> getStringList(String column) {
        Object value = values.get(column);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String column) {
        Object value = values.get(column);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ResultRow other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ResultRow" + values;
    }
}
