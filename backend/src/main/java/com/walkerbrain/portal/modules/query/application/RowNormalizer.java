package com.walkerbrain.portal.modules.query.application;

import java.sql.Array;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.walkerbrain.portal.modules.query.domain.ResultRow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw store rows into {@link ResultRow}s. JSON-bearing columns may arrive as text, as driver
 * objects or already parsed; all of them end up as lists or maps, and malformed JSON becomes an empty one.
 */
@Component
public class RowNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RowNormalizer.class);

    static final Set<String> JSON_LIST_COLUMNS = Set.of(
            "suggested_tags", "objection_categories", "common_questions_asked", "key_quotes",
            "misunderstandings", "process_confusion_points", "other_brands_mentioned", "colloquialisms",
            "cultural_markers", "family_references", "repeated_questions_from_caller",
            "questions_repeated_by_attorney"
    );

    static final Set<String> JSON_MAP_COLUMNS = Set.of(
            "content_text", "quality_sub_scores", "emotional_arc"
    );

    static final Set<String> LANGUAGE_COLUMNS = Set.of("original_language", "language");

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RowNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ResultRow> normalize(List<Map<String, Object>> rows) {
        return rows.stream().map(this::normalize).toList();
    }

    public ResultRow normalize(Map<String, Object> row) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        row.forEach((column, value) -> normalized.put(column, normalizeValue(column, value)));
        return new ResultRow(normalized);
    }

    Object normalizeValue(String column, Object value) {
        if (value == null) {
            return JSON_LIST_COLUMNS.contains(column) ? List.of() : null;
        }
        if (JSON_LIST_COLUMNS.contains(column)) {
            return toList(column, value);
        }
        if (JSON_MAP_COLUMNS.contains(column)) {
            return toMap(column, value);
        }
        if (LANGUAGE_COLUMNS.contains(column)) {
            return cleanLanguage(value.toString());
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof OffsetDateTime timestamp) {
            return timestamp.withOffsetSameInstant(ZoneOffset.UTC);
        }
        if (value instanceof Array array) {
            return fromSqlArray(column, array);
        }
        return value;
    }

    /**
     * Strips the single quotes some upstream rows wrap language names in.
     */
    public static String cleanLanguage(String value) {
        if (value == null) {
            return "";
        }
        String stripped = value.strip();
        int start = 0;
        int end = stripped.length();
        while (start < end && stripped.charAt(start) == '\'') {
            start++;
        }
        while (end > start && stripped.charAt(end - 1) == '\'') {
            end--;
        }
        return stripped.substring(start, end).strip();
    }

    private List<?> toList(String column, Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Array array) {
            return fromSqlArray(column, array);
        }
        String json = value.toString().trim();
        if (json.isEmpty()) {
            return List.of();
        }
        try {
            List<Object> parsed = objectMapper.readValue(json, LIST_TYPE);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.debug("column {} holds malformed JSON list", column);
            return List.of();
        }
    }

    private Map<String, Object> toMap(String column, Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        String json = value.toString().trim();
        if (json.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.debug("column {} holds malformed JSON object", column);
            return Map.of();
        }
    }

    private List<?> fromSqlArray(String column, Array array) {
        try {
            Object raw = array.getArray();
            return raw instanceof Object[] elements ? Arrays.asList(elements) : List.of();
        } catch (SQLException e) {
            log.debug("column {} array could not be read", column, e);
            return List.of();
        }
    }
}
