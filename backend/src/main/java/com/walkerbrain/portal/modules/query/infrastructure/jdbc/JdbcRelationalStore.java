package com.walkerbrain.portal.modules.query.infrastructure.jdbc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import javax.sql.DataSource;

import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.application.SqlIdentifiers;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcRelationalStore implements RelationalStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRelationalStore.class);
    private static final String WHERE_PARAM = "w";
    private static final String DATA_PARAM = "d";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcRelationalStore(DataSource dataSource, @Value("${app.query.timeout:PT10S}") Duration queryTimeout) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        this.jdbcTemplate = new NamedParameterJdbcTemplate(template);
    }

    JdbcRelationalStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Map<String, Object>> select(SelectStatement statement) {
        String table = SqlIdentifiers.require(statement.table());
        Map<String, Object> params = new LinkedHashMap<>();

        String columns = statement.columns().isEmpty()
                ? "*"
                : statement.columns().stream().map(SqlIdentifiers::require).collect(Collectors.joining(", "));
        String whereSql = SqlPredicateRenderer.renderWhere(statement.predicates(), params, WHERE_PARAM);

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(statement.distinct() ? "DISTINCT " : "")
                .append(columns)
                .append(" FROM ").append(table)
                .append(whereSql)
                .append(renderOrder(statement.order()));
        if (statement.limit() != null) {
            sql.append(" LIMIT :limit");
            params.put("limit", statement.limit());
        }
        if (statement.offset() != null && statement.offset() > 0) {
            sql.append(" OFFSET :offset");
            params.put("offset", statement.offset());
        }

        log.debug("select {}", sql);
        return jdbcTemplate.queryForList(sql.toString(), params);
    }

    @Override
    public long count(String table, List<StorePredicate> predicates) {
        Map<String, Object> params = new LinkedHashMap<>();
        String sql = "SELECT COUNT(*) FROM " + SqlIdentifiers.require(table)
                + SqlPredicateRenderer.renderWhere(predicates, params, WHERE_PARAM);
        Long total = jdbcTemplate.queryForObject(sql, params, Long.class);
        return total == null ? 0L : total;
    }

    @Override
    public int update(String table, Map<String, Object> data, List<StorePredicate> match) {
        if (data.isEmpty()) {
            return 0;
        }
        if (match.isEmpty()) {
            throw new IllegalArgumentException("update without a match predicate is not allowed");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        List<String> assignments = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String name = DATA_PARAM + index++;
            assignments.add(SqlIdentifiers.require(entry.getKey()) + " = :" + name);
            params.put(name, entry.getValue());
        }
        String sql = "UPDATE " + SqlIdentifiers.require(table)
                + " SET " + String.join(", ", assignments)
                + SqlPredicateRenderer.renderWhere(match, params, WHERE_PARAM);
        return jdbcTemplate.update(sql, params);
    }

    @Override
    public int upsert(String table, Map<String, Object> data, List<String> conflictColumns) {
        if (conflictColumns.isEmpty()) {
            throw new IllegalArgumentException("upsert needs at least one conflict column");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        List<String> columns = new ArrayList<>();
        List<String> values = new ArrayList<>();
        List<String> updates = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String column = SqlIdentifiers.require(entry.getKey());
            String name = DATA_PARAM + index++;
            columns.add(column);
            values.add(":" + name);
            params.put(name, entry.getValue());
            if (!conflictColumns.contains(column)) {
                updates.add(column + " = EXCLUDED." + column);
            }
        }
        String conflict = conflictColumns.stream().map(SqlIdentifiers::require).collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + SqlIdentifiers.require(table)
                + " (" + String.join(", ", columns) + ") VALUES (" + String.join(", ", values) + ")"
                + " ON CONFLICT (" + conflict + ")"
                + (updates.isEmpty() ? " DO NOTHING" : " DO UPDATE SET " + String.join(", ", updates));
        return jdbcTemplate.update(sql, params);
    }

    @Override
    public List<Map<String, Object>> callProcedure(String name, Map<String, Object> params) {
        Map<String, Object> bound = new LinkedHashMap<>();
        List<String> arguments = new ArrayList<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            String argument = SqlIdentifiers.require(entry.getKey());
            arguments.add(argument + " => :" + argument);
            bound.put(argument, entry.getValue());
        }
        String sql = "SELECT * FROM " + SqlIdentifiers.require(name) + "(" + String.join(", ", arguments) + ")";
        return jdbcTemplate.queryForList(sql, bound);
    }

    private static String renderOrder(List<SortOrder> order) {
        if (order.isEmpty()) {
            return "";
        }
        return " ORDER BY " + order.stream()
                .map(o -> SqlIdentifiers.require(o.field()) + (o.descending() ? " DESC NULLS LAST" : " ASC"))
                .collect(Collectors.joining(", "));
    }
}
