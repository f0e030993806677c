package com.rsl.retrieval.repository;

import com.rsl.retrieval.access.AccessPredicate;
import com.rsl.retrieval.search.SearchFilters;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Predicate-filtered substring search over one record table, newest first.
 */
@Repository
public class RecordSearchRepository {
    private final JdbcTemplate jdbcTemplate;

    public RecordSearchRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Map<String, Object>> search(
        SourceTable table,
        AccessPredicate predicate,
        String text,
        SearchFilters filters,
        int limit
    ) {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        sql.append("SELECT ").append(table.getSelect())
            .append(" FROM ").append(table.getFrom())
            .append(" WHERE ").append(table.getTenantColumn()).append(" = ?");
        params.add(predicate.getTenantId());

        if (predicate.isOwnedOnly()) {
            sql.append(" AND ").append(table.getOwnerColumn()).append(" = ?");
            params.add(predicate.getOwnerId());
        }
        for (String condition : table.getFixedConditions()) {
            sql.append(" AND ").append(condition);
        }

        String pattern = JdbcUtils.containsPattern(text);
        sql.append(" AND (");
        List<String> columns = table.getSearchColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            sql.append(columns.get(i)).append(" ILIKE ?");
            params.add(pattern);
        }
        sql.append(")");

        if (filters != null) {
            appendFilters(sql, params, table, filters);
        }

        sql.append(" ORDER BY ").append(table.getRecencyColumn()).append(" DESC LIMIT ?");
        params.add(limit);
        return jdbcTemplate.queryForList(sql.toString(), params.toArray());
    }

    private void appendFilters(StringBuilder sql, List<Object> params, SourceTable table, SearchFilters filters) {
        if (filters.hasStatus() && table.getStatusColumn() != null) {
            sql.append(" AND ").append(table.getStatusColumn())
                .append(" IN (").append(JdbcUtils.placeholders(filters.getStatus().size())).append(")");
            params.addAll(filters.getStatus());
        }
        if (filters.hasOwner()) {
            sql.append(" AND ").append(table.getOwnerColumn()).append(" = ?");
            params.add(filters.getOwner());
        }
        SearchFilters.DateRange range = filters.getDateRange();
        if (range != null && range.getStart() != null) {
            sql.append(" AND ").append(table.getRecencyColumn()).append(" >= ?");
            params.add(Timestamp.from(range.getStart()));
        }
        if (range != null && range.getEnd() != null) {
            sql.append(" AND ").append(table.getRecencyColumn()).append(" <= ?");
            params.add(Timestamp.from(range.getEnd()));
        }
    }
}
