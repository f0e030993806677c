package com.rsl.retrieval.repository;

import com.rsl.retrieval.embed.EmbeddingVector;
import com.rsl.retrieval.index.IndexableRecord;
import com.rsl.retrieval.index.IndexableStore;
import com.rsl.retrieval.index.IndexedKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class NoteRepository implements IndexableStore {
    private final JdbcTemplate jdbcTemplate;

    public NoteRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public IndexedKind kind() {
        return IndexedKind.NOTES;
    }

    @Override
    public Optional<IndexableRecord> findIndexable(String id) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT id::text AS id, content FROM contact_notes WHERE id::text = ? LIMIT 1",
            id
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = rows.get(0);
        return Optional.of(IndexableRecord.note(
            JdbcUtils.asString(row.get("id")),
            JdbcUtils.asString(row.get("content"))
        ));
    }

    @Override
    public void saveEmbedding(String id, EmbeddingVector vector) {
        jdbcTemplate.update(
            "UPDATE contact_notes SET embedding = ?::vector WHERE id::text = ?",
            JdbcUtils.toVectorLiteral(vector.values()),
            id
        );
    }

    @Override
    public long countEligible(String tenantId) {
        return count("SELECT COUNT(*) FROM contact_notes WHERE 1 = 1", tenantId);
    }

    @Override
    public List<String> findEligibleIds(String tenantId, int offset, int limit) {
        StringBuilder sql = new StringBuilder("SELECT id::text AS id FROM contact_notes WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        appendTenant(sql, params, tenantId);
        sql.append(" ORDER BY created_at ASC, id ASC OFFSET ? LIMIT ?");
        params.add(offset);
        params.add(limit);
        return jdbcTemplate.queryForList(sql.toString(), String.class, params.toArray());
    }

    @Override
    public List<String> findUnindexedIds(String tenantId, int limit) {
        StringBuilder sql = new StringBuilder("SELECT id::text AS id FROM contact_notes WHERE embedding IS NULL");
        List<Object> params = new ArrayList<>();
        appendTenant(sql, params, tenantId);
        sql.append(" LIMIT ?");
        params.add(limit);
        return jdbcTemplate.queryForList(sql.toString(), String.class, params.toArray());
    }

    @Override
    public long countIndexed(String tenantId) {
        return count("SELECT COUNT(*) FROM contact_notes WHERE embedding IS NOT NULL", tenantId);
    }

    private long count(String baseSql, String tenantId) {
        StringBuilder sql = new StringBuilder(baseSql);
        List<Object> params = new ArrayList<>();
        appendTenant(sql, params, tenantId);
        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray());
        return count == null ? 0L : count;
    }

    private void appendTenant(StringBuilder sql, List<Object> params, String tenantId) {
        if (tenantId != null) {
            sql.append(" AND tenant_id = ?");
            params.add(tenantId);
        }
    }
}
