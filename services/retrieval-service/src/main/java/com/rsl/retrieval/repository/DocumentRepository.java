package com.rsl.retrieval.repository;

import com.rsl.retrieval.access.AccessLevel;
import com.rsl.retrieval.access.DocumentAclEntry;
import com.rsl.retrieval.access.PrincipalType;
import com.rsl.retrieval.document.CaseDocument;
import com.rsl.retrieval.document.DocumentFtsHit;
import com.rsl.retrieval.document.DocumentVectorHit;
import com.rsl.retrieval.embed.EmbeddingVector;
import com.rsl.retrieval.index.IndexableRecord;
import com.rsl.retrieval.index.IndexableStore;
import com.rsl.retrieval.index.IndexedKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads and writes {@code case_documents}: ranked full-text search, pgvector similarity
 * search, ACL lookups and embedding storage.
 */
@Repository
public class DocumentRepository implements IndexableStore {
    private static final Logger logger = LoggerFactory.getLogger(DocumentRepository.class);

    private static final String HEADLINE_OPTIONS = "StartSel=<b>,StopSel=</b>,MaxWords=50,MinWords=20";

    private final JdbcTemplate jdbcTemplate;

    public DocumentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<DocumentFtsHit> fullTextSearch(String tenantId, String query, String caseId, int limit) {
        StringBuilder sql = new StringBuilder(
            "SELECT cd.id::text AS id, cd.title, cd.description, "
                + "ts_rank_cd(cd.search_vector, plainto_tsquery('english', ?))::float AS rank, "
                + "ts_headline('english', COALESCE(cd.title, '') || ' ' || COALESCE(cd.description, ''), "
                + "plainto_tsquery('english', ?), '" + HEADLINE_OPTIONS + "') AS snippet "
                + "FROM case_documents cd "
                + "WHERE cd.tenant_id = ? AND cd.deleted_at IS NULL AND cd.is_latest_version = true "
                + "AND cd.search_vector @@ plainto_tsquery('english', ?)"
        );
        List<Object> params = new ArrayList<>(List.of(query, query, tenantId, query));
        if (caseId != null) {
            sql.append(" AND cd.related_case_id = ?::uuid");
            params.add(caseId);
        }
        sql.append(" ORDER BY rank DESC LIMIT ?");
        params.add(limit);

        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql.toString(), params.toArray());
        List<DocumentFtsHit> hits = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Double rank = JdbcUtils.asDouble(row.get("rank"));
            hits.add(new DocumentFtsHit(
                JdbcUtils.asString(row.get("id")),
                JdbcUtils.asString(row.get("title")),
                JdbcUtils.asString(row.get("description")),
                rank == null ? 0.0 : rank,
                JdbcUtils.asString(row.get("snippet"))
            ));
        }
        return hits;
    }

    public List<DocumentVectorHit> vectorSearch(
        String tenantId,
        EmbeddingVector queryVector,
        double threshold,
        String caseId,
        int limit
    ) {
        String vector = JdbcUtils.toVectorLiteral(queryVector.values());
        StringBuilder sql = new StringBuilder(
            "SELECT cd.id::text AS id, cd.title, cd.description, "
                + "(1 - (cd.embedding <=> ?::vector))::float AS similarity "
                + "FROM case_documents cd "
                + "WHERE cd.tenant_id = ? AND cd.deleted_at IS NULL AND cd.is_latest_version = true "
                + "AND cd.embedding IS NOT NULL "
                + "AND (1 - (cd.embedding <=> ?::vector)) >= ?"
        );
        List<Object> params = new ArrayList<>(List.of(vector, tenantId, vector, threshold));
        if (caseId != null) {
            sql.append(" AND cd.related_case_id = ?::uuid");
            params.add(caseId);
        }
        sql.append(" ORDER BY cd.embedding <=> ?::vector LIMIT ?");
        params.add(vector);
        params.add(limit);

        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql.toString(), params.toArray());
        List<DocumentVectorHit> hits = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Double similarity = JdbcUtils.asDouble(row.get("similarity"));
            hits.add(new DocumentVectorHit(
                JdbcUtils.asString(row.get("id")),
                JdbcUtils.asString(row.get("title")),
                JdbcUtils.asString(row.get("description")),
                similarity == null ? 0.0 : similarity
            ));
        }
        return hits;
    }

    /**
     * Loads documents with their ACL entries, in storage order. Ids from other tenants are
     * dropped.
     */
    public List<CaseDocument> findWithAcl(String tenantId, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        String placeholders = JdbcUtils.placeholders(ids.size());
        List<Object> params = new ArrayList<>(ids.size() + 1);
        params.add(tenantId);
        params.addAll(ids);
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT cd.id::text AS id, cd.title, cd.description, cd.document_type, cd.classification, cd.status, "
                + "cd.version_major, cd.version_minor, cd.version_patch, cd.related_case_id::text AS related_case_id, "
                + "cd.created_by, cd.created_at, cd.updated_at, cd.tags "
                + "FROM case_documents cd WHERE cd.tenant_id = ? AND cd.id::text IN (" + placeholders + ")",
            params.toArray()
        );
        Map<String, List<DocumentAclEntry>> aclByDocument = findAcl(ids);

        List<CaseDocument> documents = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String id = JdbcUtils.asString(row.get("id"));
            documents.add(new CaseDocument(
                id,
                JdbcUtils.asString(row.get("title")),
                JdbcUtils.asString(row.get("description")),
                JdbcUtils.asString(row.get("document_type")),
                JdbcUtils.asString(row.get("classification")),
                JdbcUtils.asString(row.get("status")),
                (int) JdbcUtils.asLongOrZero(row.get("version_major")),
                (int) JdbcUtils.asLongOrZero(row.get("version_minor")),
                (int) JdbcUtils.asLongOrZero(row.get("version_patch")),
                JdbcUtils.asString(row.get("related_case_id")),
                JdbcUtils.asString(row.get("created_by")),
                JdbcUtils.asInstant(row.get("created_at")),
                JdbcUtils.asInstant(row.get("updated_at")),
                JdbcUtils.asStringList(row.get("tags")),
                aclByDocument.getOrDefault(id, List.of())
            ));
        }
        return documents;
    }

    private Map<String, List<DocumentAclEntry>> findAcl(List<String> ids) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT document_id::text AS document_id, principal_type, principal_id, access_level "
                + "FROM document_acl WHERE document_id::text IN (" + JdbcUtils.placeholders(ids.size()) + ")",
            ids.toArray()
        );
        Map<String, List<DocumentAclEntry>> result = new HashMap<>();
        for (Map<String, Object> row : rows) {
            PrincipalType principalType = parseEnum(PrincipalType.class, row.get("principal_type"));
            AccessLevel accessLevel = parseEnum(AccessLevel.class, row.get("access_level"));
            if (principalType == null || accessLevel == null) {
                logger.debug("document_acl_entry_skipped document_id={} principal_type={} access_level={}",
                    row.get("document_id"), row.get("principal_type"), row.get("access_level"));
                continue;
            }
            result.computeIfAbsent(JdbcUtils.asString(row.get("document_id")), key -> new ArrayList<>())
                .add(new DocumentAclEntry(principalType, JdbcUtils.asString(row.get("principal_id")), accessLevel));
        }
        return result;
    }

    @Override
    public IndexedKind kind() {
        return IndexedKind.DOCUMENTS;
    }

    @Override
    public Optional<IndexableRecord> findIndexable(String id) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT id::text AS id, title, description, extracted_text, tags FROM case_documents WHERE id::text = ? LIMIT 1",
            id
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = rows.get(0);
        return Optional.of(new IndexableRecord(
            JdbcUtils.asString(row.get("id")),
            JdbcUtils.asString(row.get("title")),
            JdbcUtils.asString(row.get("description")),
            JdbcUtils.asString(row.get("extracted_text")),
            JdbcUtils.asStringList(row.get("tags"))
        ));
    }

    @Override
    public void saveEmbedding(String id, EmbeddingVector vector) {
        jdbcTemplate.update(
            "UPDATE case_documents SET embedding = ?::vector WHERE id::text = ?",
            JdbcUtils.toVectorLiteral(vector.values()),
            id
        );
    }

    @Override
    public long countEligible(String tenantId) {
        return count("SELECT COUNT(*) FROM case_documents WHERE deleted_at IS NULL", tenantId);
    }

    @Override
    public List<String> findEligibleIds(String tenantId, int offset, int limit) {
        StringBuilder sql = new StringBuilder("SELECT id::text AS id FROM case_documents WHERE deleted_at IS NULL");
        List<Object> params = new ArrayList<>();
        appendTenant(sql, params, tenantId);
        sql.append(" ORDER BY created_at ASC, id ASC OFFSET ? LIMIT ?");
        params.add(offset);
        params.add(limit);
        return jdbcTemplate.queryForList(sql.toString(), String.class, params.toArray());
    }

    @Override
    public List<String> findUnindexedIds(String tenantId, int limit) {
        StringBuilder sql = new StringBuilder(
            "SELECT id::text AS id FROM case_documents WHERE embedding IS NULL AND deleted_at IS NULL"
        );
        List<Object> params = new ArrayList<>();
        appendTenant(sql, params, tenantId);
        sql.append(" LIMIT ?");
        params.add(limit);
        return jdbcTemplate.queryForList(sql.toString(), String.class, params.toArray());
    }

    @Override
    public long countIndexed(String tenantId) {
        return count("SELECT COUNT(*) FROM case_documents WHERE embedding IS NOT NULL AND deleted_at IS NULL", tenantId);
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

    private static <E extends Enum<E>> E parseEnum(Class<E> type, Object value) {
        String text = JdbcUtils.asString(value);
        if (text == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
