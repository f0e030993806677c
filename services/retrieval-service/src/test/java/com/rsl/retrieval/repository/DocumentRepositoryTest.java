package com.rsl.retrieval.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rsl.retrieval.access.AccessLevel;
import com.rsl.retrieval.access.DocumentAclEntry;
import com.rsl.retrieval.access.PrincipalType;
import com.rsl.retrieval.document.CaseDocument;
import com.rsl.retrieval.document.DocumentFtsHit;
import com.rsl.retrieval.embed.EmbeddingVector;
import com.rsl.retrieval.index.IndexableRecord;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class DocumentRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void fullTextSearchBindsQueryTenantCaseAndLimit() {
        List<List<Object>> calls = new ArrayList<>();
        List<String> sqls = new ArrayList<>();
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenAnswer(invocation -> {
            Object[] arguments = invocation.getArguments();
            sqls.add((String) arguments[0]);
            calls.add(Arrays.asList(Arrays.copyOfRange(arguments, 1, arguments.length)));
            return List.of(row("id", "d1", "title", "NDA", "rank", 0.42f, "snippet", "<b>NDA</b>"));
        });

        List<DocumentFtsHit> hits = new DocumentRepository(jdbcTemplate)
            .fullTextSearch("t1", "nda", "7a0c1f2e-0000-4000-8000-000000000001", 20);

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).id()).isEqualTo("d1");
        assertThat(hits.get(0).rank()).isCloseTo(0.42, within(1e-6));
        assertThat(hits.get(0).snippet()).isEqualTo("<b>NDA</b>");
        assertThat(sqls.get(0))
            .contains("ts_rank_cd(cd.search_vector, plainto_tsquery('english', ?))")
            .contains("cd.is_latest_version = true")
            .contains("AND cd.related_case_id = ?::uuid")
            .endsWith("ORDER BY rank DESC LIMIT ?");
        assertThat(calls.get(0)).containsExactly(
            "nda", "nda", "t1", "nda", "7a0c1f2e-0000-4000-8000-000000000001", 20);
    }

    @Test
    void findWithAclAttachesEntriesAndSkipsUnknownLevels() {
        Timestamp created = Timestamp.from(Instant.parse("2026-02-01T10:00:00Z"));
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenAnswer(invocation -> {
            String sql = invocation.getArgument(0);
            if (sql.contains("FROM document_acl")) {
                return List.of(
                    row("document_id", "d1", "principal_type", "USER", "principal_id", "u2", "access_level", "EDIT"),
                    row("document_id", "d1", "principal_type", "ROLE", "principal_id", "LEGAL", "access_level", "OWNER")
                );
            }
            return List.of(row(
                "id", "d1", "title", "NDA", "description", "Mutual NDA", "document_type", "CONTRACT",
                "classification", "CONFIDENTIAL", "status", "APPROVED", "version_major", 2, "version_minor", 1,
                "version_patch", 0, "related_case_id", null, "created_by", "u1", "created_at", created,
                "updated_at", created, "tags", new String[] {"nda", "legal"}
            ));
        });

        List<CaseDocument> documents = new DocumentRepository(jdbcTemplate).findWithAcl("t1", List.of("d1"));

        assertThat(documents).hasSize(1);
        CaseDocument document = documents.get(0);
        assertThat(document.version()).isEqualTo("2.1.0");
        assertThat(document.tags()).containsExactly("nda", "legal");
        assertThat(document.createdAt()).isEqualTo(created.toInstant());
        assertThat(document.acl()).containsExactly(new DocumentAclEntry(PrincipalType.USER, "u2", AccessLevel.EDIT));
    }

    @Test
    void findWithAclSkipsQueryForNoIds() {
        assertThat(new DocumentRepository(jdbcTemplate).findWithAcl("t1", List.of())).isEmpty();
    }

    @Test
    void findIndexableReadsTextFieldsAndTags() {
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(List.of(row(
            "id", "d1", "title", "NDA", "description", null, "extracted_text", "Body", "tags", List.of("legal", "nda")
        )));

        Optional<IndexableRecord> record = new DocumentRepository(jdbcTemplate).findIndexable("d1");

        assertThat(record).isPresent();
        assertThat(record.get().body()).isEqualTo("Body");
        assertThat(record.get().tags()).containsExactly("legal", "nda");
    }

    @Test
    void saveEmbeddingWritesVectorLiteral() {
        new DocumentRepository(jdbcTemplate)
            .saveEmbedding("d1", new EmbeddingVector(new float[] {0.5f, 0.25f}, "m"));

        verify(jdbcTemplate).update(
            "UPDATE case_documents SET embedding = ?::vector WHERE id::text = ?",
            "[0.5,0.25]",
            "d1"
        );
    }

    @Test
    void countsAreTenantScopedOnlyWhenTenantGiven() {
        when(jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM case_documents WHERE deleted_at IS NULL AND tenant_id = ?", Long.class, "t1"))
            .thenReturn(100L);
        when(jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM case_documents WHERE embedding IS NOT NULL AND deleted_at IS NULL", Long.class,
            new Object[0]))
            .thenReturn(80L);

        DocumentRepository repository = new DocumentRepository(jdbcTemplate);

        assertThat(repository.countEligible("t1")).isEqualTo(100L);
        assertThat(repository.countIndexed(null)).isEqualTo(80L);
    }

    @Test
    void eligibleIdsArePagedInCreationOrder() {
        when(jdbcTemplate.queryForList(
            "SELECT id::text AS id FROM case_documents WHERE deleted_at IS NULL AND tenant_id = ? "
                + "ORDER BY created_at ASC, id ASC OFFSET ? LIMIT ?",
            String.class, "t1", 10, 10))
            .thenReturn(List.of("d11", "d12"));

        assertThat(new DocumentRepository(jdbcTemplate).findEligibleIds("t1", 10, 10)).containsExactly("d11", "d12");
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
