package com.rsl.retrieval.source;

import com.rsl.retrieval.repository.JdbcUtils;
import com.rsl.retrieval.repository.RecordSearchRepository;
import com.rsl.retrieval.repository.SourceTable;
import com.rsl.retrieval.search.SearchProperties;
import com.rsl.retrieval.search.SearchResult;
import com.rsl.retrieval.search.SourceKind;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Contact notes. The author is the owner for access purposes.
 */
@Component
public class NoteSourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("n.id::text AS id, n.content, n.author, n.contact_id::text AS contact_id, n.created_at, n.updated_at")
        .from("contact_notes n")
        .tenantColumn("n.tenant_id")
        .ownerColumn("n.author")
        .searchColumns("n.content")
        .recencyColumn("n.updated_at")
        .build();

    public NoteSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.NOTES;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String content = JdbcUtils.asStringOrEmpty(row.get("content"));
        String author = JdbcUtils.asString(row.get("author"));

        return scored(query, content, content)
            .id(JdbcUtils.asString(row.get("id")))
            .title("Note on contact")
            .content(content)
            .metadata("author", author)
            .metadata("contactId", JdbcUtils.asString(row.get("contact_id")))
            .acl(SearchResult.Acl.owner(author))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("updated_at")))
            .build();
    }
}
