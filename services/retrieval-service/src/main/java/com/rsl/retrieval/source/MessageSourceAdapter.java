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
 * Messages inherit tenant and owner from their conversation.
 */
@Component
public class MessageSourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("m.id::text AS id, m.content, m.role, m.conversation_id::text AS conversation_id, "
            + "cr.title AS conversation_title, cr.user_id AS conversation_user_id, m.created_at")
        .from("message_records m JOIN conversation_records cr ON cr.id = m.conversation_id")
        .tenantColumn("cr.tenant_id")
        .ownerColumn("cr.user_id")
        .searchColumns("m.content")
        .recencyColumn("m.created_at")
        .condition("cr.status <> 'DELETED'")
        .build();

    public MessageSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.MESSAGES;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String content = JdbcUtils.asStringOrEmpty(row.get("content"));
        String conversationTitle = JdbcUtils.asString(row.get("conversation_title"));

        return scored(query, content, content)
            .id(JdbcUtils.asString(row.get("id")))
            .title("Message in " + orDefault(conversationTitle, "conversation"))
            .content(content)
            .metadata("role", JdbcUtils.asString(row.get("role")))
            .metadata("conversationId", JdbcUtils.asString(row.get("conversation_id")))
            .metadata("conversationTitle", conversationTitle)
            .acl(SearchResult.Acl.owner(JdbcUtils.asString(row.get("conversation_user_id"))))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("created_at")))
            .build();
    }
}
