package com.rsl.retrieval.source;

import com.rsl.retrieval.repository.JdbcUtils;
import com.rsl.retrieval.repository.RecordSearchRepository;
import com.rsl.retrieval.repository.SourceTable;
import com.rsl.retrieval.search.SearchProperties;
import com.rsl.retrieval.search.SearchResult;
import com.rsl.retrieval.search.SourceKind;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ConversationSourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("cr.id::text AS id, cr.title, cr.summary, cr.session_id, cr.agent_name, cr.channel, "
            + "cr.message_count, cr.status, cr.user_id, cr.created_at, cr.updated_at")
        .from("conversation_records cr")
        .tenantColumn("cr.tenant_id")
        .ownerColumn("cr.user_id")
        .searchColumns("cr.title", "cr.summary", "cr.context_name")
        .recencyColumn("cr.started_at")
        .condition("cr.status <> 'DELETED'")
        .build();

    public ConversationSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.CONVERSATIONS;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String title = JdbcUtils.asString(row.get("title"));
        String summary = JdbcUtils.asString(row.get("summary"));
        String text = joined(title, summary);

        return scored(query, text, text)
            .id(JdbcUtils.asString(row.get("id")))
            .title(title != null && !title.isEmpty() ? title : "Conversation " + sessionPrefix(row.get("session_id")))
            .content(orDefault(summary, ""))
            .metadata("agentName", JdbcUtils.asString(row.get("agent_name")))
            .metadata("channel", JdbcUtils.asString(row.get("channel")))
            .metadata("messageCount", row.get("message_count"))
            .metadata("status", JdbcUtils.asString(row.get("status")))
            .acl(SearchResult.Acl.owner(JdbcUtils.asString(row.get("user_id"))))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("updated_at")))
            .build();
    }

    private static String sessionPrefix(Object sessionId) {
        String value = JdbcUtils.asStringOrEmpty(sessionId);
        return value.length() > 8 ? value.substring(0, 8) : value;
    }
}
