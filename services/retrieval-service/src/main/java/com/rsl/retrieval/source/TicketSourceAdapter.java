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
public class TicketSourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("t.id::text AS id, t.ticket_number, t.subject, t.description, t.status, t.priority, t.sla_status, "
            + "t.contact_name, t.assignee_id, t.created_at, t.updated_at")
        .from("tickets t")
        .tenantColumn("t.tenant_id")
        .ownerColumn("t.assignee_id")
        .searchColumns("t.ticket_number", "t.subject", "t.description")
        .statusColumn("t.status")
        .recencyColumn("t.updated_at")
        .build();

    public TicketSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.TICKETS;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String number = JdbcUtils.asStringOrEmpty(row.get("ticket_number"));
        String subject = JdbcUtils.asStringOrEmpty(row.get("subject"));
        String description = JdbcUtils.asString(row.get("description"));

        return scored(query, subject, joined(subject, description))
            .id(JdbcUtils.asString(row.get("id")))
            .title(number + ": " + subject)
            .content(orDefault(description, ""))
            .metadata("ticketNumber", number)
            .metadata("status", JdbcUtils.asString(row.get("status")))
            .metadata("priority", JdbcUtils.asString(row.get("priority")))
            .metadata("slaStatus", JdbcUtils.asString(row.get("sla_status")))
            .metadata("contactName", JdbcUtils.asString(row.get("contact_name")))
            .acl(SearchResult.Acl.owner(JdbcUtils.asString(row.get("assignee_id"))))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("updated_at")))
            .build();
    }
}
