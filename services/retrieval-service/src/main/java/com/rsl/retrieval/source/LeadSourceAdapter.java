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
public class LeadSourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("l.id::text AS id, l.email, l.first_name, l.last_name, l.company, l.title, l.status, l.score, "
            + "l.source, l.owner_id, l.created_at, l.updated_at")
        .from("leads l")
        .tenantColumn("l.tenant_id")
        .ownerColumn("l.owner_id")
        .searchColumns("l.email", "l.first_name", "l.last_name", "l.company", "l.title")
        .statusColumn("l.status")
        .recencyColumn("l.updated_at")
        .build();

    public LeadSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.LEADS;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String email = JdbcUtils.asStringOrEmpty(row.get("email"));
        String firstName = JdbcUtils.asString(row.get("first_name"));
        String lastName = JdbcUtils.asString(row.get("last_name"));
        String company = JdbcUtils.asString(row.get("company"));
        String title = JdbcUtils.asString(row.get("title"));
        String ownerId = JdbcUtils.asString(row.get("owner_id"));
        String name = joined(firstName, lastName).trim();

        return scored(query, joined(firstName, lastName, email, company), joined(email, company, title))
            .id(JdbcUtils.asString(row.get("id")))
            .title(name.isEmpty() ? email : name)
            .content(email + " - " + orDefault(company, "No company") + " - " + orDefault(title, "No title"))
            .metadata("email", email)
            .metadata("company", company)
            .metadata("status", JdbcUtils.asString(row.get("status")))
            .metadata("score", row.get("score"))
            .metadata("source", JdbcUtils.asString(row.get("source")))
            .acl(SearchResult.Acl.owner(ownerId))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("updated_at")))
            .build();
    }
}
