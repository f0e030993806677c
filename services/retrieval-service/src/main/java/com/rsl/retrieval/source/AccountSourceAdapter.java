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
public class AccountSourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("a.id::text AS id, a.name, a.website, a.industry, a.description, a.employees, a.owner_id, "
            + "a.created_at, a.updated_at")
        .from("accounts a")
        .tenantColumn("a.tenant_id")
        .ownerColumn("a.owner_id")
        .searchColumns("a.name", "a.website", "a.industry", "a.description")
        .recencyColumn("a.updated_at")
        .build();

    public AccountSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.ACCOUNTS;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String name = JdbcUtils.asStringOrEmpty(row.get("name"));
        String website = JdbcUtils.asString(row.get("website"));
        String industry = JdbcUtils.asString(row.get("industry"));
        String description = JdbcUtils.asString(row.get("description"));

        // scored on the name only
        return scored(query, name, joined(name, industry, description))
            .id(JdbcUtils.asString(row.get("id")))
            .title(name)
            .content(orDefault(website, "") + " - " + orDefault(industry, "No industry") + " - "
                + orDefault(description, ""))
            .metadata("website", website)
            .metadata("industry", industry)
            .metadata("employees", row.get("employees"))
            .acl(SearchResult.Acl.owner(JdbcUtils.asString(row.get("owner_id"))))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("updated_at")))
            .build();
    }
}
