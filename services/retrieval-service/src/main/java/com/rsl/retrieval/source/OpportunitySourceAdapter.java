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
public class OpportunitySourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("o.id::text AS id, o.name, o.description, o.stage, o.value, o.probability, o.owner_id, "
            + "a.name AS account_name, o.created_at, o.updated_at")
        .from("opportunities o LEFT JOIN accounts a ON a.id = o.account_id")
        .tenantColumn("o.tenant_id")
        .ownerColumn("o.owner_id")
        .searchColumns("o.name", "o.description")
        .statusColumn("o.stage")
        .recencyColumn("o.updated_at")
        .build();

    public OpportunitySourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.OPPORTUNITIES;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String name = JdbcUtils.asStringOrEmpty(row.get("name"));
        String description = JdbcUtils.asString(row.get("description"));
        String stage = JdbcUtils.asString(row.get("stage"));
        String accountName = JdbcUtils.asString(row.get("account_name"));

        return scored(query, name, joined(name, description))
            .id(JdbcUtils.asString(row.get("id")))
            .title(name)
            .content(orDefault(stage, "") + " - " + orDefault(accountName, "No account") + " - "
                + orDefault(description, ""))
            .metadata("stage", stage)
            .metadata("value", JdbcUtils.asString(row.get("value")))
            .metadata("probability", row.get("probability"))
            .metadata("accountName", accountName)
            .acl(SearchResult.Acl.owner(JdbcUtils.asString(row.get("owner_id"))))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("updated_at")))
            .build();
    }
}
