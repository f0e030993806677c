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
public class ContactSourceAdapter extends RecordSourceAdapter {
    static final SourceTable TABLE = SourceTable.builder()
        .select("c.id::text AS id, c.email, c.first_name, c.last_name, c.title, c.department, c.owner_id, "
            + "a.name AS account_name, c.created_at, c.updated_at")
        .from("contacts c LEFT JOIN accounts a ON a.id = c.account_id")
        .tenantColumn("c.tenant_id")
        .ownerColumn("c.owner_id")
        .searchColumns("c.email", "c.first_name", "c.last_name", "c.title", "c.department")
        .recencyColumn("c.updated_at")
        .build();

    public ContactSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        super(repository, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.CONTACTS;
    }

    @Override
    protected SourceTable table() {
        return TABLE;
    }

    @Override
    protected SearchResult toResult(Map<String, Object> row, String query) {
        String email = JdbcUtils.asStringOrEmpty(row.get("email"));
        String firstName = JdbcUtils.asStringOrEmpty(row.get("first_name"));
        String lastName = JdbcUtils.asStringOrEmpty(row.get("last_name"));
        String title = JdbcUtils.asString(row.get("title"));
        String accountName = JdbcUtils.asString(row.get("account_name"));

        return scored(query, joined(firstName, lastName, email, title), joined(firstName, lastName, email, title))
            .id(JdbcUtils.asString(row.get("id")))
            .title(firstName + " " + lastName)
            .content(email + " - " + orDefault(title, "No title") + " at " + orDefault(accountName, "No company"))
            .metadata("email", email)
            .metadata("title", title)
            .metadata("department", JdbcUtils.asString(row.get("department")))
            .metadata("accountName", accountName)
            .acl(SearchResult.Acl.owner(JdbcUtils.asString(row.get("owner_id"))))
            .createdAt(JdbcUtils.asInstant(row.get("created_at")))
            .updatedAt(JdbcUtils.asInstant(row.get("updated_at")))
            .build();
    }
}
