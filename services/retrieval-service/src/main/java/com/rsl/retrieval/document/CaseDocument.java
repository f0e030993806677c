package com.rsl.retrieval.document;

import com.rsl.retrieval.access.DocumentAclEntry;
import java.time.Instant;
import java.util.List;

public record CaseDocument(
    String id,
    String title,
    String description,
    String documentType,
    String classification,
    String status,
    int versionMajor,
    int versionMinor,
    int versionPatch,
    String caseId,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    List<String> tags,
    List<DocumentAclEntry> acl
) {
    public CaseDocument {
        tags = tags == null ? List.of() : List.copyOf(tags);
        acl = acl == null ? List.of() : List.copyOf(acl);
    }

    public String version() {
        return versionMajor + "." + versionMinor + "." + versionPatch;
    }
}
