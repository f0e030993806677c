package com.rsl.retrieval.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.rsl.retrieval.access.ResourceKind;
import java.util.Locale;

public enum SourceKind {
    LEADS("leads", ResourceKind.LEAD),
    CONTACTS("contacts", ResourceKind.CONTACT),
    ACCOUNTS("accounts", ResourceKind.ACCOUNT),
    OPPORTUNITIES("opportunities", ResourceKind.OPPORTUNITY),
    DOCUMENTS("documents", ResourceKind.DOCUMENT),
    NOTES("notes", ResourceKind.NOTE),
    CONVERSATIONS("conversations", ResourceKind.CONVERSATION),
    MESSAGES("messages", ResourceKind.MESSAGE),
    TICKETS("tickets", ResourceKind.TICKET);

    private final String key;
    private final ResourceKind resource;

    SourceKind(String key, ResourceKind resource) {
        this.key = key;
        this.resource = resource;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public ResourceKind resource() {
        return resource;
    }

    @JsonCreator
    public static SourceKind fromKey(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown source: " + value);
    }
}
