package com.rsl.retrieval.access;

import java.util.Locale;
import java.util.Optional;

/**
 * Record types that carry permissions. Stored permission names use either the singular
 * resource key ({@code lead:read}) or the plural source key ({@code leads:read}).
 */
public enum ResourceKind {
    LEAD("lead", "leads"),
    CONTACT("contact", "contacts"),
    ACCOUNT("account", "accounts"),
    OPPORTUNITY("opportunity", "opportunities"),
    DOCUMENT("document", "documents"),
    NOTE("note", "notes"),
    CONVERSATION("conversation", "conversations"),
    MESSAGE("message", "messages"),
    TICKET("ticket", "tickets");

    private final String key;
    private final String pluralKey;

    ResourceKind(String key, String pluralKey) {
        this.key = key;
        this.pluralKey = pluralKey;
    }

    public String key() {
        return key;
    }

    public String pluralKey() {
        return pluralKey;
    }

    public static Optional<ResourceKind> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResourceKind kind : values()) {
            if (kind.key.equals(normalized) || kind.pluralKey.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
