package com.rsl.retrieval.access;

import java.util.Locale;
import java.util.Optional;

public enum PermissionAction {
    CREATE("create"),
    READ("read"),
    READ_OWN("read:own"),
    UPDATE("update"),
    DELETE("delete"),
    EXPORT("export"),
    MANAGE("manage");

    private final String key;

    PermissionAction(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<PermissionAction> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PermissionAction action : values()) {
            if (action.key.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
