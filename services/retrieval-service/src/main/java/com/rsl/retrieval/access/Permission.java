package com.rsl.retrieval.access;

import java.util.Objects;

public record Permission(ResourceKind resource, PermissionAction action) {
    public Permission {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(action, "action");
    }

    public static Permission of(ResourceKind resource, PermissionAction action) {
        return new Permission(resource, action);
    }

    public String name() {
        return resource.key() + ":" + action.key();
    }
}
