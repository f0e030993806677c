package com.rsl.retrieval.access;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Snapshot of one user's roles and permissions, built once per query.
 */
public final class AccessContext {
    private final String userId;
    private final String tenantId;
    private final Set<String> roles;
    private final Set<Permission> permissions;

    public AccessContext(String userId, String tenantId, Set<String> roles, Set<Permission> permissions) {
        this.userId = userId;
        this.tenantId = tenantId;
        this.roles = roles == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(roles));
        this.permissions = permissions == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
    }

    public String getUserId() {
        return userId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public Set<String> getRoles() {
        return roles;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public boolean hasRole(String role) {
        return role != null && roles.contains(role);
    }

    public boolean hasPermission(ResourceKind resource, PermissionAction action) {
        return permissions.contains(Permission.of(resource, action));
    }
}
