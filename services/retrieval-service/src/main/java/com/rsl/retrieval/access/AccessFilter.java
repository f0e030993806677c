package com.rsl.retrieval.access;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class AccessFilter {
    private final AccessProperties properties;
    private final TeamMembershipResolver teamMembershipResolver;

    public AccessFilter(AccessProperties properties, TeamMembershipResolver teamMembershipResolver) {
        this.properties = properties;
        this.teamMembershipResolver = teamMembershipResolver;
    }

    public boolean isAdmin(AccessContext context) {
        return context.hasRole(properties.getAdminRole());
    }

    public boolean canAccess(AccessContext context, ResourceKind resource, String resourceOwnerId) {
        return canAccess(context, resource, resourceOwnerId, PermissionAction.READ);
    }

    public boolean canAccess(
        AccessContext context,
        ResourceKind resource,
        String resourceOwnerId,
        PermissionAction requiredAction
    ) {
        if (isAdmin(context)) {
            return true;
        }
        if (context.hasPermission(resource, requiredAction)) {
            return true;
        }
        if (resourceOwnerId != null && resourceOwnerId.equals(context.getUserId())) {
            return true;
        }
        if (resourceOwnerId != null && context.hasRole(properties.getManagerRole())) {
            return teamMembershipResolver.isTeamMember(context.getUserId(), context.getTenantId(), resourceOwnerId);
        }
        return false;
    }

    /**
     * Tenant-wide for admins and holders of {@code (resource, READ)}; owned records only
     * otherwise, including {@code read:own} holders.
     */
    public AccessPredicate buildAccessPredicate(AccessContext context, ResourceKind resource) {
        if (isAdmin(context) || context.hasPermission(resource, PermissionAction.READ)) {
            return AccessPredicate.tenantWide(context.getTenantId());
        }
        return AccessPredicate.ownedBy(context.getTenantId(), context.getUserId());
    }

    public boolean canViewDocument(AccessContext context, String createdBy, List<DocumentAclEntry> acl) {
        if (isAdmin(context)) {
            return true;
        }
        if (createdBy != null && createdBy.equals(context.getUserId())) {
            return true;
        }
        if (acl == null) {
            return false;
        }
        for (DocumentAclEntry entry : acl) {
            if (matchesPrincipal(context, entry)) {
                return true;
            }
        }
        return false;
    }

    public static List<String> viewableBy(List<DocumentAclEntry> acl) {
        List<String> principals = new ArrayList<>();
        if (acl == null) {
            return principals;
        }
        for (DocumentAclEntry entry : acl) {
            if (entry.accessLevel() != null) {
                principals.add(entry.principalId());
            }
        }
        return principals;
    }

    public static List<String> editableBy(List<DocumentAclEntry> acl) {
        List<String> principals = new ArrayList<>();
        if (acl == null) {
            return principals;
        }
        for (DocumentAclEntry entry : acl) {
            if (entry.accessLevel() != null && entry.accessLevel().canEdit()) {
                principals.add(entry.principalId());
            }
        }
        return principals;
    }

    private boolean matchesPrincipal(AccessContext context, DocumentAclEntry entry) {
        if (entry.principalType() == null || entry.principalId() == null) {
            return false;
        }
        return switch (entry.principalType()) {
            case USER -> Objects.equals(entry.principalId(), context.getUserId());
            case ROLE -> context.hasRole(entry.principalId());
            case TENANT -> Objects.equals(entry.principalId(), context.getTenantId());
        };
    }
}
