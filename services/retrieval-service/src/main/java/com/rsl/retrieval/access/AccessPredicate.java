package com.rsl.retrieval.access;

/**
 * Source-level pre-filter. Always tenant scoped; {@code ownerId} is set when the caller may
 * only see records they own.
 */
public final class AccessPredicate {
    private final String tenantId;
    private final String ownerId;

    private AccessPredicate(String tenantId, String ownerId) {
        this.tenantId = tenantId;
        this.ownerId = ownerId;
    }

    public static AccessPredicate tenantWide(String tenantId) {
        return new AccessPredicate(tenantId, null);
    }

    public static AccessPredicate ownedBy(String tenantId, String ownerId) {
        return new AccessPredicate(tenantId, ownerId);
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public boolean isOwnedOnly() {
        return ownerId != null;
    }

    @Override
    public String toString() {
        return "AccessPredicate{tenantId=" + tenantId + ", ownerId=" + ownerId + "}";
    }
}
