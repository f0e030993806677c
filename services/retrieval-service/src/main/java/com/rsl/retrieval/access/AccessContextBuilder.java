package com.rsl.retrieval.access;

import com.rsl.retrieval.repository.AccessControlRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Service;

@Service
public class AccessContextBuilder {
    private final AccessControlRepository accessControlRepository;
    private final PermissionRegistry permissionRegistry;
    private final Clock clock;

    public AccessContextBuilder(
        AccessControlRepository accessControlRepository,
        PermissionRegistry permissionRegistry,
        Clock clock
    ) {
        this.accessControlRepository = accessControlRepository;
        this.permissionRegistry = permissionRegistry;
        this.clock = clock;
    }

    /**
     * Resolves non-expired role assignments and direct grants into one context. Storage
     * failures propagate to the caller.
     */
    public AccessContext build(String userId, String tenantId) {
        Instant now = clock.instant();
        Set<String> roles = new LinkedHashSet<>();
        List<String> permissionNames = new ArrayList<>();
        for (AccessControlRepository.RoleGrant grant : accessControlRepository.findActiveRoleGrants(userId, now)) {
            if (grant.roleName() != null) {
                roles.add(grant.roleName());
            }
            if (grant.permissionName() != null) {
                permissionNames.add(grant.permissionName());
            }
        }
        permissionNames.addAll(accessControlRepository.findActiveUserPermissionNames(userId, now));
        return new AccessContext(userId, tenantId, roles, permissionRegistry.resolveAll(permissionNames));
    }
}
