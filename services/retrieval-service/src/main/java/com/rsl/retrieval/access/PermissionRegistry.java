package com.rsl.retrieval.access;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves stored permission names of the form {@code resource:action} (or
 * {@code resource:read:own}) into typed {@link Permission} values.
 */
@Component
public class PermissionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PermissionRegistry.class);

    public Optional<Permission> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        int separator = name.indexOf(':');
        if (separator <= 0 || separator == name.length() - 1) {
            return Optional.empty();
        }
        Optional<ResourceKind> resource = ResourceKind.fromKey(name.substring(0, separator));
        Optional<PermissionAction> action = PermissionAction.fromKey(name.substring(separator + 1));
        if (resource.isEmpty() || action.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Permission.of(resource.get(), action.get()));
    }

    public Set<Permission> resolveAll(Collection<String> names) {
        Set<Permission> permissions = new LinkedHashSet<>();
        if (names == null) {
            return permissions;
        }
        for (String name : names) {
            Optional<Permission> permission = resolve(name);
            if (permission.isPresent()) {
                permissions.add(permission.get());
            } else {
                logger.debug("permission_name_ignored name={}", name);
            }
        }
        return permissions;
    }
}
