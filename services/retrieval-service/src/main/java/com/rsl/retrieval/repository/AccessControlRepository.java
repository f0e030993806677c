package com.rsl.retrieval.repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AccessControlRepository {
    private final JdbcTemplate jdbcTemplate;

    public AccessControlRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Active role assignments of the user, one row per granted permission of the role. Roles
     * without granted permissions still appear once with a null permission name.
     */
    public List<RoleGrant> findActiveRoleGrants(String userId, Instant now) {
        String sql = "SELECT r.name AS role_name, p.name AS permission_name "
            + "FROM user_role_assignments ura "
            + "JOIN roles r ON r.id = ura.role_id "
            + "LEFT JOIN role_permissions rp ON rp.role_id = r.id AND rp.granted = true "
            + "LEFT JOIN permissions p ON p.id = rp.permission_id "
            + "WHERE ura.user_id = ? AND (ura.expires_at IS NULL OR ura.expires_at > ?)";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, userId, Timestamp.from(now));
        List<RoleGrant> grants = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            grants.add(new RoleGrant(
                JdbcUtils.asString(row.get("role_name")),
                JdbcUtils.asString(row.get("permission_name"))
            ));
        }
        return grants;
    }

    public List<String> findActiveUserPermissionNames(String userId, Instant now) {
        String sql = "SELECT p.name AS permission_name "
            + "FROM user_permissions up "
            + "JOIN permissions p ON p.id = up.permission_id "
            + "WHERE up.user_id = ? AND up.granted = true "
            + "AND (up.expires_at IS NULL OR up.expires_at > ?)";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, userId, Timestamp.from(now));
        List<String> names = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String name = JdbcUtils.asString(row.get("permission_name"));
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    public record RoleGrant(String roleName, String permissionName) {
    }
}
