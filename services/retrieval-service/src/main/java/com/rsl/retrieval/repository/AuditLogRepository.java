package com.rsl.retrieval.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AuditLogRepository {
    private final JdbcTemplate jdbcTemplate;

    public AuditLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(
        String tenantId,
        String eventType,
        String eventId,
        String actorType,
        String actorId,
        String resourceType,
        String resourceId,
        String action,
        String actionResult,
        String metadataJson
    ) {
        jdbcTemplate.update(
            "INSERT INTO audit_log_entry (tenant_id, event_type, event_id, actor_type, actor_id, resource_type, "
                + "resource_id, action, action_result, metadata) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb))",
            tenantId,
            eventType,
            eventId,
            actorType,
            actorId,
            resourceType,
            resourceId,
            action,
            actionResult,
            metadataJson
        );
    }
}
