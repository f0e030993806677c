package com.rsl.retrieval.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rsl.retrieval.repository.AuditLogRepository;
import java.time.Clock;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes search and re-index events to {@code audit_log_entry}. Callers decide what to do with failures.
 */
@Component
public class JdbcAuditSink implements AuditSink {
    static final String EVENT_TYPE = "Search";
    static final String RESOURCE_TYPE = "search";
    static final String REINDEX_EVENT_TYPE = "ReindexComplete";
    static final String REINDEX_RESOURCE_TYPE = "search_index";
    static final String SYSTEM = "system";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcAuditSink(AuditLogRepository auditLogRepository, ObjectMapper objectMapper, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void record(String tenantId, String actorId, String action, Map<String, Object> metadata) {
        auditLogRepository.insert(
            tenantId,
            EVENT_TYPE,
            "search_" + clock.millis(),
            "USER",
            actorId,
            RESOURCE_TYPE,
            "global",
            action,
            "SUCCESS",
            toJson(metadata)
        );
    }

    @Override
    public void recordReindex(String tenantId, String requestedBy, String jobId, Map<String, Object> metadata) {
        auditLogRepository.insert(
            tenantId == null ? SYSTEM : tenantId,
            REINDEX_EVENT_TYPE,
            "reindex_" + jobId,
            "SYSTEM",
            requestedBy == null ? SYSTEM : requestedBy,
            REINDEX_RESOURCE_TYPE,
            tenantId == null ? "all" : tenantId,
            "UPDATE",
            "SUCCESS",
            toJson(metadata)
        );
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("audit metadata is not serializable", e);
        }
    }
}
