package com.rsl.retrieval.audit;

import java.util.Map;

public interface AuditSink {
    void record(String tenantId, String actorId, String action, Map<String, Object> metadata);

    /**
     * Records a finished re-index job. A missing tenant means the job covered every tenant.
     */
    void recordReindex(String tenantId, String requestedBy, String jobId, Map<String, Object> metadata);
}
