package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * In-memory state of one background re-index job. Mutated only by the job thread;
 * readers see each field's latest published value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReindexJob {
    public static final String STAGE_DOCUMENTS = "documents";
    public static final String STAGE_NOTES = "notes";
    public static final String STAGE_COMPLETE = "complete";

    private final String id;
    private final IndexType indexType;
    private final String tenantId;
    private final List<String> documentIds;
    private final List<String> noteIds;
    private final int batchSize;
    private final boolean forceRegenerate;
    private final String requestedBy;
    private final String reason;
    private final Instant createdAt;

    private volatile ReindexJobStatus status = ReindexJobStatus.QUEUED;
    private volatile Progress progress;
    private volatile Summary documents;
    private volatile Summary notes;
    private volatile String error;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile Long totalElapsedMs;

    public ReindexJob(
        String id,
        IndexType indexType,
        String tenantId,
        List<String> documentIds,
        List<String> noteIds,
        int batchSize,
        boolean forceRegenerate,
        String requestedBy,
        String reason,
        Instant createdAt
    ) {
        this.id = id;
        this.indexType = indexType;
        this.tenantId = tenantId;
        this.documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
        this.noteIds = noteIds == null ? List.of() : List.copyOf(noteIds);
        this.batchSize = batchSize;
        this.forceRegenerate = forceRegenerate;
        this.requestedBy = requestedBy;
        this.reason = reason;
        this.createdAt = createdAt;
    }

    void markRunning(Instant now) {
        this.startedAt = now;
        this.status = ReindexJobStatus.RUNNING;
    }

    void updateProgress(Progress progress) {
        this.progress = progress;
    }

    void documentsDone(BatchIndexResult result) {
        this.documents = Summary.of(result);
    }

    void notesDone(BatchIndexResult result) {
        this.notes = Summary.of(result);
    }

    void complete(Instant now, long elapsedMs) {
        this.progress = new Progress(STAGE_COMPLETE, 100, null, null);
        this.completedAt = now;
        this.totalElapsedMs = elapsedMs;
        this.status = ReindexJobStatus.COMPLETED;
    }

    void fail(Instant now, long elapsedMs, String error) {
        this.error = error;
        this.completedAt = now;
        this.totalElapsedMs = elapsedMs;
        this.status = ReindexJobStatus.FAILED;
    }

    public String getId() {
        return id;
    }

    @JsonProperty("index_type")
    public IndexType getIndexType() {
        return indexType;
    }

    @JsonProperty("tenant_id")
    public String getTenantId() {
        return tenantId;
    }

    @JsonProperty("document_ids")
    public List<String> getDocumentIds() {
        return documentIds;
    }

    @JsonProperty("note_ids")
    public List<String> getNoteIds() {
        return noteIds;
    }

    @JsonProperty("batch_size")
    public int getBatchSize() {
        return batchSize;
    }

    @JsonProperty("force_regenerate")
    public boolean isForceRegenerate() {
        return forceRegenerate;
    }

    @JsonProperty("requested_by")
    public String getRequestedBy() {
        return requestedBy;
    }

    public String getReason() {
        return reason;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    public ReindexJobStatus getStatus() {
        return status;
    }

    public Progress getProgress() {
        return progress;
    }

    public Summary getDocuments() {
        return documents;
    }

    public Summary getNotes() {
        return notes;
    }

    public String getError() {
        return error;
    }

    @JsonProperty("started_at")
    public Instant getStartedAt() {
        return startedAt;
    }

    @JsonProperty("completed_at")
    public Instant getCompletedAt() {
        return completedAt;
    }

    @JsonProperty("total_elapsed_ms")
    public Long getTotalElapsedMs() {
        return totalElapsedMs;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Progress(
        String stage,
        @JsonProperty("overall_progress") int overallProgress,
        ReindexProgress documents,
        ReindexProgress notes
    ) {
        static Progress started(String stage, int overallProgress) {
            return new Progress(stage, overallProgress, null, null);
        }
    }

    public record Summary(int total, int successful, int failed) {
        static Summary of(BatchIndexResult result) {
            return new Summary(result.getTotal(), result.getSuccessful(), result.getFailed());
        }
    }
}
