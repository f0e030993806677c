package com.rsl.retrieval.index;

import com.rsl.retrieval.audit.AuditSink;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class ReindexJobService {
    private static final Logger logger = LoggerFactory.getLogger(ReindexJobService.class);

    static final int DEFAULT_BATCH_SIZE = 10;
    static final int MAX_BATCH_SIZE = 100;

    private final EmbeddingIndexer indexer;
    private final AuditSink auditSink;
    private final Executor reindexJobExecutor;
    private final Clock clock;
    private final int retainedJobs;
    private final Map<String, ReindexJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> finishedJobIds = new ConcurrentLinkedDeque<>();

    public ReindexJobService(
        EmbeddingIndexer indexer,
        AuditSink auditSink,
        @Qualifier("reindexJobExecutor") Executor reindexJobExecutor,
        Clock clock,
        IndexerProperties properties
    ) {
        this.indexer = indexer;
        this.auditSink = auditSink;
        this.reindexJobExecutor = reindexJobExecutor;
        this.clock = clock;
        this.retainedJobs = Math.max(1, properties.getRetainedJobs());
    }

    public ReindexJob submit(ReindexJobRequest request) {
        if (request == null) {
            throw new InvalidIndexRequestException("request body is required");
        }
        int batchSize = request.getBatchSize() == null ? DEFAULT_BATCH_SIZE : request.getBatchSize();
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            throw new InvalidIndexRequestException("batch_size must be between 1 and " + MAX_BATCH_SIZE);
        }
        if (request.getTenantId() != null && !isUuid(request.getTenantId())) {
            throw new InvalidIndexRequestException("tenant_id must be a UUID");
        }
        requireUuids("document_ids", request.getDocumentIds());
        requireUuids("note_ids", request.getNoteIds());

        ReindexJob job = new ReindexJob(
            UUID.randomUUID().toString(),
            request.getIndexType() == null ? IndexType.ALL : request.getIndexType(),
            request.getTenantId(),
            request.getDocumentIds(),
            request.getNoteIds(),
            batchSize,
            Boolean.TRUE.equals(request.getForceRegenerate()),
            request.getRequestedBy(),
            request.getReason(),
            clock.instant()
        );
        jobs.put(job.getId(), job);
        logger.info("reindex_job_queued job_id={} index_type={} tenant_id={}",
            job.getId(), job.getIndexType().key(), job.getTenantId());
        reindexJobExecutor.execute(() -> run(job));
        return job;
    }

    public ReindexJob get(String jobId) {
        ReindexJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new IndexJobNotFoundException(jobId);
        }
        return job;
    }

    /** Newest first. */
    public List<ReindexJob> list() {
        List<ReindexJob> snapshot = new ArrayList<>(jobs.values());
        snapshot.sort(Comparator.comparing(ReindexJob::getCreatedAt).reversed().thenComparing(ReindexJob::getId));
        return snapshot;
    }

    void run(ReindexJob job) {
        long started = System.nanoTime();
        job.markRunning(clock.instant());
        IndexType type = job.getIndexType();
        try {
            if (type.includesDocuments()) {
                job.updateProgress(ReindexJob.Progress.started(ReindexJob.STAGE_DOCUMENTS, 0));
                BatchIndexResult result;
                if (!job.getDocumentIds().isEmpty()) {
                    result = indexer.indexBatch(job.getDocumentIds());
                } else {
                    int span = type == IndexType.ALL ? 50 : 100;
                    result = indexer.reindexAll(IndexedKind.DOCUMENTS, job.getTenantId(), job.getBatchSize(),
                        progress -> job.updateProgress(new ReindexJob.Progress(
                            ReindexJob.STAGE_DOCUMENTS, scaled(progress, 0, span), progress, null)));
                }
                job.documentsDone(result);
            }
            if (type.includesNotes()) {
                int base = type == IndexType.ALL ? 50 : 0;
                int span = type == IndexType.ALL ? 50 : 100;
                job.updateProgress(ReindexJob.Progress.started(ReindexJob.STAGE_NOTES, base));
                BatchIndexResult result;
                if (!job.getNoteIds().isEmpty()) {
                    result = indexer.indexNotesBatch(job.getNoteIds());
                } else {
                    result = indexer.reindexAll(IndexedKind.NOTES, job.getTenantId(), job.getBatchSize(),
                        progress -> job.updateProgress(new ReindexJob.Progress(
                            ReindexJob.STAGE_NOTES, scaled(progress, base, span), null, progress)));
                }
                job.notesDone(result);
            }
        } catch (RuntimeException e) {
            job.fail(clock.instant(), elapsedMs(started), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            logger.error("reindex_job_failed job_id={} index_type={}", job.getId(), type.key(), e);
            retire(job);
            return;
        }
        job.complete(clock.instant(), elapsedMs(started));
        logger.info("reindex_job_completed job_id={} index_type={} took_ms={}",
            job.getId(), type.key(), job.getTotalElapsedMs());
        audit(job);
        retire(job);
    }

    /** Evicts the oldest finished jobs beyond the retention cap. */
    private void retire(ReindexJob job) {
        finishedJobIds.addLast(job.getId());
        while (finishedJobIds.size() > retainedJobs) {
            String evicted = finishedJobIds.pollFirst();
            if (evicted == null) {
                break;
            }
            jobs.remove(evicted);
            logger.debug("reindex_job_evicted job_id={}", evicted);
        }
    }

    private void audit(ReindexJob job) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("jobId", job.getId());
        metadata.put("indexType", job.getIndexType().key());
        metadata.put("documents", job.getDocuments());
        metadata.put("notes", job.getNotes());
        metadata.put("totalTimeMs", job.getTotalElapsedMs());
        metadata.put("forceRegenerate", job.isForceRegenerate());
        if (job.getReason() != null) {
            metadata.put("reason", job.getReason());
        }
        try {
            auditSink.recordReindex(job.getTenantId(), job.getRequestedBy(), job.getId(), metadata);
        } catch (RuntimeException e) {
            logger.warn("reindex_audit_failed job_id={} reason={}", job.getId(), e.getMessage());
        }
    }

    private static int scaled(ReindexProgress progress, int base, int span) {
        double fraction = progress.total() <= 0 ? 1.0 : Math.min(1.0, (double) progress.processed() / progress.total());
        return base + (int) Math.round(fraction * span);
    }

    private static void requireUuids(String field, List<String> ids) {
        if (ids == null) {
            return;
        }
        for (String id : ids) {
            if (!isUuid(id)) {
                throw new InvalidIndexRequestException(field + " must contain UUIDs");
            }
        }
    }

    static boolean isUuid(String value) {
        if (value == null || value.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
