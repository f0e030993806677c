package com.rsl.retrieval.api;

import com.rsl.retrieval.index.BatchIndexResult;
import com.rsl.retrieval.index.EmbeddingIndexer;
import com.rsl.retrieval.index.IndexResult;
import com.rsl.retrieval.index.IndexStats;
import com.rsl.retrieval.index.IndexedKind;
import com.rsl.retrieval.index.InvalidIndexRequestException;
import com.rsl.retrieval.index.ReindexJob;
import com.rsl.retrieval.index.ReindexJobRequest;
import com.rsl.retrieval.index.ReindexJobService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal indexing surface: single and batch embedding, coverage stats, and background re-index jobs.
 */
@RestController
@RequestMapping("/internal/index")
public class IndexController {
    static final int MAX_BATCH_IDS = 100;
    static final int MAX_UNINDEXED_LIMIT = 1000;

    private final EmbeddingIndexer indexer;
    private final ReindexJobService jobService;

    public IndexController(EmbeddingIndexer indexer, ReindexJobService jobService) {
        this.indexer = indexer;
        this.jobService = jobService;
    }

    @PostMapping("/documents/{id}")
    public IndexResult indexDocument(@PathVariable("id") String id) {
        return indexer.indexOne(id);
    }

    @PostMapping("/notes/{id}")
    public IndexResult indexNote(@PathVariable("id") String id) {
        return indexer.indexNote(id);
    }

    @PostMapping("/documents/batch")
    public BatchIndexResult indexDocuments(@RequestBody(required = false) IndexBatchRequest request) {
        return indexer.indexBatch(requireIds(request));
    }

    @PostMapping("/notes/batch")
    public BatchIndexResult indexNotes(@RequestBody(required = false) IndexBatchRequest request) {
        return indexer.indexNotesBatch(requireIds(request));
    }

    @GetMapping("/stats")
    public IndexStats stats(@RequestParam(value = "tenant_id", required = false) String tenantId) {
        return indexer.getIndexStats(tenantId);
    }

    @GetMapping("/unindexed")
    public Map<String, Object> unindexed(
        @RequestParam(value = "kind", defaultValue = "documents") String kind,
        @RequestParam(value = "tenant_id", required = false) String tenantId,
        @RequestParam(value = "limit", defaultValue = "100") int limit
    ) {
        IndexedKind indexedKind = IndexedKind.fromKey(kind);
        if (indexedKind == null) {
            throw new InvalidIndexRequestException("kind must be documents or notes");
        }
        if (limit < 1 || limit > MAX_UNINDEXED_LIMIT) {
            throw new InvalidIndexRequestException("limit must be between 1 and " + MAX_UNINDEXED_LIMIT);
        }
        List<String> ids = indexer.getUnindexedIds(indexedKind, tenantId, limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", indexedKind.key());
        body.put("ids", ids);
        body.put("count", ids.size());
        return body;
    }

    @PostMapping("/reindex-jobs")
    public ResponseEntity<ReindexJob> submitJob(@RequestBody(required = false) ReindexJobRequest request) {
        ReindexJob job = jobService.submit(request == null ? new ReindexJobRequest() : request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping("/reindex-jobs")
    public List<ReindexJob> listJobs() {
        return jobService.list();
    }

    @GetMapping("/reindex-jobs/{jobId}")
    public ReindexJob getJob(@PathVariable("jobId") String jobId) {
        return jobService.get(jobId);
    }

    private static List<String> requireIds(IndexBatchRequest request) {
        if (request == null || request.getIds() == null) {
            throw new InvalidIndexRequestException("ids is required");
        }
        if (request.getIds().size() > MAX_BATCH_IDS) {
            throw new InvalidIndexRequestException("at most " + MAX_BATCH_IDS + " ids per batch");
        }
        return request.getIds();
    }
}
