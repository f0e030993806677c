package com.rsl.retrieval.index;

import com.rsl.retrieval.embed.EmbeddingOutcome;
import com.rsl.retrieval.embed.EmbeddingProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Computes and stores embeddings for documents and notes. At most {@code maxConcurrent}
 * embedding requests are in flight; per-item failures are reported, never thrown.
 */
@Service
public class EmbeddingIndexer {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingIndexer.class);

    static final String GENERATION_FAILED = "Embedding generation failed";

    private final Map<IndexedKind, IndexableStore> stores;
    private final EmbeddingProvider embeddingProvider;
    private final IndexerProperties properties;
    private final ExecutorService indexingExecutor;
    private final MeterRegistry meterRegistry;

    public EmbeddingIndexer(
        List<IndexableStore> stores,
        EmbeddingProvider embeddingProvider,
        IndexerProperties properties,
        @Qualifier("indexingExecutor") ExecutorService indexingExecutor,
        MeterRegistry meterRegistry
    ) {
        this.stores = new EnumMap<>(IndexedKind.class);
        for (IndexableStore store : stores) {
            this.stores.put(store.kind(), store);
        }
        this.embeddingProvider = embeddingProvider;
        this.properties = properties;
        this.indexingExecutor = indexingExecutor;
        this.meterRegistry = meterRegistry;
    }

    public IndexResult indexOne(String documentId) {
        return index(IndexedKind.DOCUMENTS, documentId);
    }

    public IndexResult indexNote(String noteId) {
        return index(IndexedKind.NOTES, noteId);
    }

    public BatchIndexResult indexBatch(List<String> documentIds) {
        return indexBatch(IndexedKind.DOCUMENTS, documentIds);
    }

    public BatchIndexResult indexNotesBatch(List<String> noteIds) {
        return indexBatch(IndexedKind.NOTES, noteIds);
    }

    public BatchIndexResult reindexAll(String tenantId, Consumer<ReindexProgress> onProgress) {
        return reindexAll(IndexedKind.DOCUMENTS, tenantId, properties.getBatchSize(), onProgress);
    }

    public BatchIndexResult reindexAllNotes(String tenantId, Consumer<ReindexProgress> onProgress) {
        return reindexAll(IndexedKind.NOTES, tenantId, properties.getBatchSize(), onProgress);
    }

    public List<String> getUnindexedIds(IndexedKind kind, String tenantId, int limit) {
        return store(kind).findUnindexedIds(tenantId, limit);
    }

    public IndexStats getIndexStats(String tenantId) {
        return new IndexStats(coverage(IndexedKind.DOCUMENTS, tenantId), coverage(IndexedKind.NOTES, tenantId));
    }

    public IndexResult index(IndexedKind kind, String id) {
        long started = System.nanoTime();
        IndexResult result;
        try {
            IndexableStore store = store(kind);
            Optional<IndexableRecord> record = store.findIndexable(id);
            if (record.isEmpty()) {
                result = IndexResult.failed(id, notFoundMessage(kind), elapsedMs(started));
            } else {
                EmbeddingOutcome outcome = generateWithRetry(buildEmbeddingInput(record.get()));
                if (outcome.isGenerated()) {
                    store.saveEmbedding(id, outcome.getVector());
                    result = IndexResult.indexed(id, elapsedMs(started));
                } else {
                    logger.warn("index_embedding_failed kind={} id={} reason={}", kind.key(), id, outcome.getReason());
                    result = IndexResult.failed(id, GENERATION_FAILED + ": " + outcome.getReason(), elapsedMs(started));
                }
            }
        } catch (RuntimeException e) {
            logger.warn("index_item_failed kind={} id={} reason={}", kind.key(), id, e.getMessage());
            result = IndexResult.failed(id, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                elapsedMs(started));
        }
        meterRegistry.counter(
            "retrieval.index.items",
            "kind", kind.key(),
            "outcome", result.isSuccess() ? "indexed" : "failed"
        ).increment();
        return result;
    }

    /**
     * Indexes {@code ids} in chunks of {@code maxConcurrent}; items of a chunk run concurrently
     * and chunks are separated by a fixed delay. Results keep input order.
     */
    public BatchIndexResult indexBatch(IndexedKind kind, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return BatchIndexResult.empty();
        }
        long started = System.nanoTime();
        int chunkSize = Math.max(1, properties.getMaxConcurrent());
        List<IndexResult> results = new ArrayList<>(ids.size());

        for (int i = 0; i < ids.size(); i += chunkSize) {
            List<String> chunk = ids.subList(i, Math.min(i + chunkSize, ids.size()));
            List<CompletableFuture<IndexResult>> futures = new ArrayList<>(chunk.size());
            for (String id : chunk) {
                futures.add(CompletableFuture.supplyAsync(() -> index(kind, id), indexingExecutor));
            }
            for (CompletableFuture<IndexResult> future : futures) {
                results.add(future.join());
            }
            if (i + chunkSize < ids.size()) {
                pause(properties.getChunkDelayMs());
            }
        }
        return aggregate(ids.size(), results, elapsedMs(started));
    }

    public BatchIndexResult reindexAll(
        IndexedKind kind,
        String tenantId,
        int batchSize,
        Consumer<ReindexProgress> onProgress
    ) {
        long started = System.nanoTime();
        IndexableStore store = store(kind);
        int pageSize = Math.max(1, batchSize);
        int total = (int) store.countEligible(tenantId);
        int totalBatches = (total + pageSize - 1) / pageSize;
        logger.info("reindex_started kind={} tenant_id={} total={} batches={}", kind.key(), tenantId, total, totalBatches);

        List<IndexResult> results = new ArrayList<>(total);
        int processed = 0;
        int successful = 0;
        int failed = 0;
        for (int batch = 0; batch < totalBatches; batch++) {
            List<String> ids = store.findEligibleIds(tenantId, batch * pageSize, pageSize);
            if (ids.isEmpty()) {
                break;
            }
            BatchIndexResult batchResult = indexBatch(kind, ids);
            results.addAll(batchResult.getResults());
            processed += batchResult.getTotal();
            successful += batchResult.getSuccessful();
            failed += batchResult.getFailed();

            if (onProgress != null) {
                long elapsed = elapsedMs(started);
                long remaining = Math.max(0, total - processed);
                long estimatedRemainingMs = processed == 0 ? 0L : Math.round((double) elapsed / processed * remaining);
                onProgress.accept(new ReindexProgress(
                    total, processed, successful, failed, batch + 1, totalBatches, estimatedRemainingMs
                ));
            }
            if (batch < totalBatches - 1) {
                pause(properties.getBatchDelayMs());
            }
        }
        long elapsed = elapsedMs(started);
        logger.info("reindex_finished kind={} tenant_id={} successful={} failed={} took_ms={}",
            kind.key(), tenantId, successful, failed, elapsed);
        return new BatchIndexResult(total, successful, failed, results, elapsed);
    }

    /**
     * Title, description, extracted text and space-joined tags, blank parts skipped, separated
     * by blank lines. Notes contribute their content only.
     */
    static String buildEmbeddingInput(IndexableRecord record) {
        List<String> parts = new ArrayList<>(4);
        addIfPresent(parts, record.title());
        addIfPresent(parts, record.description());
        addIfPresent(parts, record.body());
        if (!record.tags().isEmpty()) {
            addIfPresent(parts, String.join(" ", record.tags()));
        }
        return String.join("\n\n", parts).trim();
    }

    private EmbeddingOutcome generateWithRetry(String text) {
        int attempts = 1 + Math.max(0, properties.getRetryAttempts());
        EmbeddingOutcome outcome = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            outcome = embeddingProvider.generate(text, properties.getModel());
            if (outcome.isGenerated()) {
                return outcome;
            }
            if (attempt < attempts) {
                logger.debug("index_embedding_retry attempt={} reason={}", attempt, outcome.getReason());
                pause(properties.getRetryDelayMs());
            }
        }
        return outcome;
    }

    private IndexStats.Coverage coverage(IndexedKind kind, String tenantId) {
        IndexableStore store = store(kind);
        return IndexStats.Coverage.of(store.countEligible(tenantId), store.countIndexed(tenantId));
    }

    private IndexableStore store(IndexedKind kind) {
        IndexableStore store = stores.get(kind);
        if (store == null) {
            throw new IllegalStateException("no store registered for " + kind.key());
        }
        return store;
    }

    private static BatchIndexResult aggregate(int total, List<IndexResult> results, long elapsedMs) {
        int successful = 0;
        for (IndexResult result : results) {
            if (result.isSuccess()) {
                successful++;
            }
        }
        return new BatchIndexResult(total, successful, results.size() - successful, results, elapsedMs);
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value);
        }
    }

    private static String notFoundMessage(IndexedKind kind) {
        return kind == IndexedKind.NOTES ? "Note not found" : "Document not found";
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("indexing interrupted", e);
        }
    }
}
