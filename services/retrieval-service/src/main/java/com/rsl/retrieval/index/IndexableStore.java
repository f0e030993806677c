package com.rsl.retrieval.index;

import com.rsl.retrieval.embed.EmbeddingVector;
import java.util.List;
import java.util.Optional;

/**
 * Storage side of the embedding pipeline for one record type. A null tenant means all tenants.
 */
public interface IndexableStore {
    IndexedKind kind();

    Optional<IndexableRecord> findIndexable(String id);

    void saveEmbedding(String id, EmbeddingVector vector);

    long countEligible(String tenantId);

    /**
     * Eligible ids ordered by creation time, oldest first.
     */
    List<String> findEligibleIds(String tenantId, int offset, int limit);

    List<String> findUnindexedIds(String tenantId, int limit);

    long countIndexed(String tenantId);
}
