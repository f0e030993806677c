package com.rsl.retrieval.source;

import com.rsl.retrieval.search.SearchResult;
import com.rsl.retrieval.search.SourceKind;
import java.util.List;

/**
 * Searches one record type. Implementations apply the access predicate themselves and may
 * throw; the orchestrator isolates failures per source.
 */
public interface SourceAdapter {
    SourceKind kind();

    List<SearchResult> search(SourceSearchRequest request);
}
