package com.rsl.retrieval.source;

import com.rsl.retrieval.access.AccessContext;
import com.rsl.retrieval.access.AccessPredicate;
import com.rsl.retrieval.search.SearchQuery;

public record SourceSearchRequest(SearchQuery query, AccessContext accessContext, AccessPredicate predicate) {
}
