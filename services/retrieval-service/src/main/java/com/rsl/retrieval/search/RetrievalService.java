package com.rsl.retrieval.search;

import com.rsl.retrieval.access.AccessContext;
import com.rsl.retrieval.access.AccessContextBuilder;
import com.rsl.retrieval.access.AccessFilter;
import com.rsl.retrieval.access.AccessPredicate;
import com.rsl.retrieval.audit.AuditSink;
import com.rsl.retrieval.relevance.QueryTerms;
import com.rsl.retrieval.relevance.RelevanceEvaluator;
import com.rsl.retrieval.source.SourceAdapter;
import com.rsl.retrieval.source.SourceSearchRequest;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs a permissioned query: validate, resolve access once, fan out to every requested source
 * in parallel, rank the merged results, paginate, compute facets and audit the search.
 */
@Service
public class RetrievalService {
    private static final Logger logger = LoggerFactory.getLogger(RetrievalService.class);

    static final String AUDIT_ACTION = "READ";

    private final SearchQueryValidator validator;
    private final AccessContextBuilder accessContextBuilder;
    private final AccessFilter accessFilter;
    private final Map<SourceKind, SourceAdapter> adapters;
    private final RelevanceEvaluator relevanceEvaluator;
    private final AuditSink auditSink;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RetrievalService(
        SearchQueryValidator validator,
        AccessContextBuilder accessContextBuilder,
        AccessFilter accessFilter,
        List<SourceAdapter> adapters,
        RelevanceEvaluator relevanceEvaluator,
        AuditSink auditSink,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.validator = validator;
        this.accessContextBuilder = accessContextBuilder;
        this.accessFilter = accessFilter;
        this.adapters = new EnumMap<>(SourceKind.class);
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("duplicate source adapter for " + adapter.kind().key());
            }
        }
        this.relevanceEvaluator = relevanceEvaluator;
        this.auditSink = auditSink;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public SearchResponse search(SearchQuery request) {
        long started = System.nanoTime();
        SearchQuery query = validator.validate(request);
        AccessContext context = accessContextBuilder.build(query.getUserId(), query.getTenantId());

        List<SourceKind> sources = new ArrayList<>(EnumSet.copyOf(query.getSources()));
        Map<SourceKind, CompletableFuture<SourceSearchOutcome>> futures = new LinkedHashMap<>();
        for (SourceKind source : sources) {
            futures.put(source, CompletableFuture.supplyAsync(() -> searchSource(source, query, context), searchExecutor));
        }

        List<SearchResult> merged = new ArrayList<>();
        for (Map.Entry<SourceKind, CompletableFuture<SourceSearchOutcome>> entry : futures.entrySet()) {
            SourceSearchOutcome outcome = awaitSource(entry.getKey(), entry.getValue());
            if (outcome.isFailed()) {
                meterRegistry.counter("retrieval.search.source.failures", "source", entry.getKey().key()).increment();
                logger.warn(
                    "search_source_failed source={} tenant_id={} reason={}",
                    entry.getKey().key(),
                    query.getTenantId(),
                    outcome.getErrorMessage()
                );
                continue;
            }
            merged.addAll(outcome.getResults());
        }

        Instant now = clock.instant();
        List<SearchResult> ranked = relevanceEvaluator.filterAndRank(
            merged,
            QueryTerms.forRanking(query.getQuery()),
            now,
            query.getMinRelevanceScore()
        );

        int from = Math.min(query.getOffset(), ranked.size());
        int to = Math.min(from + query.getLimit(), ranked.size());
        List<SearchResult> page = new ArrayList<>(ranked.subList(from, to));
        if (!Boolean.TRUE.equals(query.getIncludeMetadata())) {
            page.replaceAll(SearchResult::withoutMetadata);
        }

        SearchResponse.Facets facets = FacetBuilder.build(ranked, now);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        audit(query, sources, ranked.size(), elapsedMs);
        meterRegistry.counter("retrieval.search.total", "mode", query.getSearchMode().key()).increment();

        SearchResponse response = new SearchResponse();
        response.setResults(page);
        response.setTotal(ranked.size());
        response.setQuery(query.getQuery());
        response.setSearchMode(query.getSearchMode());
        response.setElapsedMs((System.nanoTime() - started) / 1_000_000L);
        response.setFacets(facets);
        return response;
    }

    private SourceSearchOutcome searchSource(SourceKind source, SearchQuery query, AccessContext context) {
        SourceAdapter adapter = adapters.get(source);
        if (adapter == null) {
            return SourceSearchOutcome.unsupported(source);
        }
        long started = System.nanoTime();
        try {
            AccessPredicate predicate = accessFilter.buildAccessPredicate(context, source.resource());
            List<SearchResult> results = adapter.search(new SourceSearchRequest(query, context, predicate));
            return SourceSearchOutcome.success(source, results, (System.nanoTime() - started) / 1_000_000L);
        } catch (RuntimeException e) {
            logger.debug("search_source_exception source={}", source.key(), e);
            return SourceSearchOutcome.error(source, e.getMessage(), (System.nanoTime() - started) / 1_000_000L);
        }
    }

    private SourceSearchOutcome awaitSource(SourceKind source, CompletableFuture<SourceSearchOutcome> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return SourceSearchOutcome.error(source, cause.getMessage(), 0L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SourceSearchOutcome.error(source, "interrupted", 0L);
        }
    }

    private void audit(SearchQuery query, List<SourceKind> sources, int resultCount, long elapsedMs) {
        List<String> sourceKeys = new ArrayList<>(sources.size());
        for (SourceKind source : sources) {
            sourceKeys.add(source.key());
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("query", query.getQuery());
        metadata.put("sources", sourceKeys);
        metadata.put("searchType", query.getSearchMode().key());
        metadata.put("resultCount", resultCount);
        metadata.put("executionTimeMs", elapsedMs);
        try {
            auditSink.record(query.getTenantId(), query.getUserId(), AUDIT_ACTION, metadata);
        } catch (RuntimeException e) {
            logger.warn("search_audit_failed tenant_id={} user_id={} reason={}",
                query.getTenantId(), query.getUserId(), e.getMessage());
        }
    }
}
