package com.rsl.retrieval.document;

import com.rsl.retrieval.access.AccessContext;
import com.rsl.retrieval.access.AccessFilter;
import com.rsl.retrieval.embed.EmbeddingOutcome;
import com.rsl.retrieval.embed.EmbeddingProvider;
import com.rsl.retrieval.relevance.RelevanceProperties;
import com.rsl.retrieval.relevance.SnippetBuilder;
import com.rsl.retrieval.repository.DocumentRepository;
import com.rsl.retrieval.search.SearchFilters;
import com.rsl.retrieval.search.SearchProperties;
import com.rsl.retrieval.search.SearchQuery;
import com.rsl.retrieval.search.SearchResult;
import com.rsl.retrieval.search.SourceKind;
import com.rsl.retrieval.source.SourceAdapter;
import com.rsl.retrieval.source.SourceSearchRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Document source: ranked full-text, vector similarity, or both fused with weighted RRF.
 * Candidates are re-read with their ACL and filtered per user; a leg may return fewer than
 * {@code limit} hits.
 */
@Component
public class DocumentHybridSearch implements SourceAdapter {
    private static final Logger logger = LoggerFactory.getLogger(DocumentHybridSearch.class);

    private final DocumentRepository documentRepository;
    private final EmbeddingProvider embeddingProvider;
    private final AccessFilter accessFilter;
    private final RelevanceProperties relevanceProperties;
    private final SearchProperties searchProperties;
    private final ExecutorService legExecutor;
    private final Counter semanticFallbacks;

    public DocumentHybridSearch(
        DocumentRepository documentRepository,
        EmbeddingProvider embeddingProvider,
        AccessFilter accessFilter,
        RelevanceProperties relevanceProperties,
        SearchProperties searchProperties,
        @Qualifier("documentLegExecutor") ExecutorService legExecutor,
        MeterRegistry meterRegistry
    ) {
        this.documentRepository = documentRepository;
        this.embeddingProvider = embeddingProvider;
        this.accessFilter = accessFilter;
        this.relevanceProperties = relevanceProperties;
        this.searchProperties = searchProperties;
        this.legExecutor = legExecutor;
        this.semanticFallbacks = meterRegistry.counter("retrieval.document.semantic.fallback");
    }

    @Override
    public SourceKind kind() {
        return SourceKind.DOCUMENTS;
    }

    @Override
    public List<SearchResult> search(SourceSearchRequest request) {
        return switch (request.query().getSearchMode()) {
            case FULLTEXT -> fullText(request.query(), request.accessContext());
            case SEMANTIC -> semantic(request.query(), request.accessContext());
            case HYBRID -> hybrid(request.query(), request.accessContext());
        };
    }

    public List<SearchResult> fullText(SearchQuery query, AccessContext context) {
        List<DocumentFtsHit> hits = documentRepository.fullTextSearch(
            context.getTenantId(),
            query.getQuery(),
            query.getCaseId(),
            query.getLimit()
        );
        if (hits.isEmpty()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>(hits.size());
        for (DocumentFtsHit hit : hits) {
            ids.add(hit.id());
        }
        Map<String, CaseDocument> visible = visibleDocuments(context, ids, query.getFilters());

        List<SearchResult> results = new ArrayList<>(visible.size());
        for (DocumentFtsHit hit : hits) {
            CaseDocument document = visible.get(hit.id());
            if (document == null) {
                continue;
            }
            String snippet = hit.snippet() != null && !hit.snippet().isEmpty()
                ? hit.snippet()
                : SnippetBuilder.build(joinedText(document), "");
            results.add(toResult(document, hit.rank(), snippet).lexicalScore(hit.rank()).build());
        }
        return results;
    }

    /**
     * Falls back to {@link #fullText} when no query embedding can be produced.
     */
    public List<SearchResult> semantic(SearchQuery query, AccessContext context) {
        EmbeddingOutcome outcome = embeddingProvider.generate(query.getQuery());
        if (!outcome.isGenerated()) {
            semanticFallbacks.increment();
            logger.warn("document_semantic_fallback tenant_id={} reason={}", context.getTenantId(), outcome.getReason());
            return fullText(query, context);
        }
        List<DocumentVectorHit> hits = documentRepository.vectorSearch(
            context.getTenantId(),
            outcome.getVector(),
            query.getSemanticThreshold(),
            query.getCaseId(),
            query.getLimit()
        );
        if (hits.isEmpty()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>(hits.size());
        for (DocumentVectorHit hit : hits) {
            ids.add(hit.id());
        }
        Map<String, CaseDocument> visible = visibleDocuments(context, ids, query.getFilters());

        List<SearchResult> results = new ArrayList<>(visible.size());
        for (DocumentVectorHit hit : hits) {
            CaseDocument document = visible.get(hit.id());
            if (document == null) {
                continue;
            }
            results.add(toResult(document, hit.similarity(), SnippetBuilder.build(joinedText(document), ""))
                .semanticScore(hit.similarity())
                .metadata("searchType", "semantic")
                .build());
        }
        return results;
    }

    public List<SearchResult> hybrid(SearchQuery query, AccessContext context) {
        CompletableFuture<List<SearchResult>> semanticFuture =
            CompletableFuture.supplyAsync(() -> semantic(query, context), legExecutor);
        List<SearchResult> lexical = fullText(query, context);
        List<SearchResult> semantic = awaitLeg(semanticFuture);

        Map<String, SearchResult> byId = new HashMap<>();
        List<String> lexicalIds = new ArrayList<>(lexical.size());
        for (SearchResult result : lexical) {
            lexicalIds.add(result.getId());
            byId.putIfAbsent(result.getId(), result);
        }
        List<String> semanticIds = new ArrayList<>(semantic.size());
        for (SearchResult result : semantic) {
            semanticIds.add(result.getId());
            byId.merge(result.getId(), result, (lexicalHit, semanticHit) ->
                lexicalHit.toBuilder().semanticScore(semanticHit.getSemanticScore()).build());
        }

        List<RrfFusion.Candidate> fused = RrfFusion.fuse(
            lexicalIds,
            semanticIds,
            searchProperties.getRrfK(),
            relevanceProperties.getFullTextWeight(),
            relevanceProperties.getSemanticWeight()
        );
        int limit = query.getLimit();
        List<SearchResult> results = new ArrayList<>(Math.min(limit, fused.size()));
        for (RrfFusion.Candidate candidate : fused) {
            if (results.size() >= limit) {
                break;
            }
            results.add(byId.get(candidate.getDocId()).withRelevanceScore(candidate.getDisplayScore()));
        }
        return results;
    }

    private List<SearchResult> awaitLeg(CompletableFuture<List<SearchResult>> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("document semantic leg failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for semantic leg", e);
        }
    }

    private Map<String, CaseDocument> visibleDocuments(AccessContext context, List<String> ids, SearchFilters filters) {
        Map<String, CaseDocument> visible = new LinkedHashMap<>();
        for (CaseDocument document : documentRepository.findWithAcl(context.getTenantId(), ids)) {
            if (!accessFilter.canViewDocument(context, document.createdBy(), document.acl())) {
                continue;
            }
            if (!matchesFilters(document, filters)) {
                continue;
            }
            visible.put(document.id(), document);
        }
        return visible;
    }

    private boolean matchesFilters(CaseDocument document, SearchFilters filters) {
        if (filters == null) {
            return true;
        }
        if (filters.getDocumentTypes() != null && !filters.getDocumentTypes().isEmpty()
            && !filters.getDocumentTypes().contains(document.documentType())) {
            return false;
        }
        if (filters.getClassification() != null && !filters.getClassification().isEmpty()
            && !filters.getClassification().contains(document.classification())) {
            return false;
        }
        if (filters.getTags() != null && !filters.getTags().isEmpty()
            && Collections.disjoint(filters.getTags(), document.tags())) {
            return false;
        }
        return true;
    }

    private SearchResult.Builder toResult(CaseDocument document, double score, String snippet) {
        return SearchResult.builder()
            .id(document.id())
            .source(SourceKind.DOCUMENTS)
            .title(document.title())
            .content(document.description() == null ? "" : document.description())
            .snippet(snippet)
            .relevanceScore(score)
            .metadata("documentType", document.documentType())
            .metadata("classification", document.classification())
            .metadata("status", document.status())
            .metadata("version", document.version())
            .metadata("caseId", document.caseId())
            .acl(new SearchResult.Acl(
                AccessFilter.viewableBy(document.acl()),
                AccessFilter.editableBy(document.acl())
            ))
            .createdAt(document.createdAt())
            .updatedAt(document.updatedAt());
    }

    private static String joinedText(CaseDocument document) {
        String title = document.title() == null ? "" : document.title();
        String description = document.description() == null ? "" : document.description();
        return title + " " + description;
    }
}
