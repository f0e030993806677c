package com.rsl.retrieval.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rsl.retrieval.access.AccessContext;
import com.rsl.retrieval.access.AccessFilter;
import com.rsl.retrieval.access.AccessLevel;
import com.rsl.retrieval.access.AccessPredicate;
import com.rsl.retrieval.access.AccessProperties;
import com.rsl.retrieval.access.DocumentAclEntry;
import com.rsl.retrieval.access.PrincipalType;
import com.rsl.retrieval.embed.EmbeddingOutcome;
import com.rsl.retrieval.embed.EmbeddingProvider;
import com.rsl.retrieval.embed.EmbeddingVector;
import com.rsl.retrieval.relevance.RelevanceProperties;
import com.rsl.retrieval.repository.DocumentRepository;
import com.rsl.retrieval.search.SearchFilters;
import com.rsl.retrieval.search.SearchMode;
import com.rsl.retrieval.search.SearchProperties;
import com.rsl.retrieval.search.SearchQuery;
import com.rsl.retrieval.search.SearchResult;
import com.rsl.retrieval.source.SourceSearchRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentHybridSearchTest {
    private static final String TENANT = "tenant-1";
    private static final String USER = "user-1";

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private EmbeddingProvider embeddingProvider;

    private final Map<String, CaseDocument> documents = new HashMap<>();
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private DocumentHybridSearch search;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newSingleThreadExecutor();
        search = new DocumentHybridSearch(
            documentRepository,
            embeddingProvider,
            new AccessFilter(new AccessProperties(), (manager, tenant, member) -> false),
            new RelevanceProperties(),
            new SearchProperties(),
            executor,
            meterRegistry
        );
        documents.put("a", document("a", "Master services agreement", USER, "CONTRACT", List.of()));
        documents.put("b", document("b", "Board minutes", USER, "MINUTES", List.of(), List.of("board", "q1")));
        documents.put("c", document("c", "Contract addendum", "someone-else", "CONTRACT",
            List.of(new DocumentAclEntry(PrincipalType.USER, USER, AccessLevel.VIEW))));
        documents.put("hidden", document("hidden", "Private memo", "someone-else", "MEMO", List.of()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void fullTextKeepsHitOrderAndDropsInvisibleDocuments() {
        stubAclLookup();
        when(documentRepository.fullTextSearch(TENANT, "contract", null, 20)).thenReturn(List.of(
            new DocumentFtsHit("hidden", "Private memo", null, 0.9, "memo"),
            new DocumentFtsHit("c", "Contract addendum", null, 0.7, "<b>Contract</b> addendum"),
            new DocumentFtsHit("a", "Master services agreement", null, 0.4, null)
        ));

        List<SearchResult> results = search.search(request(SearchMode.FULLTEXT, null));

        assertEquals(List.of("c", "a"), ids(results));
        assertEquals("<b>Contract</b> addendum", results.get(0).getSnippet());
        assertEquals(0.7, results.get(0).getRelevanceScore(), 1e-9);
        assertEquals(0.7, results.get(0).getLexicalScore(), 1e-9);
        assertNull(results.get(0).getSemanticScore());
        assertEquals(List.of(USER), results.get(0).getAcl().viewableBy());
        assertEquals("1.0.0", results.get(1).getMetadata().get("version"));
        assertTrue(results.get(1).getSnippet().startsWith("Master services agreement"));
    }

    @Test
    void documentTypeFilterIsApplied() {
        stubAclLookup();
        when(documentRepository.fullTextSearch(TENANT, "contract", null, 20)).thenReturn(List.of(
            new DocumentFtsHit("a", "Master services agreement", null, 0.5, null),
            new DocumentFtsHit("b", "Board minutes", null, 0.4, null)
        ));
        SearchFilters filters = new SearchFilters();
        filters.setDocumentTypes(List.of("MINUTES"));

        List<SearchResult> results = search.search(request(SearchMode.FULLTEXT, filters));

        assertEquals(List.of("b"), ids(results));
    }

    @Test
    void tagFilterDropsDocumentsWithoutOverlap() {
        stubAclLookup();
        when(documentRepository.fullTextSearch(TENANT, "contract", null, 20)).thenReturn(List.of(
            new DocumentFtsHit("a", "Master services agreement", null, 0.5, null),
            new DocumentFtsHit("b", "Board minutes", null, 0.4, null)
        ));
        SearchFilters unknownTag = new SearchFilters();
        unknownTag.setTags(List.of("nonexistent-tag"));
        SearchFilters boardTag = new SearchFilters();
        boardTag.setTags(List.of("board", "legal"));

        assertEquals(List.of(), ids(search.search(request(SearchMode.FULLTEXT, unknownTag))));
        assertEquals(List.of("b"), ids(search.search(request(SearchMode.FULLTEXT, boardTag))));
    }

    @Test
    void semanticFallsBackToFullTextWhenEmbeddingFails() {
        stubAclLookup();
        when(embeddingProvider.generate("contract")).thenReturn(EmbeddingOutcome.transientFailure("embed_timeout"));
        when(documentRepository.fullTextSearch(TENANT, "contract", null, 20)).thenReturn(List.of(
            new DocumentFtsHit("a", "Master services agreement", null, 0.5, null)
        ));

        List<SearchResult> results = search.search(request(SearchMode.SEMANTIC, null));

        assertEquals(List.of("a"), ids(results));
        assertEquals(1.0, meterRegistry.counter("retrieval.document.semantic.fallback").count(), 1e-9);
        verify(documentRepository, never()).vectorSearch(any(), any(), anyDouble(), any(), anyInt());
    }

    @Test
    void semanticResultsCarrySimilarityAndSearchType() {
        stubAclLookup();
        EmbeddingVector vector = new EmbeddingVector(new float[] {0.1f, 0.2f}, "test-model");
        when(embeddingProvider.generate("contract")).thenReturn(EmbeddingOutcome.generated(vector));
        when(documentRepository.vectorSearch(eq(TENANT), eq(vector), eq(0.7), isNull(), eq(20))).thenReturn(List.of(
            new DocumentVectorHit("c", "Contract addendum", null, 0.91)
        ));

        List<SearchResult> results = search.search(request(SearchMode.SEMANTIC, null));

        assertEquals(List.of("c"), ids(results));
        assertEquals(0.91, results.get(0).getRelevanceScore(), 1e-9);
        assertEquals(0.91, results.get(0).getSemanticScore(), 1e-9);
        assertEquals("semantic", results.get(0).getMetadata().get("searchType"));
    }

    @Test
    void hybridFusesBothLegsWithWeightedRrf() {
        stubAclLookup();
        EmbeddingVector vector = new EmbeddingVector(new float[] {0.3f}, "test-model");
        when(embeddingProvider.generate("contract")).thenReturn(EmbeddingOutcome.generated(vector));
        when(documentRepository.fullTextSearch(TENANT, "contract", null, 20)).thenReturn(List.of(
            new DocumentFtsHit("a", "Master services agreement", null, 0.5, null),
            new DocumentFtsHit("b", "Board minutes", null, 0.4, null)
        ));
        when(documentRepository.vectorSearch(eq(TENANT), eq(vector), eq(0.7), isNull(), eq(20))).thenReturn(List.of(
            new DocumentVectorHit("c", "Contract addendum", null, 0.9),
            new DocumentVectorHit("a", "Master services agreement", null, 0.8)
        ));

        List<SearchResult> results = search.search(request(SearchMode.HYBRID, null));

        assertEquals(List.of("a", "c", "b"), ids(results));
        double expected = (0.4 / 61.0 + 0.6 / 62.0) * 10.0;
        assertEquals(expected, results.get(0).getRelevanceScore(), 1e-9);
        assertEquals(0.5, results.get(0).getLexicalScore(), 1e-9);
        assertEquals(0.8, results.get(0).getSemanticScore(), 1e-9);
        assertNull(results.get(1).getLexicalScore());
        assertEquals(0.9, results.get(1).getSemanticScore(), 1e-9);
        assertEquals(0.4, results.get(2).getLexicalScore(), 1e-9);
        assertNull(results.get(2).getSemanticScore());
    }

    @Test
    void hybridStillReturnsLexicalHitsWhenEmbeddingFails() {
        stubAclLookup();
        when(embeddingProvider.generate("contract")).thenReturn(EmbeddingOutcome.transientFailure("embed_circuit_open"));
        when(documentRepository.fullTextSearch(TENANT, "contract", null, 20)).thenReturn(List.of(
            new DocumentFtsHit("a", "Master services agreement", null, 0.5, null)
        ));

        List<SearchResult> results = search.search(request(SearchMode.HYBRID, null));

        assertEquals(List.of("a"), ids(results));
    }

    private void stubAclLookup() {
        when(documentRepository.findWithAcl(eq(TENANT), anyList())).thenAnswer(invocation -> {
            List<String> requested = invocation.getArgument(1);
            List<CaseDocument> found = new ArrayList<>();
            for (String id : requested) {
                if (documents.containsKey(id)) {
                    found.add(documents.get(id));
                }
            }
            return found;
        });
    }

    private static SourceSearchRequest request(SearchMode mode, SearchFilters filters) {
        SearchQuery query = new SearchQuery();
        query.setTenantId(TENANT);
        query.setUserId(USER);
        query.setQuery("contract");
        query.setSearchMode(mode);
        query.setLimit(20);
        query.setOffset(0);
        query.setSemanticThreshold(0.7);
        query.setFilters(filters == null ? new SearchFilters() : filters);
        AccessContext context = new AccessContext(USER, TENANT, Set.of("SALES_REP"), Set.of());
        return new SourceSearchRequest(query, context, AccessPredicate.ownedBy(TENANT, USER));
    }

    private static CaseDocument document(
        String id,
        String title,
        String createdBy,
        String documentType,
        List<DocumentAclEntry> acl
    ) {
        return document(id, title, createdBy, documentType, acl, null);
    }

    private static CaseDocument document(
        String id,
        String title,
        String createdBy,
        String documentType,
        List<DocumentAclEntry> acl,
        List<String> tags
    ) {
        Instant created = Instant.parse("2026-01-10T09:00:00Z");
        return new CaseDocument(id, title, "Description of " + title, documentType, "INTERNAL", "ACTIVE",
            1, 0, 0, "case-1", createdBy, created, created, tags, acl);
    }

    private static List<String> ids(List<SearchResult> results) {
        return results.stream().map(SearchResult::getId).toList();
    }
}
