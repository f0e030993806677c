package com.rsl.retrieval.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rsl.retrieval.access.AccessContext;
import com.rsl.retrieval.access.AccessContextBuilder;
import com.rsl.retrieval.access.AccessFilter;
import com.rsl.retrieval.access.AccessPredicate;
import com.rsl.retrieval.access.AccessProperties;
import com.rsl.retrieval.access.Permission;
import com.rsl.retrieval.access.PermissionAction;
import com.rsl.retrieval.access.ResourceKind;
import com.rsl.retrieval.audit.AuditSink;
import com.rsl.retrieval.relevance.RelevanceEvaluator;
import com.rsl.retrieval.relevance.RelevanceProperties;
import com.rsl.retrieval.source.SourceAdapter;
import com.rsl.retrieval.source.SourceSearchRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TENANT = "tenant-1";
    private static final String USER = "user-1";

    @Mock
    private AccessContextBuilder accessContextBuilder;

    @Mock
    private AuditSink auditSink;

    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void failingSourceIsIsolated() {
        stubContext(Set.of());
        StubAdapter contacts = new StubAdapter(SourceKind.CONTACTS, List.of(
            result("c1", SourceKind.CONTACTS, 0.9),
            result("c2", SourceKind.CONTACTS, 0.8)
        ));
        RetrievalService service = service(List.of(new FailingAdapter(SourceKind.LEADS), contacts));

        SearchResponse response = service.search(query(EnumSet.of(SourceKind.LEADS, SourceKind.CONTACTS)));

        assertEquals(2, response.getTotal());
        assertEquals(List.of("c1", "c2"), ids(response.getResults()));
        assertEquals(1.0, meterRegistry.counter("retrieval.search.source.failures", "source", "leads").count(), 1e-9);
    }

    @Test
    void sourceWithoutAdapterContributesNothing() {
        stubContext(Set.of());
        StubAdapter leads = new StubAdapter(SourceKind.LEADS, List.of(result("l1", SourceKind.LEADS, 0.9)));
        RetrievalService service = service(List.of(leads));

        SearchResponse response = service.search(query(EnumSet.of(SourceKind.LEADS, SourceKind.TICKETS)));

        assertEquals(List.of("l1"), ids(response.getResults()));
        assertEquals(1.0, meterRegistry.counter("retrieval.search.source.failures", "source", "tickets").count(), 1e-9);
    }

    @Test
    void auditFailureDoesNotFailTheSearch() {
        stubContext(Set.of());
        doThrow(new IllegalStateException("audit down"))
            .when(auditSink).record(anyString(), anyString(), anyString(), anyMap());
        RetrievalService service = service(List.of(
            new StubAdapter(SourceKind.LEADS, List.of(result("l1", SourceKind.LEADS, 0.9)))
        ));

        SearchResponse response = service.search(query(EnumSet.of(SourceKind.LEADS)));

        assertEquals(1, response.getTotal());
    }

    @Test
    void auditRecordsQuerySourcesAndCounts() {
        stubContext(Set.of());
        RetrievalService service = service(List.of(
            new StubAdapter(SourceKind.LEADS, List.of(result("l1", SourceKind.LEADS, 0.9))),
            new StubAdapter(SourceKind.ACCOUNTS, List.of(result("a1", SourceKind.ACCOUNTS, 0.1)))
        ));

        service.search(query(EnumSet.of(SourceKind.ACCOUNTS, SourceKind.LEADS)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(auditSink).record(eq(TENANT), eq(USER), eq("READ"), metadata.capture());
        assertEquals("widget", metadata.getValue().get("query"));
        assertEquals(List.of("leads", "accounts"), metadata.getValue().get("sources"));
        assertEquals("hybrid", metadata.getValue().get("searchType"));
        assertEquals(1, metadata.getValue().get("resultCount"));
    }

    @Test
    void paginatesAfterRanking() {
        stubContext(Set.of());
        List<SearchResult> leads = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            leads.add(result("l" + i, SourceKind.LEADS, 0.9 - i * 0.1));
        }
        RetrievalService service = service(List.of(new StubAdapter(SourceKind.LEADS, leads)));
        SearchQuery query = query(EnumSet.of(SourceKind.LEADS));
        query.setLimit(2);
        query.setOffset(2);

        SearchResponse response = service.search(query);

        assertEquals(5, response.getTotal());
        assertEquals(List.of("l2", "l3"), ids(response.getResults()));
    }

    @Test
    void offsetPastTheEndYieldsEmptyPage() {
        stubContext(Set.of());
        RetrievalService service = service(List.of(
            new StubAdapter(SourceKind.LEADS, List.of(result("l1", SourceKind.LEADS, 0.9)))
        ));
        SearchQuery query = query(EnumSet.of(SourceKind.LEADS));
        query.setOffset(10);

        SearchResponse response = service.search(query);

        assertEquals(1, response.getTotal());
        assertTrue(response.getResults().isEmpty());
    }

    @Test
    void metadataIsStrippedWhenNotRequested() {
        stubContext(Set.of());
        SearchResult withMetadata = result("l1", SourceKind.LEADS, 0.9).toBuilder().metadata("status", "NEW").build();
        RetrievalService service = service(List.of(new StubAdapter(SourceKind.LEADS, List.of(withMetadata))));
        SearchQuery query = query(EnumSet.of(SourceKind.LEADS));
        query.setIncludeMetadata(false);

        SearchResponse response = service.search(query);

        assertTrue(response.getResults().get(0).getMetadata().isEmpty());
    }

    @Test
    void predicateFollowsPermissionsPerSource() {
        stubContext(Set.of(Permission.of(ResourceKind.CONTACT, PermissionAction.READ)));
        StubAdapter leads = new StubAdapter(SourceKind.LEADS, List.of());
        StubAdapter contacts = new StubAdapter(SourceKind.CONTACTS, List.of());
        RetrievalService service = service(List.of(leads, contacts));

        service.search(query(EnumSet.of(SourceKind.LEADS, SourceKind.CONTACTS)));

        AccessPredicate leadPredicate = leads.requests.get(0).predicate();
        AccessPredicate contactPredicate = contacts.requests.get(0).predicate();
        assertTrue(leadPredicate.isOwnedOnly());
        assertEquals(USER, leadPredicate.getOwnerId());
        assertFalse(contactPredicate.isOwnedOnly());
    }

    @Test
    void facetsCountSourcesAndRecency() {
        stubContext(Set.of());
        SearchResult recent = result("l1", SourceKind.LEADS, 0.5).toBuilder()
            .updatedAt(NOW.minus(Duration.ofHours(2)))
            .build();
        SearchResult old = result("a1", SourceKind.ACCOUNTS, 0.9).toBuilder()
            .updatedAt(NOW.minus(Duration.ofDays(90)))
            .build();
        RetrievalService service = service(List.of(
            new StubAdapter(SourceKind.LEADS, List.of(recent)),
            new StubAdapter(SourceKind.ACCOUNTS, List.of(old))
        ));

        SearchResponse response = service.search(query(EnumSet.of(SourceKind.LEADS, SourceKind.ACCOUNTS)));

        assertEquals(1, response.getFacets().getSources().get("leads"));
        assertEquals(1, response.getFacets().getSources().get("accounts"));
        assertEquals(1, response.getFacets().getDateRanges().get("last24h"));
        assertEquals(1, response.getFacets().getDateRanges().get("older"));
        assertEquals(1.0, meterRegistry.counter("retrieval.search.total", "mode", "hybrid").count(), 1e-9);
    }

    @Test
    void invalidQueryFailsBeforeAnyIo() {
        StubAdapter leads = new StubAdapter(SourceKind.LEADS, List.of());
        RetrievalService service = service(List.of(leads));
        SearchQuery query = query(EnumSet.of(SourceKind.LEADS));
        query.setQuery("  ");

        assertThrows(InvalidSearchRequestException.class, () -> service.search(query));

        verifyNoInteractions(accessContextBuilder, auditSink);
        assertTrue(leads.requests.isEmpty());
        verify(auditSink, never()).record(any(), any(), any(), any());
    }

    private void stubContext(Set<Permission> permissions) {
        when(accessContextBuilder.build(USER, TENANT))
            .thenReturn(new AccessContext(USER, TENANT, Set.of("SALES_REP"), permissions));
    }

    private RetrievalService service(List<SourceAdapter> adapters) {
        return new RetrievalService(
            new SearchQueryValidator(new SearchProperties()),
            accessContextBuilder,
            new AccessFilter(new AccessProperties(), (manager, tenant, member) -> false),
            adapters,
            new RelevanceEvaluator(new RelevanceProperties()),
            auditSink,
            executor,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static SearchQuery query(Set<SourceKind> sources) {
        SearchQuery query = new SearchQuery();
        query.setTenantId(TENANT);
        query.setUserId(USER);
        query.setQuery("widget");
        query.setSources(new LinkedHashSet<>(sources));
        return query;
    }

    private static SearchResult result(String id, SourceKind source, double score) {
        return SearchResult.builder()
            .id(id)
            .source(source)
            .title("Record " + id)
            .content("")
            .relevanceScore(score)
            .build();
    }

    private static List<String> ids(List<SearchResult> results) {
        return results.stream().map(SearchResult::getId).toList();
    }

    private static final class StubAdapter implements SourceAdapter {
        private final SourceKind kind;
        private final List<SearchResult> results;
        private final List<SourceSearchRequest> requests = new CopyOnWriteArrayList<>();

        private StubAdapter(SourceKind kind, List<SearchResult> results) {
            this.kind = kind;
            this.results = results;
        }

        @Override
        public SourceKind kind() {
            return kind;
        }

        @Override
        public List<SearchResult> search(SourceSearchRequest request) {
            requests.add(request);
            return results;
        }
    }

    private static final class FailingAdapter implements SourceAdapter {
        private final SourceKind kind;

        private FailingAdapter(SourceKind kind) {
            this.kind = kind;
        }

        @Override
        public SourceKind kind() {
            return kind;
        }

        @Override
        public List<SearchResult> search(SourceSearchRequest request) {
            throw new IllegalStateException("connection refused");
        }
    }
}
