package com.rsl.retrieval.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SearchQueryValidatorTest {
    private final SearchQueryValidator validator = new SearchQueryValidator(new SearchProperties());

    @Test
    void fillsDefaults() {
        SearchQuery query = validator.validate(minimal());

        assertEquals(20, query.getLimit());
        assertEquals(0, query.getOffset());
        assertEquals(0.3, query.getMinRelevanceScore(), 1e-9);
        assertEquals(0.7, query.getSemanticThreshold(), 1e-9);
        assertEquals(SearchMode.HYBRID, query.getSearchMode());
        assertTrue(query.getIncludeMetadata());
        assertEquals(
            Set.of(SourceKind.LEADS, SourceKind.CONTACTS, SourceKind.ACCOUNTS, SourceKind.OPPORTUNITIES,
                SourceKind.DOCUMENTS),
            query.getSources()
        );
        assertTrue(query.getUserRoles().isEmpty());
    }

    @Test
    void requiresTenantUserAndQueryText() {
        SearchQuery noTenant = minimal();
        noTenant.setTenantId(null);
        SearchQuery noUser = minimal();
        noUser.setUserId(" ");
        SearchQuery noText = minimal();
        noText.setQuery("");

        assertEquals("tenant_id is required", rejected(noTenant).getMessage());
        assertEquals("user_id is required", rejected(noUser).getMessage());
        assertEquals("query text is required", rejected(noText).getMessage());
        assertEquals("request body is required",
            assertThrows(InvalidSearchRequestException.class, () -> validator.validate(null)).getMessage());
    }

    @Test
    void rejectsNullSource() {
        SearchQuery query = minimal();
        Set<SourceKind> sources = new HashSet<>();
        sources.add(SourceKind.LEADS);
        sources.add(null);
        query.setSources(sources);

        assertEquals("sources must not contain null", rejected(query).getMessage());
    }

    @Test
    void rejectsOverlongQuery() {
        SearchQuery query = minimal();
        query.setQuery("q".repeat(1001));

        rejected(query);

        query.setQuery("q".repeat(1000));
        assertEquals(1000, validator.validate(query).getQuery().length());
    }

    @Test
    void rejectsOutOfRangePaging() {
        SearchQuery zeroLimit = minimal();
        zeroLimit.setLimit(0);
        SearchQuery bigLimit = minimal();
        bigLimit.setLimit(101);
        SearchQuery negativeOffset = minimal();
        negativeOffset.setOffset(-1);
        SearchQuery deepWindow = minimal();
        deepWindow.setOffset(9_990);
        deepWindow.setLimit(20);

        rejected(zeroLimit);
        rejected(bigLimit);
        rejected(negativeOffset);
        rejected(deepWindow);
    }

    @Test
    void rejectsScoresOutsideUnitInterval() {
        SearchQuery minScore = minimal();
        minScore.setMinRelevanceScore(1.5);
        SearchQuery threshold = minimal();
        threshold.setSemanticThreshold(-0.1);

        rejected(minScore);
        rejected(threshold);
    }

    @Test
    void caseIdMustBeUuid() {
        SearchQuery query = minimal();
        query.setCaseId("case-1");

        assertEquals("case_id must be a UUID", rejected(query).getMessage());

        query.setCaseId("3f2b8c1e-9d4a-4f6b-8a2e-1c5d7e9f0a3b");
        assertEquals("3f2b8c1e-9d4a-4f6b-8a2e-1c5d7e9f0a3b", validator.validate(query).getCaseId());
    }

    private InvalidSearchRequestException rejected(SearchQuery query) {
        return assertThrows(InvalidSearchRequestException.class, () -> validator.validate(query));
    }

    private static SearchQuery minimal() {
        SearchQuery query = new SearchQuery();
        query.setTenantId("tenant-1");
        query.setUserId("user-1");
        query.setQuery("acme renewal");
        return query;
    }
}
