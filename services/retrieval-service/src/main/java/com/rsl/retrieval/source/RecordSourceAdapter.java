package com.rsl.retrieval.source;

import com.rsl.retrieval.relevance.LexicalScorer;
import com.rsl.retrieval.relevance.SnippetBuilder;
import com.rsl.retrieval.repository.RecordSearchRepository;
import com.rsl.retrieval.repository.SourceTable;
import com.rsl.retrieval.search.SearchProperties;
import com.rsl.retrieval.search.SearchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base for adapters backed by a single table: runs the predicate-filtered substring query and
 * maps each row to a lexically scored result.
 */
public abstract class RecordSourceAdapter implements SourceAdapter {
    private final RecordSearchRepository repository;
    private final SearchProperties properties;

    protected RecordSourceAdapter(RecordSearchRepository repository, SearchProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    protected abstract SourceTable table();

    protected abstract SearchResult toResult(Map<String, Object> row, String query);

    @Override
    public List<SearchResult> search(SourceSearchRequest request) {
        String text = request.query().getQuery();
        List<Map<String, Object>> rows = repository.search(
            table(),
            request.predicate(),
            text,
            request.query().getFilters(),
            properties.getPreFilterLimit()
        );
        List<SearchResult> results = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            results.add(toResult(row, text));
        }
        return results;
    }

    protected SearchResult.Builder scored(String query, String scoringText, String snippetText) {
        double score = LexicalScorer.score(query, scoringText);
        return SearchResult.builder()
            .source(kind())
            .relevanceScore(score)
            .lexicalScore(score)
            .snippet(SnippetBuilder.build(snippetText, query));
    }

    protected static String joined(String... parts) {
        StringBuilder builder = new StringBuilder();
        for (String part : parts) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(part == null ? "" : part);
        }
        return builder.toString();
    }

    protected static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
