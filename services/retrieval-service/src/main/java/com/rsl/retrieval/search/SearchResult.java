package com.rsl.retrieval.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One ranked hit. Instances are immutable; rescoring produces a copy.
 */
public final class SearchResult {
    private final String id;
    private final SourceKind source;
    private final String title;
    private final String content;
    private final String snippet;
    private final double relevanceScore;
    private final Double lexicalScore;
    private final Double semanticScore;
    private final Map<String, Object> metadata;
    private final Acl acl;
    private final Instant createdAt;
    private final Instant updatedAt;

    private SearchResult(Builder builder) {
        this.id = builder.id;
        this.source = builder.source;
        this.title = builder.title == null ? "" : builder.title;
        this.content = builder.content == null ? "" : builder.content;
        this.snippet = builder.snippet == null ? "" : builder.snippet;
        this.relevanceScore = builder.relevanceScore;
        this.lexicalScore = builder.lexicalScore;
        this.semanticScore = builder.semanticScore;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.acl = builder.acl == null ? new Acl(List.of(), List.of()) : builder.acl;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .id(id)
            .source(source)
            .title(title)
            .content(content)
            .snippet(snippet)
            .relevanceScore(relevanceScore)
            .lexicalScore(lexicalScore)
            .semanticScore(semanticScore)
            .acl(acl)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
        builder.metadata.putAll(metadata);
        return builder;
    }

    public SearchResult withRelevanceScore(double score) {
        return toBuilder().relevanceScore(score).build();
    }

    public SearchResult withoutMetadata() {
        Builder builder = toBuilder();
        builder.metadata.clear();
        return builder.build();
    }

    public String getId() {
        return id;
    }

    public SourceKind getSource() {
        return source;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public String getSnippet() {
        return snippet;
    }

    @JsonProperty("relevance_score")
    public double getRelevanceScore() {
        return relevanceScore;
    }

    @JsonIgnore
    public Double getLexicalScore() {
        return lexicalScore;
    }

    @JsonIgnore
    public Double getSemanticScore() {
        return semanticScore;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Acl getAcl() {
        return acl;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public record Acl(
        @JsonProperty("viewable_by") List<String> viewableBy,
        @JsonProperty("editable_by") List<String> editableBy
    ) {
        public Acl {
            viewableBy = viewableBy == null ? List.of() : List.copyOf(viewableBy);
            editableBy = editableBy == null ? List.of() : List.copyOf(editableBy);
        }

        public static Acl owner(String ownerId) {
            return ownerId == null ? new Acl(List.of(), List.of()) : new Acl(List.of(ownerId), List.of(ownerId));
        }
    }

    public static final class Builder {
        private String id;
        private SourceKind source;
        private String title;
        private String content;
        private String snippet;
        private double relevanceScore;
        private Double lexicalScore;
        private Double semanticScore;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Acl acl;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(SourceKind source) {
            this.source = source;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder snippet(String snippet) {
            this.snippet = snippet;
            return this;
        }

        public Builder relevanceScore(double relevanceScore) {
            this.relevanceScore = relevanceScore;
            return this;
        }

        public Builder lexicalScore(Double lexicalScore) {
            this.lexicalScore = lexicalScore;
            return this;
        }

        public Builder semanticScore(Double semanticScore) {
            this.semanticScore = semanticScore;
            return this;
        }

        /**
         * Null values are skipped.
         */
        public Builder metadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder acl(Acl acl) {
            this.acl = acl;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public SearchResult build() {
            return new SearchResult(this);
        }
    }
}
