package com.rsl.retrieval.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Describes how one record type is queried: the FROM clause, the tenant and owner columns the
 * access predicate binds to, the columns matched against the query text, and optional status
 * and recency columns.
 */
public final class SourceTable {
    private final String select;
    private final String from;
    private final String tenantColumn;
    private final String ownerColumn;
    private final List<String> searchColumns;
    private final String statusColumn;
    private final String recencyColumn;
    private final List<String> fixedConditions;

    private SourceTable(Builder builder) {
        this.select = Objects.requireNonNull(builder.select, "select");
        this.from = Objects.requireNonNull(builder.from, "from");
        this.tenantColumn = Objects.requireNonNull(builder.tenantColumn, "tenantColumn");
        this.ownerColumn = Objects.requireNonNull(builder.ownerColumn, "ownerColumn");
        if (builder.searchColumns.isEmpty()) {
            throw new IllegalArgumentException("at least one search column is required");
        }
        this.searchColumns = List.copyOf(builder.searchColumns);
        this.statusColumn = builder.statusColumn;
        this.recencyColumn = Objects.requireNonNull(builder.recencyColumn, "recencyColumn");
        this.fixedConditions = List.copyOf(builder.fixedConditions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSelect() {
        return select;
    }

    public String getFrom() {
        return from;
    }

    public String getTenantColumn() {
        return tenantColumn;
    }

    public String getOwnerColumn() {
        return ownerColumn;
    }

    public List<String> getSearchColumns() {
        return searchColumns;
    }

    public String getStatusColumn() {
        return statusColumn;
    }

    public String getRecencyColumn() {
        return recencyColumn;
    }

    public List<String> getFixedConditions() {
        return fixedConditions;
    }

    public static final class Builder {
        private String select;
        private String from;
        private String tenantColumn;
        private String ownerColumn;
        private final List<String> searchColumns = new ArrayList<>();
        private String statusColumn;
        private String recencyColumn;
        private final List<String> fixedConditions = new ArrayList<>();

        private Builder() {
        }

        public Builder select(String select) {
            this.select = select;
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder tenantColumn(String tenantColumn) {
            this.tenantColumn = tenantColumn;
            return this;
        }

        public Builder ownerColumn(String ownerColumn) {
            this.ownerColumn = ownerColumn;
            return this;
        }

        public Builder searchColumns(String... columns) {
            this.searchColumns.addAll(List.of(columns));
            return this;
        }

        public Builder statusColumn(String statusColumn) {
            this.statusColumn = statusColumn;
            return this;
        }

        /**
         * Column used for ordering and for date-range filters.
         */
        public Builder recencyColumn(String recencyColumn) {
            this.recencyColumn = recencyColumn;
            return this;
        }

        public Builder condition(String condition) {
            this.fixedConditions.add(condition);
            return this;
        }

        public SourceTable build() {
            return new SourceTable(this);
        }
    }
}
