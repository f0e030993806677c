package com.rsl.retrieval.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchFilters {
    @JsonProperty("date_range")
    private DateRange dateRange;

    private List<String> status;

    private String owner;

    private List<String> tags;

    private List<String> classification;

    @JsonProperty("document_types")
    private List<String> documentTypes;

    public DateRange getDateRange() {
        return dateRange;
    }

    public void setDateRange(DateRange dateRange) {
        this.dateRange = dateRange;
    }

    public List<String> getStatus() {
        return status;
    }

    public void setStatus(List<String> status) {
        this.status = status;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public List<String> getClassification() {
        return classification;
    }

    public void setClassification(List<String> classification) {
        this.classification = classification;
    }

    public List<String> getDocumentTypes() {
        return documentTypes;
    }

    public void setDocumentTypes(List<String> documentTypes) {
        this.documentTypes = documentTypes;
    }

    public boolean hasStatus() {
        return status != null && !status.isEmpty();
    }

    public boolean hasOwner() {
        return owner != null && !owner.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DateRange {
        private Instant start;
        private Instant end;

        public DateRange() {
        }

        public DateRange(Instant start, Instant end) {
            this.start = start;
            this.end = end;
        }

        public Instant getStart() {
            return start;
        }

        public void setStart(Instant start) {
            this.start = start;
        }

        public Instant getEnd() {
            return end;
        }

        public void setEnd(Instant end) {
            this.end = end;
        }
    }
}
