package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ReindexJobRequest {
    @JsonProperty("index_type")
    private IndexType indexType;

    @JsonProperty("tenant_id")
    private String tenantId;

    @JsonProperty("document_ids")
    private List<String> documentIds;

    @JsonProperty("note_ids")
    private List<String> noteIds;

    @JsonProperty("batch_size")
    private Integer batchSize;

    @JsonProperty("force_regenerate")
    private Boolean forceRegenerate;

    @JsonProperty("requested_by")
    private String requestedBy;

    private String reason;

    public IndexType getIndexType() {
        return indexType;
    }

    public void setIndexType(IndexType indexType) {
        this.indexType = indexType;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public List<String> getDocumentIds() {
        return documentIds;
    }

    public void setDocumentIds(List<String> documentIds) {
        this.documentIds = documentIds;
    }

    public List<String> getNoteIds() {
        return noteIds;
    }

    public void setNoteIds(List<String> noteIds) {
        this.noteIds = noteIds;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
    }

    public Boolean getForceRegenerate() {
        return forceRegenerate;
    }

    public void setForceRegenerate(Boolean forceRegenerate) {
        this.forceRegenerate = forceRegenerate;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public void setRequestedBy(String requestedBy) {
        this.requestedBy = requestedBy;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
