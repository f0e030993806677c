package com.rsl.retrieval.api;

import java.util.List;

public class IndexBatchRequest {
    private List<String> ids;

    public List<String> getIds() {
        return ids;
    }

    public void setIds(List<String> ids) {
        this.ids = ids;
    }
}
