package com.rsl.retrieval.api;

import com.rsl.retrieval.search.RetrievalService;
import com.rsl.retrieval.search.SearchQuery;
import com.rsl.retrieval.search.SearchResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Logger logger = LoggerFactory.getLogger(SearchController.class);

    private final RetrievalService retrievalService;

    public SearchController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping({"/search", "/internal/search"})
    public ResponseEntity<SearchResponse> search(
        @RequestBody(required = false) SearchQuery query,
        HttpServletRequest request
    ) {
        String traceId = RequestIdUtil.traceId(request);
        String requestId = RequestIdUtil.requestId(request);
        SearchResponse response = retrievalService.search(query);
        logger.debug("search_served request_id={} trace_id={} total={} elapsed_ms={}",
            requestId, traceId, response.getTotal(), response.getElapsedMs());
        return ResponseEntity.ok()
            .header(RequestIdUtil.TRACE_HEADER, traceId)
            .header(RequestIdUtil.REQUEST_HEADER, requestId)
            .body(response);
    }
}
