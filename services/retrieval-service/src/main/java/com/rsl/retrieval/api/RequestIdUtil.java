package com.rsl.retrieval.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    static final String TRACE_HEADER = "x-trace-id";
    static final String REQUEST_HEADER = "x-request-id";
    static final String TRACEPARENT_HEADER = "traceparent";

    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value.trim();
        }
        return UUID.randomUUID().toString();
    }

    public static String requestId(HttpServletRequest request) {
        return resolveOrGenerate(request.getHeader(REQUEST_HEADER));
    }

    /**
     * Explicit trace header first, then the trace id segment of a W3C traceparent.
     */
    public static String traceId(HttpServletRequest request) {
        String explicit = request.getHeader(TRACE_HEADER);
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        return resolveOrGenerate(fromTraceparent(request.getHeader(TRACEPARENT_HEADER)));
    }

    static String fromTraceparent(String traceparent) {
        if (traceparent == null) {
            return null;
        }
        String[] parts = traceparent.trim().split("-");
        if (parts.length < 4 || parts[1].length() != 32) {
            return null;
        }
        return parts[1];
    }
}
