package com.rsl.retrieval.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body shared by every endpoint: {@code {error:{code,message}, trace_id, request_id}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    ErrorDetail error,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId
) {
    public static ErrorResponse of(String code, String message, String traceId, String requestId) {
        return new ErrorResponse(new ErrorDetail(code, message), traceId, requestId);
    }

    public record ErrorDetail(String code, String message) {
    }
}
