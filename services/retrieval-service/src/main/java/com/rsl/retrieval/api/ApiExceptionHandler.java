package com.rsl.retrieval.api;

import com.rsl.retrieval.index.IndexJobNotFoundException;
import com.rsl.retrieval.index.InvalidIndexRequestException;
import com.rsl.retrieval.search.InvalidSearchRequestException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidSearchRequestException.class, InvalidIndexRequestException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request", request);
    }

    @ExceptionHandler(IndexJobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(IndexJobNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String traceId = RequestIdUtil.traceId(request);
        String requestId = RequestIdUtil.requestId(request);
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            requestId,
            traceId,
            request.getMethod(),
            request.getRequestURI(),
            ex
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("internal_error", "Unexpected error", traceId, requestId));
    }

    private ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        ErrorResponse body = ErrorResponse.of(
            code,
            message,
            RequestIdUtil.traceId(request),
            RequestIdUtil.requestId(request)
        );
        return ResponseEntity.status(status).body(body);
    }
}
