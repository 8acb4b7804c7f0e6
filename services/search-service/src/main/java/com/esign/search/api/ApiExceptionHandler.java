package com.esign.search.api;

import com.esign.search.api.dto.ErrorResponse;
import com.esign.search.opensearch.OpenSearchUnavailableException;
import com.esign.search.service.InvalidSearchRequestException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(errorResponse("bad_request", "Invalid request body", request));
    }

    @ExceptionHandler({
        InvalidSearchRequestException.class,
        IllegalArgumentException.class,
        DateTimeParseException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(errorResponse("bad_request", ex.getMessage(), request));
    }

    @ExceptionHandler(OpenSearchUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(OpenSearchUnavailableException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(errorResponse("opensearch_unavailable", "OpenSearch is unavailable", request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("unhandled error path={}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorResponse("internal_error", "Unexpected error", request));
    }

    private ErrorResponse errorResponse(String code, String message, HttpServletRequest request) {
        return new ErrorResponse(
            code,
            message,
            RequestHeaders.correlationId(request, RequestHeaders.TRACE_ID),
            RequestHeaders.correlationId(request, RequestHeaders.REQUEST_ID)
        );
    }
}
