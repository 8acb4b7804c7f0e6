package com.esign.search.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

final class RequestHeaders {
    static final String ORGANIZATION_ID = "x-organization-id";
    static final String USER_ID = "x-user-id";
    static final String SESSION_ID = "x-session-id";
    static final String TRACE_ID = "x-trace-id";
    static final String REQUEST_ID = "x-request-id";

    private RequestHeaders() {
    }

    /**
     * Blank identity headers count as absent.
     */
    static String identity(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String correlationId(HttpServletRequest request, String headerName) {
        String value = identity(request.getHeader(headerName));
        return value == null ? UUID.randomUUID().toString() : value;
    }
}
