package com.esign.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    Detail error,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId
) {
    public ErrorResponse(String code, String message, String traceId, String requestId) {
        this(new Detail(code, message), traceId, requestId);
    }

    public record Detail(String code, String message) {
    }
}
