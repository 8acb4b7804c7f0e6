package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ComponentHealth(HealthStatus status, Map<String, Object> details) {

    public static ComponentHealth of(HealthStatus status) {
        return new ComponentHealth(status, Map.of());
    }
}
