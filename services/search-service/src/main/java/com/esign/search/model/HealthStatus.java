package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    UNKNOWN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
