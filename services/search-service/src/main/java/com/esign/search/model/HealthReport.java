package com.esign.search.model;

import java.util.Map;

public record HealthReport(HealthStatus status, Map<String, ComponentHealth> components) {
}
