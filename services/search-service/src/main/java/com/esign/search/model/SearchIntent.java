package com.esign.search.model;

import java.util.List;
import java.util.Map;

/**
 * Classified purpose of a free-text query. Derived per request, never persisted.
 */
public record SearchIntent(
    IntentType type,
    double confidence,
    List<IntentEntity> entities,
    Map<String, String> parameters
) {
    public static SearchIntent unknown() {
        return new SearchIntent(IntentType.UNKNOWN, 0.0, List.of(), Map.of());
    }

    public String parameter(String name) {
        return parameters == null ? null : parameters.get(name);
    }
}
