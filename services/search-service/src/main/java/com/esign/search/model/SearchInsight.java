package com.esign.search.model;

import java.time.Instant;
import java.util.Map;

public record SearchInsight(
    String type,
    String title,
    String description,
    InsightImpact impact,
    String recommendation,
    Map<String, Object> data,
    Instant timestamp
) {
    public static final String QUERY_PERFORMANCE = "query_performance";
    public static final String RELEVANCE_ISSUE = "relevance_issue";
    public static final String ZERO_RESULTS = "zero_results";
    public static final String POPULAR_CONTENT = "popular_content";
    public static final String USER_BEHAVIOR = "user_behavior";

    public SearchInsight {
        if (recommendation == null || recommendation.isBlank()) {
            throw new IllegalArgumentException("insight recommendation is required");
        }
    }
}
