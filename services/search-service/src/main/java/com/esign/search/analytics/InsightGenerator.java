package com.esign.search.analytics;

import com.esign.search.model.EntityType;
import com.esign.search.model.InsightImpact;
import com.esign.search.model.SearchAnalyticsEvent;
import com.esign.search.model.SearchInsight;
import com.esign.search.model.SearchMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class InsightGenerator {
    private static final int SAMPLE_SIZE = 5;
    private static final double HIGH_IMPACT_IMPROVEMENT = 10.0;
    private static final List<Recommendation> RECOMMENDATIONS = List.of(
        new Recommendation("query_expansion", 15,
            "Expanding queries with domain synonyms is expected to improve recall",
            "Configure synonym analyzer with domain-specific terms"),
        new Recommendation("boosting_optimization", 12,
            "Rebalancing field boosts is expected to improve ranking precision",
            "Increase title field boost to 4x, reduce content boost to 1.5x"),
        new Recommendation("facet_optimization", 8,
            "Reordering facets by usage is expected to improve filter engagement",
            "Move \"type\" and \"tags\" facets to top, hide low-usage facets")
    );

    private final AnalyticsProperties properties;
    private final Clock clock;

    public InsightGenerator(AnalyticsProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Rule-based insights, highest impact first.
     */
    public List<SearchInsight> generate(SearchMetrics metrics, List<SearchAnalyticsEvent> events) {
        Instant now = clock.instant();
        List<SearchInsight> insights = new ArrayList<>();

        double averageResponseTime = metrics.getQueryPerformance().getAverageResponseTime();
        if (averageResponseTime > properties.getLatencyTargetMs()) {
            insights.add(new SearchInsight(
                SearchInsight.QUERY_PERFORMANCE,
                "Slow Query Performance Detected",
                String.format(Locale.ROOT, "Average response time is %.0fms, which exceeds the %dms target",
                    averageResponseTime, properties.getLatencyTargetMs()),
                InsightImpact.HIGH,
                "Consider optimizing index mappings and query structure",
                Map.of("averageResponseTime", averageResponseTime, "target", properties.getLatencyTargetMs()),
                now
            ));
        }

        double ctr = metrics.getRelevance().getClickThroughRate();
        if (!events.isEmpty() && ctr < properties.getCtrTarget()) {
            insights.add(new SearchInsight(
                SearchInsight.RELEVANCE_ISSUE,
                "Low Click-Through Rate",
                String.format(Locale.ROOT, "Click-through rate is %.1f%%, indicating potential relevance issues", ctr * 100),
                InsightImpact.MEDIUM,
                "Review and adjust search result ranking algorithms",
                Map.of("clickThroughRate", ctr, "target", properties.getCtrGoal()),
                now
            ));
        }

        List<SearchMetrics.QueryCount> zeroResults = metrics.getUsage().getZeroResultQueries();
        if (!zeroResults.isEmpty()) {
            insights.add(new SearchInsight(
                SearchInsight.ZERO_RESULTS,
                "High Number of Zero-Result Queries",
                zeroResults.size() + " queries returned no results, indicating content gaps",
                InsightImpact.MEDIUM,
                "Review zero-result queries and consider adding relevant content or improving query handling",
                Map.of("zeroResultQueries", zeroResults.stream().limit(SAMPLE_SIZE).toList()),
                now
            ));
        }

        List<SearchMetrics.QueryCount> topQueries = metrics.getUsage().getTopQueries();
        if (!topQueries.isEmpty()) {
            insights.add(new SearchInsight(
                SearchInsight.POPULAR_CONTENT,
                "Popular Search Terms Identified",
                "Top search terms indicate high demand for specific content types",
                InsightImpact.LOW,
                "Consider creating more content around popular search terms",
                Map.of("topQueries", topQueries.stream().limit(SAMPLE_SIZE).toList()),
                now
            ));
        }

        insights.add(behaviorInsight(events, now));

        if (properties.isMlRecommendations()) {
            for (Recommendation recommendation : RECOMMENDATIONS) {
                insights.add(recommendation.toInsight(now));
            }
        }

        insights.sort(Comparator.comparingInt((SearchInsight insight) -> insight.impact().getWeight()).reversed());
        return insights;
    }

    private SearchInsight behaviorInsight(List<SearchAnalyticsEvent> events, Instant now) {
        double filterUsage = 0.0;
        double documentSearches = 0.0;
        if (!events.isEmpty()) {
            long filtered = events.stream().filter(event -> event.getFilters() != null && !event.getFilters().isEmpty()).count();
            long documents = events.stream()
                .filter(event -> event.getEntityTypes() != null && event.getEntityTypes().contains(EntityType.DOCUMENT))
                .count();
            filterUsage = (double) filtered / events.size();
            documentSearches = (double) documents / events.size();
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filterUsage", filterUsage);
        data.put("documentSearches", documentSearches);
        return new SearchInsight(
            SearchInsight.USER_BEHAVIOR,
            "Search Pattern Analysis",
            String.format(Locale.ROOT, "%.0f%% of searches use filters", filterUsage * 100),
            InsightImpact.LOW,
            "Improve discoverability of advanced search features",
            data,
            now
        );
    }

    private record Recommendation(String type, double expectedImprovement, String description, String action) {
        SearchInsight toInsight(Instant now) {
            return new SearchInsight(
                "ml_optimization",
                "ML Optimization: " + type.toUpperCase(Locale.ROOT),
                description,
                expectedImprovement > HIGH_IMPACT_IMPROVEMENT ? InsightImpact.HIGH : InsightImpact.MEDIUM,
                action,
                Map.of("type", type, "expectedImprovement", expectedImprovement),
                now
            );
        }
    }
}
