package com.esign.search.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.esign.search.model.EntityType;
import com.esign.search.model.InsightImpact;
import com.esign.search.model.SearchAnalyticsEvent;
import com.esign.search.model.SearchFilter;
import com.esign.search.model.SearchInsight;
import com.esign.search.model.SearchMetrics;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InsightGeneratorTest {
    private static final Instant NOW = Instant.parse("2024-05-15T12:00:00Z");

    private final AnalyticsProperties properties = new AnalyticsProperties();
    private final InsightGenerator generator = new InsightGenerator(properties, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void rulesFireAndAreOrderedByImpact() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.getQueryPerformance().setAverageResponseTime(250);
        metrics.getRelevance().setClickThroughRate(0.25);
        metrics.getUsage().setZeroResultQueries(List.of(new SearchMetrics.QueryCount("missing form", 1)));
        metrics.getUsage().setTopQueries(List.of(new SearchMetrics.QueryCount("nda", 2)));

        SearchAnalyticsEvent filtered = new SearchAnalyticsEvent();
        filtered.setFilters(Map.of("status", SearchFilter.term("signed")));
        filtered.setEntityTypes(List.of(EntityType.DOCUMENT));
        List<SearchAnalyticsEvent> events = List.of(filtered, new SearchAnalyticsEvent());

        List<SearchInsight> insights = generator.generate(metrics, events);

        assertThat(insights).extracting(SearchInsight::type).containsExactly(
            SearchInsight.QUERY_PERFORMANCE, "ml_optimization", "ml_optimization",
            SearchInsight.RELEVANCE_ISSUE, SearchInsight.ZERO_RESULTS, "ml_optimization",
            SearchInsight.POPULAR_CONTENT, SearchInsight.USER_BEHAVIOR);
        assertThat(insights.get(0).impact()).isEqualTo(InsightImpact.HIGH);
        assertThat(insights.get(0).description()).contains("250ms").contains("200ms");
        assertThat(insights.get(3).description()).contains("25.0%");

        SearchInsight behavior = insights.get(7);
        assertThat(behavior.data()).containsEntry("filterUsage", 0.5).containsEntry("documentSearches", 0.5);
        assertThat(insights).allSatisfy(insight -> assertThat(insight.timestamp()).isEqualTo(NOW));
    }

    @Test
    void quietWindowOnlyReportsBehavior() {
        properties.setMlRecommendations(false);

        List<SearchInsight> insights = generator.generate(new SearchMetrics(), List.of());

        assertThat(insights).extracting(SearchInsight::type).containsExactly(SearchInsight.USER_BEHAVIOR);
        assertThat(insights.get(0).data()).containsEntry("filterUsage", 0.0);
    }
}
