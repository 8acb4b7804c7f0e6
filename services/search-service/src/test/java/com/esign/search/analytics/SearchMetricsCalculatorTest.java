package com.esign.search.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.esign.search.model.ClickEvent;
import com.esign.search.model.ClickedResult;
import com.esign.search.model.SearchAnalyticsEvent;
import com.esign.search.model.SearchMetrics;
import com.esign.search.model.TimeRange;
import java.time.Instant;
import java.util.List;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class SearchMetricsCalculatorTest {
    private static final Instant START = Instant.parse("2024-05-15T12:00:00Z");
    private static final TimeRange RANGE = new TimeRange(START, START.plusSeconds(100));

    private final SearchMetricsCalculator calculator = new SearchMetricsCalculator();

    @Test
    void computesPerformanceRelevanceAndUsage() {
        SearchAnalyticsEvent first = event("e1", "NDA", 100, 5, "u1");
        first.addClick(new ClickedResult("d1", 1));
        SearchAnalyticsEvent zero = event("e2", "Missing Form", 300, 0, "u1");
        SearchAnalyticsEvent third = event("e3", "nda", 200, 3, "u2");
        SearchAnalyticsEvent fourth = event("e4", "lease", 400, 2, null);
        List<ClickEvent> clicks = List.of(
            new ClickEvent("c1", "e3", "d9", 3, "u2", "org1", START),
            new ClickEvent("c2", "unknown", "d1", 1, "u2", "org1", START)
        );

        SearchMetrics metrics = calculator.compute(List.of(first, zero, third, fourth), clicks, RANGE);

        SearchMetrics.QueryPerformance performance = metrics.getQueryPerformance();
        assertThat(performance.getAverageResponseTime()).isEqualTo(250.0);
        assertThat(performance.getP95ResponseTime()).isEqualTo(400.0);
        assertThat(performance.getP99ResponseTime()).isEqualTo(400.0);
        assertThat(performance.getThroughput()).isCloseTo(0.04, within(1e-9));

        SearchMetrics.Relevance relevance = metrics.getRelevance();
        assertThat(relevance.getClickThroughRate()).isEqualTo(0.5);
        assertThat(relevance.getMeanReciprocalRank()).isCloseTo((1.0 + 1.0 / 3) / 4, within(1e-9));
        assertThat(relevance.getNormalizedDiscountedCumulativeGain()).isCloseTo(0.75, within(1e-9));

        SearchMetrics.Usage usage = metrics.getUsage();
        assertThat(usage.getTotalQueries()).isEqualTo(4);
        assertThat(usage.getUniqueUsers()).isEqualTo(2);
        assertThat(usage.getTopQueries().get(0)).isEqualTo(new SearchMetrics.QueryCount("nda", 2));
        assertThat(usage.getZeroResultQueries()).containsExactly(new SearchMetrics.QueryCount("missing form", 1));
    }

    @Test
    void failedSearchesAreNotZeroResultQueries() {
        SearchAnalyticsEvent failed = event("e1", "nda", 50, 0, "u1");
        failed.setFailed(true);

        SearchMetrics metrics = calculator.compute(List.of(failed), List.of(), RANGE);

        assertThat(metrics.getUsage().getZeroResultQueries()).isEmpty();
        assertThat(metrics.getUsage().getTopQueries()).hasSize(1);
    }

    @Test
    void emptyWindowYieldsZeroes() {
        SearchMetrics metrics = calculator.compute(List.of(), List.of(), RANGE);

        assertThat(metrics.getQueryPerformance().getAverageResponseTime()).isZero();
        assertThat(metrics.getRelevance().getClickThroughRate()).isZero();
        assertThat(metrics.getUsage().getTopQueries()).isEmpty();
    }

    @Test
    void percentileUsesNearestRank() {
        List<Long> values = LongStream.rangeClosed(1, 20).boxed().toList();

        assertThat(SearchMetricsCalculator.percentile(values, 0.95)).isEqualTo(19.0);
        assertThat(SearchMetricsCalculator.percentile(values, 0.99)).isEqualTo(20.0);
    }

    @Test
    void ndcgRewardsEarlyClicks() {
        assertThat(SearchMetricsCalculator.ndcg(List.of(1, 2))).isEqualTo(1.0);
        assertThat(SearchMetricsCalculator.ndcg(List.of(2))).isLessThan(1.0);
    }

    private SearchAnalyticsEvent event(String id, String query, long searchTime, long results, String userId) {
        SearchAnalyticsEvent event = new SearchAnalyticsEvent();
        event.setId(id);
        event.setQuery(query);
        event.setSearchTime(searchTime);
        event.setResultsCount(results);
        event.setUserId(userId);
        event.setOrganizationId("org1");
        event.setTimestamp(START);
        return event;
    }
}
