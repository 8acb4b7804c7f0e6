package com.esign.search.analytics;

import com.esign.search.model.ClickEvent;
import com.esign.search.model.ClickedResult;
import com.esign.search.model.SearchAnalyticsEvent;
import com.esign.search.model.SearchMetrics;
import com.esign.search.model.TimeRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Aggregates persisted events and clicks. Clicks join events by query id; positions are
 * 1-based.
 */
@Component
public class SearchMetricsCalculator {
    static final int TOP_QUERIES = 10;

    public SearchMetrics compute(List<SearchAnalyticsEvent> events, List<ClickEvent> clicks, TimeRange range) {
        SearchMetrics metrics = new SearchMetrics();
        Map<String, List<Integer>> positions = clickPositions(events, clicks);

        List<Long> times = events.stream().map(SearchAnalyticsEvent::getSearchTime).sorted().toList();
        SearchMetrics.QueryPerformance performance = metrics.getQueryPerformance();
        if (!times.isEmpty()) {
            performance.setAverageResponseTime(times.stream().mapToLong(Long::longValue).average().orElse(0));
            performance.setP95ResponseTime(percentile(times, 0.95));
            performance.setP99ResponseTime(percentile(times, 0.99));
        }
        long seconds = Math.max(1, range.duration().getSeconds());
        performance.setThroughput((double) events.size() / seconds);

        SearchMetrics.Relevance relevance = metrics.getRelevance();
        if (!events.isEmpty()) {
            int clicked = 0;
            double reciprocalRanks = 0.0;
            double ndcgSum = 0.0;
            for (SearchAnalyticsEvent event : events) {
                List<Integer> eventPositions = positions.getOrDefault(event.getId(), List.of());
                if (eventPositions.isEmpty()) {
                    continue;
                }
                clicked++;
                reciprocalRanks += 1.0 / Collections.min(eventPositions);
                ndcgSum += ndcg(eventPositions);
            }
            relevance.setClickThroughRate((double) clicked / events.size());
            relevance.setMeanReciprocalRank(reciprocalRanks / events.size());
            relevance.setNormalizedDiscountedCumulativeGain(clicked == 0 ? 0.0 : ndcgSum / clicked);
        }

        SearchMetrics.Usage usage = metrics.getUsage();
        usage.setTotalQueries(events.size());
        usage.setUniqueUsers(events.stream().map(SearchAnalyticsEvent::getUserId).filter(Objects::nonNull).distinct().count());
        usage.setTopQueries(topQueries(events, false));
        usage.setZeroResultQueries(topQueries(events, true));
        return metrics;
    }

    private Map<String, List<Integer>> clickPositions(List<SearchAnalyticsEvent> events, List<ClickEvent> clicks) {
        Map<String, Set<ClickedResult>> joined = new HashMap<>();
        for (SearchAnalyticsEvent event : events) {
            Set<ClickedResult> set = joined.computeIfAbsent(event.getId(), id -> new LinkedHashSet<>());
            set.addAll(event.getClickedResults());
        }
        for (ClickEvent click : clicks) {
            Set<ClickedResult> set = joined.get(click.queryId());
            if (set != null) {
                set.add(new ClickedResult(click.documentId(), click.position()));
            }
        }
        Map<String, List<Integer>> positions = new HashMap<>();
        joined.forEach((id, results) -> positions.put(id, results.stream()
            .map(result -> Math.max(1, result.position()))
            .distinct()
            .sorted()
            .toList()));
        return positions;
    }

    static double percentile(List<Long> sorted, double percentile) {
        int rank = (int) Math.ceil(percentile * sorted.size());
        return sorted.get(Math.min(sorted.size(), Math.max(1, rank)) - 1);
    }

    static double ndcg(List<Integer> sortedPositions) {
        double dcg = 0.0;
        double idcg = 0.0;
        for (int i = 0; i < sortedPositions.size(); i++) {
            dcg += 1.0 / log2(sortedPositions.get(i) + 1);
            idcg += 1.0 / log2(i + 2);
        }
        return idcg == 0.0 ? 0.0 : dcg / idcg;
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }

    private List<SearchMetrics.QueryCount> topQueries(List<SearchAnalyticsEvent> events, boolean zeroResultsOnly) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (SearchAnalyticsEvent event : events) {
            if (event.getQuery() == null || event.getQuery().isBlank()) {
                continue;
            }
            if (zeroResultsOnly && (event.getResultsCount() > 0 || event.isFailed())) {
                continue;
            }
            counts.merge(event.getQuery().trim().toLowerCase(Locale.ROOT), 1L, Long::sum);
        }
        List<SearchMetrics.QueryCount> ranked = new ArrayList<>();
        counts.forEach((query, count) -> ranked.add(new SearchMetrics.QueryCount(query, count)));
        ranked.sort((left, right) -> Long.compare(right.count(), left.count()));
        return ranked.stream().limit(TOP_QUERIES).toList();
    }
}
