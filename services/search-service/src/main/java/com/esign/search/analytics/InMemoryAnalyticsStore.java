package com.esign.search.analytics;

import com.esign.search.model.ClickEvent;
import com.esign.search.model.SearchAnalyticsEvent;
import com.esign.search.model.TimeRange;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class InMemoryAnalyticsStore implements AnalyticsStore {
    private final List<SearchAnalyticsEvent> events = new ArrayList<>();
    private final List<ClickEvent> clicks = new ArrayList<>();

    @Override
    public synchronized void saveEvents(List<SearchAnalyticsEvent> batch) {
        events.addAll(batch);
    }

    @Override
    public synchronized void saveClick(ClickEvent click) {
        clicks.add(click);
    }

    @Override
    public synchronized List<SearchAnalyticsEvent> findEvents(String organizationId, TimeRange range) {
        return events.stream()
            .filter(event -> Objects.equals(organizationId, event.getOrganizationId()))
            .filter(event -> range.contains(event.getTimestamp()))
            .toList();
    }

    @Override
    public synchronized List<ClickEvent> findClicks(String organizationId, TimeRange range) {
        return clicks.stream()
            .filter(click -> Objects.equals(organizationId, click.organizationId()))
            .filter(click -> range.contains(click.timestamp()))
            .toList();
    }

    @Override
    public synchronized int deleteBefore(Instant cutoff) {
        int before = events.size() + clicks.size();
        events.removeIf(event -> event.getTimestamp() != null && event.getTimestamp().isBefore(cutoff));
        clicks.removeIf(click -> click.timestamp() != null && click.timestamp().isBefore(cutoff));
        return before - events.size() - clicks.size();
    }
}
