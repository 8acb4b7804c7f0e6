package com.esign.search.analytics;

import com.esign.search.model.ClickEvent;
import com.esign.search.model.SearchAnalyticsEvent;
import com.esign.search.model.TimeRange;
import java.time.Instant;
import java.util.List;

/**
 * Durable side of analytics. Flushed events and standalone clicks land here.
 */
public interface AnalyticsStore {
    void saveEvents(List<SearchAnalyticsEvent> events);

    void saveClick(ClickEvent click);

    List<SearchAnalyticsEvent> findEvents(String organizationId, TimeRange range);

    List<ClickEvent> findClicks(String organizationId, TimeRange range);

    int deleteBefore(Instant cutoff);
}
