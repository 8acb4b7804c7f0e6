package com.esign.search.analytics;

import com.esign.search.model.ClickEvent;
import com.esign.search.model.ClickedResult;
import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchAnalyticsEvent;
import com.esign.search.model.SearchInsight;
import com.esign.search.model.SearchMetrics;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.TimeRange;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(SearchAnalyticsService.class);

    private final AnalyticsEventBuffer buffer;
    private final AnalyticsStore store;
    private final PersonalizationProfileStore profileStore;
    private final SearchMetricsCalculator metricsCalculator;
    private final InsightGenerator insightGenerator;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public SearchAnalyticsService(
        AnalyticsEventBuffer buffer,
        AnalyticsStore store,
        PersonalizationProfileStore profileStore,
        SearchMetricsCalculator metricsCalculator,
        InsightGenerator insightGenerator,
        AnalyticsProperties properties,
        Clock clock
    ) {
        this.buffer = buffer;
        this.store = store;
        this.profileStore = profileStore;
        this.metricsCalculator = metricsCalculator;
        this.insightGenerator = insightGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    public void start() {
        buffer.start();
    }

    public void stop() {
        buffer.stop();
    }

    public boolean isRunning() {
        return buffer.isRunning();
    }

    public int pendingEvents() {
        return buffer.size();
    }

    public SearchAnalyticsEvent track(
        String queryId,
        SearchQuery query,
        long resultsCount,
        long searchTimeMs,
        String userId,
        String organizationId,
        String sessionId,
        boolean failed
    ) {
        SearchAnalyticsEvent event = new SearchAnalyticsEvent();
        event.setId(queryId);
        event.setUserId(userId);
        event.setOrganizationId(organizationId);
        event.setQuery(query.getQuery());
        event.setEntityTypes(query.getEntityTypes() == null ? new ArrayList<>() : new ArrayList<>(query.getEntityTypes()));
        event.setFilters(query.getFilters() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(query.getFilters()));
        event.setResultsCount(resultsCount);
        event.setSearchTime(searchTimeMs);
        event.setTimestamp(clock.instant());
        event.setSessionId(sessionId);
        event.setFailed(failed);
        buffer.append(event);

        if (userId != null && query.hasText()) {
            PersonalizationProfile.SearchHistoryEntry entry = new PersonalizationProfile.SearchHistoryEntry(
                query.getQuery(), event.getTimestamp(), resultsCount);
            buffer.runInBackground("search-history", () -> recordHistory(userId, organizationId, entry));
        }
        return event;
    }

    public void trackClick(String queryId, String documentId, int position, String userId, String organizationId) {
        buffer.findBuffered(queryId).ifPresent(event -> event.addClick(new ClickedResult(documentId, position)));
        store.saveClick(new ClickEvent(
            UUID.randomUUID().toString(),
            queryId,
            documentId,
            position,
            userId,
            organizationId,
            clock.instant()
        ));
        if (userId != null) {
            buffer.runInBackground("click-pattern", () -> profileStore.update(userId, organizationId, profile -> {
                profile.getBehavior().getClickPatterns().merge(documentId, 1, Integer::sum);
                return profile;
            }));
        }
        log.debug("click tracked queryId={} documentId={} position={}", queryId, documentId, position);
    }

    public SearchMetrics computeMetrics(String organizationId, TimeRange range) {
        List<SearchAnalyticsEvent> events = store.findEvents(organizationId, range);
        List<ClickEvent> clicks = store.findClicks(organizationId, range);
        return metricsCalculator.compute(events, clicks, range);
    }

    public List<SearchInsight> computeInsights(String organizationId, TimeRange range) {
        List<SearchAnalyticsEvent> events = store.findEvents(organizationId, range);
        List<ClickEvent> clicks = store.findClicks(organizationId, range);
        SearchMetrics metrics = metricsCalculator.compute(events, clicks, range);
        return insightGenerator.generate(metrics, events);
    }

    /**
     * A missing profile is an empty one.
     */
    public PersonalizationProfile loadProfile(String userId, String organizationId) {
        return profileStore.find(userId, organizationId)
            .orElseGet(() -> PersonalizationProfile.empty(userId, organizationId));
    }

    /**
     * Replaces the non-null sections; the others keep their stored value.
     */
    public PersonalizationProfile updateProfile(
        String userId,
        String organizationId,
        PersonalizationProfile.Preferences preferences,
        PersonalizationProfile.Contextual contextual
    ) {
        return profileStore.update(userId, organizationId, profile -> {
            if (preferences != null) {
                profile.setPreferences(preferences);
            }
            if (contextual != null) {
                profile.setContextual(contextual);
            }
            return profile;
        });
    }

    private void recordHistory(String userId, String organizationId, PersonalizationProfile.SearchHistoryEntry entry) {
        profileStore.update(userId, organizationId, profile -> {
            List<PersonalizationProfile.SearchHistoryEntry> history = profile.getBehavior().getSearchHistory();
            history.add(0, entry);
            while (history.size() > Math.max(1, properties.getSearchHistoryCap())) {
                history.remove(history.size() - 1);
            }
            return profile;
        });
    }
}
