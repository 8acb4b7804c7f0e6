package com.esign.search.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One record per search call. {@code clickedResults} is filled in by click tracking while the
 * event is still buffered.
 */
public class SearchAnalyticsEvent {
    private String id;
    private String userId;
    private String organizationId;
    private String query;
    private List<EntityType> entityTypes = new ArrayList<>();
    private Map<String, SearchFilter> filters = new LinkedHashMap<>();
    private long resultsCount;
    private final List<ClickedResult> clickedResults = new ArrayList<>();
    private long searchTime;
    private Instant timestamp;
    private String sessionId;
    private boolean failed;

    public synchronized void addClick(ClickedResult click) {
        clickedResults.add(click);
    }

    public synchronized List<ClickedResult> getClickedResults() {
        return List.copyOf(clickedResults);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<EntityType> getEntityTypes() {
        return entityTypes;
    }

    public void setEntityTypes(List<EntityType> entityTypes) {
        this.entityTypes = entityTypes == null ? new ArrayList<>() : entityTypes;
    }

    public Map<String, SearchFilter> getFilters() {
        return filters;
    }

    public void setFilters(Map<String, SearchFilter> filters) {
        this.filters = filters == null ? new LinkedHashMap<>() : filters;
    }

    public long getResultsCount() {
        return resultsCount;
    }

    public void setResultsCount(long resultsCount) {
        this.resultsCount = resultsCount;
    }

    public long getSearchTime() {
        return searchTime;
    }

    public void setSearchTime(long searchTime) {
        this.searchTime = searchTime;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public boolean isFailed() {
        return failed;
    }

    public void setFailed(boolean failed) {
        this.failed = failed;
    }
}
