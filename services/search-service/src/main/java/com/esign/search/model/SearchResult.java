package com.esign.search.model;

import java.util.ArrayList;
import java.util.List;

public class SearchResult {
    private List<SearchDocument> documents = new ArrayList<>();
    private List<FacetResult> facets = new ArrayList<>();
    private List<SearchSuggestion> suggestions = new ArrayList<>();
    private long total;
    private int page;
    private int limit;
    private long searchTime;
    private Analytics analytics = new Analytics();

    public List<SearchDocument> getDocuments() {
        return documents;
    }

    public void setDocuments(List<SearchDocument> documents) {
        this.documents = documents == null ? new ArrayList<>() : documents;
    }

    public List<FacetResult> getFacets() {
        return facets;
    }

    public void setFacets(List<FacetResult> facets) {
        this.facets = facets == null ? new ArrayList<>() : facets;
    }

    public List<SearchSuggestion> getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(List<SearchSuggestion> suggestions) {
        this.suggestions = suggestions == null ? new ArrayList<>() : suggestions;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public long getSearchTime() {
        return searchTime;
    }

    public void setSearchTime(long searchTime) {
        this.searchTime = searchTime;
    }

    public Analytics getAnalytics() {
        return analytics;
    }

    public void setAnalytics(Analytics analytics) {
        this.analytics = analytics;
    }

    public static class Analytics {
        private String queryId;

        public Analytics() {
        }

        public Analytics(String queryId) {
            this.queryId = queryId;
        }

        public String getQueryId() {
            return queryId;
        }

        public void setQueryId(String queryId) {
            this.queryId = queryId;
        }
    }
}
