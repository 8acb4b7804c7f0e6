package com.esign.search.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per (user, organization) preference and behavior state used to bias ranking and request
 * defaults.
 */
public class PersonalizationProfile {
    private String userId;
    private String organizationId;
    private Preferences preferences = new Preferences();
    private Behavior behavior = new Behavior();
    private Contextual contextual = new Contextual();

    public static PersonalizationProfile empty(String userId, String organizationId) {
        PersonalizationProfile profile = new PersonalizationProfile();
        profile.setUserId(userId);
        profile.setOrganizationId(organizationId);
        return profile;
    }

    public PersonalizationProfile copy() {
        PersonalizationProfile copy = empty(userId, organizationId);
        copy.preferences.setEntityTypes(new ArrayList<>(preferences.getEntityTypes()));
        copy.preferences.setSortPreference(preferences.getSortPreference());
        copy.preferences.setFacetPreferences(new ArrayList<>(preferences.getFacetPreferences()));
        copy.behavior.setSearchHistory(new ArrayList<>(behavior.getSearchHistory()));
        copy.behavior.setClickPatterns(new LinkedHashMap<>(behavior.getClickPatterns()));
        copy.behavior.setDwellTime(new LinkedHashMap<>(behavior.getDwellTime()));
        copy.contextual.setRecentDocuments(new ArrayList<>(contextual.getRecentDocuments()));
        copy.contextual.setCollaborators(new ArrayList<>(contextual.getCollaborators()));
        copy.contextual.setWorkingHours(contextual.getWorkingHours());
        return copy;
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

    public Preferences getPreferences() {
        return preferences;
    }

    public void setPreferences(Preferences preferences) {
        this.preferences = preferences == null ? new Preferences() : preferences;
    }

    public Behavior getBehavior() {
        return behavior;
    }

    public void setBehavior(Behavior behavior) {
        this.behavior = behavior == null ? new Behavior() : behavior;
    }

    public Contextual getContextual() {
        return contextual;
    }

    public void setContextual(Contextual contextual) {
        this.contextual = contextual == null ? new Contextual() : contextual;
    }

    public static class Preferences {
        public static final String SORT_RELEVANCE = "relevance";
        public static final String SORT_DATE = "date";

        private List<EntityType> entityTypes = new ArrayList<>();
        private String sortPreference;
        private List<String> facetPreferences = new ArrayList<>();

        public List<EntityType> getEntityTypes() {
            return entityTypes;
        }

        public void setEntityTypes(List<EntityType> entityTypes) {
            this.entityTypes = entityTypes == null ? new ArrayList<>() : entityTypes;
        }

        public String getSortPreference() {
            return sortPreference;
        }

        public void setSortPreference(String sortPreference) {
            this.sortPreference = sortPreference;
        }

        public List<String> getFacetPreferences() {
            return facetPreferences;
        }

        public void setFacetPreferences(List<String> facetPreferences) {
            this.facetPreferences = facetPreferences == null ? new ArrayList<>() : facetPreferences;
        }
    }

    public static class Behavior {
        private List<SearchHistoryEntry> searchHistory = new ArrayList<>();
        private Map<String, Integer> clickPatterns = new LinkedHashMap<>();
        private Map<String, Long> dwellTime = new LinkedHashMap<>();

        public List<SearchHistoryEntry> getSearchHistory() {
            return searchHistory;
        }

        public void setSearchHistory(List<SearchHistoryEntry> searchHistory) {
            this.searchHistory = searchHistory == null ? new ArrayList<>() : searchHistory;
        }

        public Map<String, Integer> getClickPatterns() {
            return clickPatterns;
        }

        public void setClickPatterns(Map<String, Integer> clickPatterns) {
            this.clickPatterns = clickPatterns == null ? new LinkedHashMap<>() : clickPatterns;
        }

        public Map<String, Long> getDwellTime() {
            return dwellTime;
        }

        public void setDwellTime(Map<String, Long> dwellTime) {
            this.dwellTime = dwellTime == null ? new LinkedHashMap<>() : dwellTime;
        }
    }

    public static class Contextual {
        private List<String> recentDocuments = new ArrayList<>();
        private List<String> collaborators = new ArrayList<>();
        private WorkingHours workingHours;

        public List<String> getRecentDocuments() {
            return recentDocuments;
        }

        public void setRecentDocuments(List<String> recentDocuments) {
            this.recentDocuments = recentDocuments == null ? new ArrayList<>() : recentDocuments;
        }

        public List<String> getCollaborators() {
            return collaborators;
        }

        public void setCollaborators(List<String> collaborators) {
            this.collaborators = collaborators == null ? new ArrayList<>() : collaborators;
        }

        public WorkingHours getWorkingHours() {
            return workingHours;
        }

        public void setWorkingHours(WorkingHours workingHours) {
            this.workingHours = workingHours;
        }
    }

    public record WorkingHours(String start, String end, String timezone) {
    }

    /**
     * Most recent entries first.
     */
    public record SearchHistoryEntry(String query, Instant timestamp, long resultsCount) {
    }
}
