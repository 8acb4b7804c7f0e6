package com.esign.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Toggles for the optional pipeline stages. Index execution has no toggle.
 */
@ConfigurationProperties(prefix = "search.features")
public class SearchFeatureProperties {
    private boolean intentRecognition = true;
    private boolean queryExpansion = true;
    private boolean spellCorrection = true;
    private boolean personalizedRanking = true;
    private boolean semanticSearch = true;
    private boolean autoComplete = true;
    private boolean facets = true;
    private boolean suggestions = true;
    private boolean analytics = true;

    public static SearchFeatureProperties allDisabled() {
        SearchFeatureProperties features = new SearchFeatureProperties();
        features.setIntentRecognition(false);
        features.setQueryExpansion(false);
        features.setSpellCorrection(false);
        features.setPersonalizedRanking(false);
        features.setSemanticSearch(false);
        features.setAutoComplete(false);
        features.setFacets(false);
        features.setSuggestions(false);
        features.setAnalytics(false);
        return features;
    }

    public boolean isIntentRecognition() {
        return intentRecognition;
    }

    public void setIntentRecognition(boolean intentRecognition) {
        this.intentRecognition = intentRecognition;
    }

    public boolean isQueryExpansion() {
        return queryExpansion;
    }

    public void setQueryExpansion(boolean queryExpansion) {
        this.queryExpansion = queryExpansion;
    }

    public boolean isSpellCorrection() {
        return spellCorrection;
    }

    public void setSpellCorrection(boolean spellCorrection) {
        this.spellCorrection = spellCorrection;
    }

    public boolean isPersonalizedRanking() {
        return personalizedRanking;
    }

    public void setPersonalizedRanking(boolean personalizedRanking) {
        this.personalizedRanking = personalizedRanking;
    }

    public boolean isSemanticSearch() {
        return semanticSearch;
    }

    public void setSemanticSearch(boolean semanticSearch) {
        this.semanticSearch = semanticSearch;
    }

    public boolean isAutoComplete() {
        return autoComplete;
    }

    public void setAutoComplete(boolean autoComplete) {
        this.autoComplete = autoComplete;
    }

    public boolean isFacets() {
        return facets;
    }

    public void setFacets(boolean facets) {
        this.facets = facets;
    }

    public boolean isSuggestions() {
        return suggestions;
    }

    public void setSuggestions(boolean suggestions) {
        this.suggestions = suggestions;
    }

    public boolean isAnalytics() {
        return analytics;
    }

    public void setAnalytics(boolean analytics) {
        this.analytics = analytics;
    }
}
