package com.esign.search.ranking;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.suggestions")
public class SuggestionProperties {
    private int minQueryLength = 2;
    private List<String> completions = new ArrayList<>(List.of(
        "contract template",
        "invoice template",
        "NDA agreement",
        "employment contract",
        "service agreement",
        "template library",
        "templates shared with me"
    ));
    private double completionScore = 0.8;
    private double correctionScore = 0.9;
    private double tagScore = 0.6;
    private double historyScore = 0.5;
    private double engineCompletionScore = 0.8;
    private double minScore = 0.3;
    private int maxSuggestions = 10;
    private int maxHistoryEntries = 5;
    private int maxRelatedTags = 5;

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public void setMinQueryLength(int minQueryLength) {
        this.minQueryLength = minQueryLength;
    }

    public List<String> getCompletions() {
        return completions;
    }

    public void setCompletions(List<String> completions) {
        this.completions = completions;
    }

    public double getCompletionScore() {
        return completionScore;
    }

    public void setCompletionScore(double completionScore) {
        this.completionScore = completionScore;
    }

    public double getCorrectionScore() {
        return correctionScore;
    }

    public void setCorrectionScore(double correctionScore) {
        this.correctionScore = correctionScore;
    }

    public double getTagScore() {
        return tagScore;
    }

    public void setTagScore(double tagScore) {
        this.tagScore = tagScore;
    }

    public double getHistoryScore() {
        return historyScore;
    }

    public void setHistoryScore(double historyScore) {
        this.historyScore = historyScore;
    }

    public double getEngineCompletionScore() {
        return engineCompletionScore;
    }

    public void setEngineCompletionScore(double engineCompletionScore) {
        this.engineCompletionScore = engineCompletionScore;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    public void setMaxSuggestions(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }

    public int getMaxHistoryEntries() {
        return maxHistoryEntries;
    }

    public void setMaxHistoryEntries(int maxHistoryEntries) {
        this.maxHistoryEntries = maxHistoryEntries;
    }

    public int getMaxRelatedTags() {
        return maxRelatedTags;
    }

    public void setMaxRelatedTags(int maxRelatedTags) {
        this.maxRelatedTags = maxRelatedTags;
    }
}
