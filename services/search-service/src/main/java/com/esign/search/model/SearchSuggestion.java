package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchSuggestion {
    private String text;
    private SuggestionType type;
    private double score;
    private String highlight;

    public SearchSuggestion() {
    }

    public SearchSuggestion(String text, SuggestionType type, double score) {
        this(text, type, score, null);
    }

    public SearchSuggestion(String text, SuggestionType type, double score, String highlight) {
        this.text = text;
        this.type = type;
        this.score = score;
        this.highlight = highlight;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public SuggestionType getType() {
        return type;
    }

    public void setType(SuggestionType type) {
        this.type = type;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public String getHighlight() {
        return highlight;
    }

    public void setHighlight(String highlight) {
        this.highlight = highlight;
    }
}
