package com.esign.search.model;

public class SearchScore {
    private double total;
    private double textMatch;
    private double fieldMatch;
    private double recency;
    private double popularity;
    private double personalization;
    private double semantic;

    public static SearchScore fromRelevance(double relevance) {
        SearchScore score = new SearchScore();
        score.setTextMatch(relevance);
        score.setTotal(relevance);
        return score;
    }

    public double getTotal() {
        return total;
    }

    public void setTotal(double total) {
        this.total = total;
    }

    public double getTextMatch() {
        return textMatch;
    }

    public void setTextMatch(double textMatch) {
        this.textMatch = textMatch;
    }

    public double getFieldMatch() {
        return fieldMatch;
    }

    public void setFieldMatch(double fieldMatch) {
        this.fieldMatch = fieldMatch;
    }

    public double getRecency() {
        return recency;
    }

    public void setRecency(double recency) {
        this.recency = recency;
    }

    public double getPopularity() {
        return popularity;
    }

    public void setPopularity(double popularity) {
        this.popularity = popularity;
    }

    public double getPersonalization() {
        return personalization;
    }

    public void setPersonalization(double personalization) {
        this.personalization = personalization;
    }

    public double getSemantic() {
        return semantic;
    }

    public void setSemantic(double semantic) {
        this.semantic = semantic;
    }
}
