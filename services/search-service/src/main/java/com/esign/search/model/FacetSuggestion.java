package com.esign.search.model;

public record FacetSuggestion(String field, String label, String type, int priority) {
}
