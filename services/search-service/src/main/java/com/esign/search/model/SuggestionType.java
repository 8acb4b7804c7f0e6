package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SuggestionType {
    COMPLETION("completion"),
    CORRECTION("correction"),
    PHRASE("phrase");

    private final String value;

    SuggestionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
