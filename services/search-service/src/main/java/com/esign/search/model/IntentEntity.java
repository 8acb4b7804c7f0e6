package com.esign.search.model;

public record IntentEntity(Kind type, String value, double confidence) {

    public enum Kind {
        DOCUMENT_TYPE,
        PERSON,
        DATE,
        ORGANIZATION,
        TAG
    }
}
