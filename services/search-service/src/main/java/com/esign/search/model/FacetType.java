package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FacetType {
    TERMS("terms"),
    RANGE("range"),
    DATE_HISTOGRAM("date_histogram"),
    NESTED("nested");

    private final String value;

    FacetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FacetType fromValue(String raw) {
        if (raw == null) {
            return TERMS;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FacetType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown facet type: " + raw);
    }
}
