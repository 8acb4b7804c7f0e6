package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum InsightImpact {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    InsightImpact(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
