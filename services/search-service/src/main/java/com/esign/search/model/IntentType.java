package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IntentType {
    FIND_DOCUMENT,
    FIND_TEMPLATE,
    FIND_USER,
    FIND_RECENT,
    FIND_BY_AUTHOR,
    FIND_BY_TYPE,
    UNKNOWN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
