package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EntityType {
    DOCUMENT("document"),
    TEMPLATE("template"),
    USER("user"),
    ORGANIZATION("organization"),
    SIGNATURE_REQUEST("signature_request"),
    FOLDER("folder"),
    AUDIT_LOG("audit_log");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EntityType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown entity type: " + raw);
    }
}
