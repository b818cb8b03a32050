package com.casebrain.domain.housing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LandlordType {
    SOCIAL("social"),
    PRIVATE("private"),
    UNKNOWN("unknown");

    private final String value;

    LandlordType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Lenient parse: anything other than "social" or "private" is UNKNOWN.
     */
    @JsonCreator
    public static LandlordType fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (LandlordType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
