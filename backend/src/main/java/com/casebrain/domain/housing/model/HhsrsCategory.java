package com.casebrain.domain.housing.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * HHSRS hazard category. Category 1 is the most severe.
 */
public enum HhsrsCategory {
    CATEGORY_1("1", "Category 1 hazard identified"),
    CATEGORY_2("2", "Category 2 hazard identified");

    private final String code;
    private final String label;

    HhsrsCategory(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }
}
