package com.casebrain.domain.housing.model;

import java.util.List;

/**
 * @param category     detected category, null when none
 * @param hazardLabels one descriptive label when a category was found, otherwise empty
 */
public record HhsrsAssessment(
        HhsrsCategory category,
        List<String> hazardLabels
) {
    public static HhsrsAssessment none() {
        return new HhsrsAssessment(null, List.of());
    }

    public static HhsrsAssessment of(HhsrsCategory category) {
        return new HhsrsAssessment(category, List.of(category.label()));
    }

    public boolean isCategory1() {
        return category == HhsrsCategory.CATEGORY_1;
    }

    public boolean isCategory2() {
        return category == HhsrsCategory.CATEGORY_2;
    }
}
