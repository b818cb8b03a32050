package com.casebrain.infrastructure.hazard.rules;

import com.casebrain.domain.housing.model.HhsrsAssessment;
import com.casebrain.domain.housing.model.HhsrsCategory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detects an explicit HHSRS category mentioned in the corpus.
 * Category 1 wins whenever both categories are mentioned.
 */
@Component
public class HhsrsClassifier {

    private static final List<String> CATEGORY_1_MARKERS = List.of("category 1", "cat 1", "cat1");
    private static final List<String> CATEGORY_2_MARKERS = List.of("category 2", "cat 2", "cat2");

    public HhsrsAssessment classify(String corpus) {
        if (containsAny(corpus, CATEGORY_1_MARKERS)) {
            return HhsrsAssessment.of(HhsrsCategory.CATEGORY_1);
        }
        if (containsAny(corpus, CATEGORY_2_MARKERS)) {
            return HhsrsAssessment.of(HhsrsCategory.CATEGORY_2);
        }
        return HhsrsAssessment.none();
    }

    private static boolean containsAny(String corpus, List<String> markers) {
        return markers.stream().anyMatch(corpus::contains);
    }
}
