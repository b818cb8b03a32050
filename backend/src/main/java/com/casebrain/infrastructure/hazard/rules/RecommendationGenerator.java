package com.casebrain.infrastructure.hazard.rules;

import com.casebrain.domain.housing.model.HhsrsCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the recommended next steps for a housing hazard case.
 * Blocks are appended in a fixed order: damp/mould, vulnerable occupants, HHSRS, Awaab's Law, delay.
 */
@Component
public class RecommendationGenerator {

    static final String DAMP_PHOTOGRAPHS = "Obtain dated photographs of all damp and mould affected areas.";
    static final String DAMP_SURVEY = "Instruct a surveyor for HHSRS assessment if not already done.";
    static final String VULNERABLE_NEEDS = "Document vulnerable occupants and their specific needs.";
    static final String MEDICAL_EVIDENCE = "Obtain medical evidence linking health issues to conditions.";
    static final String CATEGORY_1_URGENT = "URGENT: Category 1 hazard requires immediate attention.";
    static final String CATEGORY_1_INJUNCTION = "Consider emergency injunction or local authority involvement.";
    static final String CATEGORY_2_MONITOR = "Category 2 hazard identified - monitor for escalation.";
    static final String AWAAB_DEADLINE_FORMAT = "URGENT: Awaab's Law deadline approaching (%d days remaining).";
    static final String AWAAB_COMMUNICATIONS =
            "Document all landlord communications re: damp/mould investigation and repairs.";
    static final String DELAY_RECORD = "Record all instances of landlord delay or non-response.";
    static final String DELAY_ESCALATE = "Consider escalating via pre-action protocol if delays persist.";

    public record RecommendationContext(
            boolean dampMouldDetected,
            boolean vulnerableOccupantsDetected,
            boolean healthSymptomsDetected,
            HhsrsCategory hhsrsCategory,
            boolean awaabApplies,
            Integer awaabDeadlineDays,
            boolean delayPatternsDetected
    ) {}

    public List<String> generate(RecommendationContext context) {
        List<String> recommendations = new ArrayList<>();

        if (context.dampMouldDetected()) {
            recommendations.add(DAMP_PHOTOGRAPHS);
            recommendations.add(DAMP_SURVEY);
        }

        if (context.vulnerableOccupantsDetected()) {
            recommendations.add(VULNERABLE_NEEDS);
            if (context.healthSymptomsDetected()) {
                recommendations.add(MEDICAL_EVIDENCE);
            }
        }

        if (context.hhsrsCategory() == HhsrsCategory.CATEGORY_1) {
            recommendations.add(CATEGORY_1_URGENT);
            recommendations.add(CATEGORY_1_INJUNCTION);
        } else if (context.hhsrsCategory() == HhsrsCategory.CATEGORY_2) {
            recommendations.add(CATEGORY_2_MONITOR);
        }

        if (context.awaabApplies()) {
            Integer deadlineDays = context.awaabDeadlineDays();
            if (deadlineDays != null && deadlineDays <= 7) {
                recommendations.add(String.format(AWAAB_DEADLINE_FORMAT, deadlineDays));
            }
            recommendations.add(AWAAB_COMMUNICATIONS);
        }

        if (context.delayPatternsDetected()) {
            recommendations.add(DELAY_RECORD);
            recommendations.add(DELAY_ESCALATE);
        }

        return List.copyOf(recommendations);
    }
}
