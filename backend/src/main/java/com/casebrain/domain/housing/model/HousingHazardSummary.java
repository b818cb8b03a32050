package com.casebrain.domain.housing.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of one housing hazard evaluation.
 * {@code hhsrsCategory} and {@code awaabDeadlineDays} are null when absent; a deadline of 0
 * means the window has expired, which is not the same as no deadline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HousingHazardSummary(
        // Damp & mould
        boolean dampMouldDetected,
        List<String> dampMouldIndicators,
        Severity dampMouldSeverity,

        // Vulnerable occupants
        boolean vulnerableOccupantsDetected,
        List<String> vulnerableFactors,
        Severity vulnerabilitySeverity,

        // Health impact
        boolean healthSymptomsDetected,
        List<String> symptoms,

        // Landlord response
        boolean delayPatternsDetected,
        List<String> delayFactors,

        // HHSRS
        HhsrsCategory hhsrsCategory,
        List<String> hhsrsHazards,

        // Awaab's Law
        boolean awaabApplies,
        Severity awaabBreachRisk,
        Integer awaabDeadlineDays,

        // Overall
        Severity overallRiskLevel,
        boolean urgentAction,
        List<String> recommendations
) {
    /**
     * The "no hazard detected" baseline.
     */
    public static HousingHazardSummary empty() {
        return new HousingHazardSummary(
                false, List.of(), Severity.LOW,
                false, List.of(), Severity.LOW,
                false, List.of(),
                false, List.of(),
                null, List.of(),
                false, Severity.LOW, null,
                Severity.LOW, false, List.of());
    }
}
