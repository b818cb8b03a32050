package com.casebrain.infrastructure.hazard.rules;

import com.casebrain.domain.housing.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Per-dimension severity rules. Each rule is evaluated top to bottom, first match wins.
 */
@Component
public class DimensionSeverityCalculator {

    /**
     * Damp/mould:
     *   0 indicators → LOW
     *   vulnerable occupant AND ≥ 2 → CRITICAL
     *   ≥ 3 → HIGH, ≥ 2 → MEDIUM, otherwise LOW
     */
    public Severity dampMould(int indicatorCount, boolean hasVulnerableOccupants) {
        if (indicatorCount == 0) return Severity.LOW;
        if (hasVulnerableOccupants && indicatorCount >= 2) return Severity.CRITICAL;
        if (indicatorCount >= 3) return Severity.HIGH;
        if (indicatorCount >= 2) return Severity.MEDIUM;
        return Severity.LOW;
    }

    /**
     * Vulnerability:
     *   0 factors → LOW
     *   health symptoms AND ≥ 1 → CRITICAL
     *   ≥ 2 → HIGH, otherwise MEDIUM
     */
    public Severity vulnerability(int factorCount, boolean hasHealthSymptoms) {
        if (factorCount == 0) return Severity.LOW;
        if (hasHealthSymptoms && factorCount >= 1) return Severity.CRITICAL;
        if (factorCount >= 2) return Severity.HIGH;
        return Severity.MEDIUM;
    }

    /**
     * Awaab's Law breach risk. A known deadline above 14 days falls through to the delay rule.
     *
     * @param applies       social landlord with damp/mould detected
     * @param deadlineDays  days remaining, null when no deadline could be computed
     * @param hasDelays     landlord delay patterns detected
     */
    public Severity awaabBreachRisk(boolean applies, Integer deadlineDays, boolean hasDelays) {
        if (!applies) return Severity.LOW;
        if (deadlineDays != null) {
            if (deadlineDays <= 0) return Severity.CRITICAL;
            if (deadlineDays <= 7) return Severity.HIGH;
            if (deadlineDays <= 14) return Severity.MEDIUM;
        }
        if (hasDelays) return Severity.HIGH;
        return Severity.MEDIUM;
    }
}
