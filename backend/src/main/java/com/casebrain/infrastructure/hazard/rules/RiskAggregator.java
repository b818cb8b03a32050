package com.casebrain.infrastructure.hazard.rules;

import com.casebrain.domain.housing.model.HhsrsCategory;
import com.casebrain.domain.housing.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Combines dimension severities and the HHSRS category into one overall level,
 * and decides whether the case needs urgent action.
 */
@Component
public class RiskAggregator {

    private static final int NO_DEADLINE_DAYS = 99;

    /**
     * Priority (first match wins):
     *   1. Category 1 → CRITICAL
     *   2. any dimension CRITICAL → CRITICAL
     *   3. any dimension HIGH → HIGH
     *   4. Category 2 → MEDIUM
     *   5. any dimension MEDIUM → MEDIUM
     *   6. LOW
     */
    public Severity overall(Severity dampMould, Severity vulnerability, Severity awaabBreachRisk,
                            HhsrsCategory category) {
        if (category == HhsrsCategory.CATEGORY_1) return Severity.CRITICAL;

        Severity worstDimension = Severity.highest(dampMould, vulnerability, awaabBreachRisk);
        if (worstDimension == Severity.CRITICAL) return Severity.CRITICAL;
        if (worstDimension == Severity.HIGH) return Severity.HIGH;
        if (category == HhsrsCategory.CATEGORY_2) return Severity.MEDIUM;
        if (worstDimension == Severity.MEDIUM) return Severity.MEDIUM;
        return Severity.LOW;
    }

    /**
     * Urgent when any of:
     *   Category 1; overall CRITICAL; Awaab applies with ≤ 7 days left;
     *   damp/mould together with a vulnerable occupant.
     * The last rule is independent of the overall level, so a MEDIUM case can still be urgent.
     */
    public boolean isUrgent(HhsrsCategory category, Severity overall, boolean awaabApplies,
                            Integer awaabDeadlineDays, boolean dampMouldDetected,
                            boolean vulnerableOccupantsDetected) {
        int deadline = awaabDeadlineDays != null ? awaabDeadlineDays : NO_DEADLINE_DAYS;

        return category == HhsrsCategory.CATEGORY_1
                || overall == Severity.CRITICAL
                || (awaabApplies && deadline <= 7)
                || (dampMouldDetected && vulnerableOccupantsDetected);
    }
}
