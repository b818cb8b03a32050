package com.casebrain.domain.housing.service;

import com.casebrain.domain.housing.model.HazardInput;
import com.casebrain.domain.housing.model.HousingHazardSummary;
import com.casebrain.domain.housing.model.IndicatorPack;

import java.time.Instant;

/**
 * Domain service for housing disrepair hazard classification (HHSRS / Awaab's Law).
 */
public interface HazardEvaluator {

    /**
     * Classify the case material against the given lexicon.
     * Pure: the result depends only on the arguments, and identical arguments give an identical summary.
     *
     * @param input case material
     * @param pack  phrase lexicon for the practice area; null yields {@link HousingHazardSummary#empty()}
     * @param now   evaluation instant used for deadline arithmetic
     * @return the hazard summary, never null
     */
    HousingHazardSummary evaluate(HazardInput input, IndicatorPack pack, Instant now);
}
