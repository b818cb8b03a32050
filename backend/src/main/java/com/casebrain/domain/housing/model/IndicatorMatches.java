package com.casebrain.domain.housing.model;

import java.util.List;

/**
 * Phrases found in the corpus, per lexicon category, in lexicon order.
 * {@code vulnerableFactors} already includes the explicit occupant flags.
 */
public record IndicatorMatches(
        List<String> dampMouldIndicators,
        List<String> vulnerableFactors,
        List<String> symptoms,
        List<String> delayFactors
) {
    public boolean dampMouldDetected() {
        return !dampMouldIndicators.isEmpty();
    }

    public boolean vulnerableOccupantsDetected() {
        return !vulnerableFactors.isEmpty();
    }

    public boolean healthSymptomsDetected() {
        return !symptoms.isEmpty();
    }

    public boolean delayPatternsDetected() {
        return !delayFactors.isEmpty();
    }
}
