package com.casebrain.domain.housing.model;

import com.casebrain.domain.housing.exception.InvalidIndicatorPackException;

import java.util.List;

/**
 * Read-only phrase lexicon for one practice area.
 *
 * @param dampMouldFactors          phrases indicating damp or mould
 * @param vulnerableOccupantFactors phrases indicating a vulnerable occupant
 * @param symptomKeywords           phrases indicating health symptoms
 * @param delayPatterns             phrases indicating landlord delay
 */
public record IndicatorPack(
        List<String> dampMouldFactors,
        List<String> vulnerableOccupantFactors,
        List<String> symptomKeywords,
        List<String> delayPatterns
) {
    public IndicatorPack {
        dampMouldFactors = requirePhrases("dampMouldFactors", dampMouldFactors);
        vulnerableOccupantFactors = requirePhrases("vulnerableOccupantFactors", vulnerableOccupantFactors);
        symptomKeywords = requirePhrases("symptomKeywords", symptomKeywords);
        delayPatterns = requirePhrases("delayPatterns", delayPatterns);
    }

    private static List<String> requirePhrases(String field, List<String> phrases) {
        if (phrases == null) {
            throw new InvalidIndicatorPackException("Indicator pack is missing phrase list: " + field);
        }
        for (int i = 0; i < phrases.size(); i++) {
            if (phrases.get(i) == null) {
                throw new InvalidIndicatorPackException(
                        String.format("Indicator pack list %s has a null phrase at index %d", field, i));
            }
        }
        return List.copyOf(phrases);
    }
}
