package com.casebrain.infrastructure.hazard.rules;

import com.casebrain.domain.housing.model.HazardInput;
import com.casebrain.domain.housing.model.IndicatorMatches;
import com.casebrain.domain.housing.model.IndicatorPack;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Literal phrase matcher over the lower-cased corpus.
 *
 * A phrase matches when it occurs anywhere in the corpus as a substring, so "damp" also
 * matches inside "dampness" and "cat" inside "category". Results keep lexicon order.
 */
@Component
public class LexiconMatcher {

    static final String CHILD = "child";
    static final String ELDERLY = "elderly";
    static final String DISABLED = "disabled";

    /**
     * @param corpus  lower-cased corpus
     * @param phrases lexicon phrases, any case
     * @return phrases contained in the corpus, in lexicon order
     */
    public List<String> match(String corpus, List<String> phrases) {
        List<String> matched = new ArrayList<>();
        for (String phrase : phrases) {
            if (corpus.contains(phrase.toLowerCase(Locale.ROOT))) {
                matched.add(phrase);
            }
        }
        return matched;
    }

    public IndicatorMatches matchAll(String corpus, IndicatorPack pack, HazardInput input) {
        List<String> vulnerable = match(corpus, pack.vulnerableOccupantFactors());
        addFlag(vulnerable, input.hasChildOccupant(), CHILD);
        addFlag(vulnerable, input.hasElderlyOccupant(), ELDERLY);
        addFlag(vulnerable, input.hasDisabledOccupant(), DISABLED);

        return new IndicatorMatches(
                List.copyOf(match(corpus, pack.dampMouldFactors())),
                List.copyOf(vulnerable),
                List.copyOf(match(corpus, pack.symptomKeywords())),
                List.copyOf(match(corpus, pack.delayPatterns())));
    }

    private static void addFlag(List<String> factors, boolean flag, String label) {
        if (flag && !factors.contains(label)) {
            factors.add(label);
        }
    }
}
