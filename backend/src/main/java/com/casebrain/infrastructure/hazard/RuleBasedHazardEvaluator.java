package com.casebrain.infrastructure.hazard;

import com.casebrain.domain.housing.model.*;
import com.casebrain.domain.housing.service.HazardEvaluator;
import com.casebrain.infrastructure.hazard.preprocessing.ComplaintDateParser;
import com.casebrain.infrastructure.hazard.preprocessing.CorpusBuilder;
import com.casebrain.infrastructure.hazard.rules.AwaabDeadlineCalculator;
import com.casebrain.infrastructure.hazard.rules.DimensionSeverityCalculator;
import com.casebrain.infrastructure.hazard.rules.HhsrsClassifier;
import com.casebrain.infrastructure.hazard.rules.LexiconMatcher;
import com.casebrain.infrastructure.hazard.rules.RecommendationGenerator;
import com.casebrain.infrastructure.hazard.rules.RecommendationGenerator.RecommendationContext;
import com.casebrain.infrastructure.hazard.rules.RiskAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Rule-based hazard evaluation:
 * corpus → lexicon matches → HHSRS category → Awaab deadline → dimension severities
 * → overall level / urgency → recommendations.
 *
 * Stateless; safe to call concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleBasedHazardEvaluator implements HazardEvaluator {

    private final CorpusBuilder corpusBuilder;
    private final ComplaintDateParser complaintDateParser;
    private final LexiconMatcher lexiconMatcher;
    private final HhsrsClassifier hhsrsClassifier;
    private final AwaabDeadlineCalculator deadlineCalculator;
    private final DimensionSeverityCalculator severityCalculator;
    private final RiskAggregator riskAggregator;
    private final RecommendationGenerator recommendationGenerator;

    @Override
    public HousingHazardSummary evaluate(HazardInput input, IndicatorPack pack, Instant now) {
        if (pack == null) {
            log.info("[HazardEvaluator] No indicator pack supplied, returning empty summary");
            return HousingHazardSummary.empty();
        }

        // 1. Corpus + lexicon matching
        String corpus = corpusBuilder.build(input);
        IndicatorMatches matches = lexiconMatcher.matchAll(corpus, pack, input);

        // 2. HHSRS category
        HhsrsAssessment hhsrs = hhsrsClassifier.classify(corpus);

        // 3. Awaab's Law: social landlord + damp/mould only
        boolean awaabApplies = input.landlordType() == LandlordType.SOCIAL && matches.dampMouldDetected();
        Integer deadlineDays = awaabApplies ? deadlineDays(input, now) : null;

        // 4. Dimension severities
        Severity dampMouldSeverity = severityCalculator.dampMould(
                matches.dampMouldIndicators().size(), matches.vulnerableOccupantsDetected());
        Severity vulnerabilitySeverity = severityCalculator.vulnerability(
                matches.vulnerableFactors().size(), matches.healthSymptomsDetected());
        Severity awaabBreachRisk = severityCalculator.awaabBreachRisk(
                awaabApplies, deadlineDays, matches.delayPatternsDetected());

        // 5. Aggregate
        Severity overall = riskAggregator.overall(
                dampMouldSeverity, vulnerabilitySeverity, awaabBreachRisk, hhsrs.category());
        boolean urgent = riskAggregator.isUrgent(hhsrs.category(), overall, awaabApplies, deadlineDays,
                matches.dampMouldDetected(), matches.vulnerableOccupantsDetected());

        // 6. Recommendations
        List<String> recommendations = recommendationGenerator.generate(new RecommendationContext(
                matches.dampMouldDetected(),
                matches.vulnerableOccupantsDetected(),
                matches.healthSymptomsDetected(),
                hhsrs.category(),
                awaabApplies,
                deadlineDays,
                matches.delayPatternsDetected()));

        log.info("[HazardEvaluator] overall={}, urgent={}, damp={}, vulnerability={}, awaab={} (applies={}, days={}), hhsrs={}, recommendations={}",
                overall, urgent, dampMouldSeverity, vulnerabilitySeverity, awaabBreachRisk,
                awaabApplies, deadlineDays, hhsrs.category() == null ? "none" : hhsrs.category().code(),
                recommendations.size());
        log.debug("[HazardEvaluator] damp={}, vulnerable={}, symptoms={}, delays={}",
                matches.dampMouldIndicators(), matches.vulnerableFactors(),
                matches.symptoms(), matches.delayFactors());

        return new HousingHazardSummary(
                matches.dampMouldDetected(),
                matches.dampMouldIndicators(),
                dampMouldSeverity,
                matches.vulnerableOccupantsDetected(),
                matches.vulnerableFactors(),
                vulnerabilitySeverity,
                matches.healthSymptomsDetected(),
                matches.symptoms(),
                matches.delayPatternsDetected(),
                matches.delayFactors(),
                hhsrs.category(),
                hhsrs.hazardLabels(),
                awaabApplies,
                awaabBreachRisk,
                deadlineDays,
                overall,
                urgent,
                recommendations);
    }

    private Integer deadlineDays(HazardInput input, Instant now) {
        return complaintDateParser.parse(input.firstComplaintDate())
                .map(complaint -> deadlineCalculator.daysRemaining(complaint, now))
                .orElse(null);
    }
}
