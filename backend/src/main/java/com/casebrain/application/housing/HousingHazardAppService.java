package com.casebrain.application.housing;

import com.casebrain.domain.housing.model.HazardInput;
import com.casebrain.domain.housing.model.HousingHazardSummary;
import com.casebrain.domain.housing.model.IndicatorPack;
import com.casebrain.domain.housing.repository.IndicatorPackRegistry;
import com.casebrain.domain.housing.service.HazardEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Slf4j
@Service
public class HousingHazardAppService {

    private final HazardEvaluator hazardEvaluator;
    private final IndicatorPackRegistry packRegistry;
    private final Clock clock;
    private final String defaultPracticeArea;

    public HousingHazardAppService(HazardEvaluator hazardEvaluator,
                                   IndicatorPackRegistry packRegistry,
                                   Clock clock,
                                   @Value("${hazard.default-practice-area:housing_disrepair}") String defaultPracticeArea) {
        this.hazardEvaluator = hazardEvaluator;
        this.packRegistry = packRegistry;
        this.clock = clock;
        this.defaultPracticeArea = defaultPracticeArea;
    }

    public HousingHazardSummary summarize(HazardInput input) {
        return summarize(defaultPracticeArea, input);
    }

    /**
     * Evaluate the case against the lexicon registered for the practice area.
     * Without a registered lexicon the empty summary is returned.
     */
    public HousingHazardSummary summarize(String practiceArea, HazardInput input) {
        String area = practiceArea == null || practiceArea.isBlank() ? defaultPracticeArea : practiceArea;

        Optional<IndicatorPack> pack = packRegistry.findByPracticeArea(area);
        if (pack.isEmpty()) {
            log.info("[HousingHazard] No hazard pack registered for practice area '{}' (registered: {}), returning empty summary",
                    area, packRegistry.practiceAreas());
            return HousingHazardSummary.empty();
        }

        return hazardEvaluator.evaluate(input, pack.get(), clock.instant());
    }
}
