package com.casebrain.interfaces.api.housing;

import com.casebrain.application.housing.HousingHazardAppService;
import com.casebrain.domain.housing.model.HousingHazardSummary;
import com.casebrain.interfaces.api.dto.HazardSummaryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/housing")
@RequiredArgsConstructor
public class HousingHazardController {

    private final HousingHazardAppService housingHazardAppService;

    @PostMapping("/hazard-summary")
    public ResponseEntity<HousingHazardSummary> hazardSummary(
            @RequestParam(name = "practiceArea", required = false) String practiceArea,
            @Valid @RequestBody HazardSummaryRequest request) {
        HousingHazardSummary summary = housingHazardAppService.summarize(practiceArea, request.toInput());
        return ResponseEntity.ok(summary);
    }
}
