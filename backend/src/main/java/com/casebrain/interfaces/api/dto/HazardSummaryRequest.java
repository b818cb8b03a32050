package com.casebrain.interfaces.api.dto;

import com.casebrain.domain.housing.model.HazardInput;
import com.casebrain.domain.housing.model.LandlordType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Objects;

public record HazardSummaryRequest(
        @Size(max = 500, message = "Case title must not exceed 500 characters")
        String caseTitle,

        @Valid
        @Size(max = 200, message = "At most 200 documents can be assessed at once")
        List<HazardDocumentRequest> documents,

        @Size(max = 20000, message = "Notes must not exceed 20000 characters")
        String notes,

        LandlordType landlordType,

        String firstComplaintDate,

        Boolean hasChildOccupant,
        Boolean hasElderlyOccupant,
        Boolean hasDisabledOccupant
) {
    public HazardInput toInput() {
        return HazardInput.builder()
                .caseTitle(caseTitle)
                .documents(documents == null ? List.of()
                        : documents.stream()
                                .filter(Objects::nonNull)
                                .map(HazardDocumentRequest::toDocument)
                                .toList())
                .notes(notes)
                .landlordType(landlordType)
                .firstComplaintDate(firstComplaintDate)
                .hasChildOccupant(Boolean.TRUE.equals(hasChildOccupant))
                .hasElderlyOccupant(Boolean.TRUE.equals(hasElderlyOccupant))
                .hasDisabledOccupant(Boolean.TRUE.equals(hasDisabledOccupant))
                .build();
    }
}
