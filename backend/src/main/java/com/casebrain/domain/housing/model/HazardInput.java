package com.casebrain.domain.housing.model;

import lombok.Builder;

import java.util.List;

/**
 * Case material for one hazard evaluation.
 *
 * @param caseTitle          short case title, part of the corpus
 * @param documents          documents in case order (never null)
 * @param notes              free-text notes (nullable)
 * @param landlordType       landlord type, only SOCIAL enables Awaab's Law (never null)
 * @param firstComplaintDate raw first-complaint date as supplied, ISO date or date-time (nullable)
 * @param hasChildOccupant    explicit child occupant flag
 * @param hasElderlyOccupant  explicit elderly occupant flag
 * @param hasDisabledOccupant explicit disabled occupant flag
 */
@Builder
public record HazardInput(
        String caseTitle,
        List<HazardDocument> documents,
        String notes,
        LandlordType landlordType,
        String firstComplaintDate,
        boolean hasChildOccupant,
        boolean hasElderlyOccupant,
        boolean hasDisabledOccupant
) {
    public HazardInput {
        documents = documents == null ? List.of() : List.copyOf(documents);
        landlordType = landlordType == null ? LandlordType.UNKNOWN : landlordType;
    }
}
