package com.casebrain.interfaces.api.dto;

import com.casebrain.domain.housing.model.HazardDocument;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record HazardDocumentRequest(
        @NotNull(message = "Document name is required")
        @Size(max = 500, message = "Document name must not exceed 500 characters")
        String name,

        @Size(max = 100, message = "Document type must not exceed 100 characters")
        String type,

        String extractedText
) {
    public HazardDocument toDocument() {
        return new HazardDocument(name, type, extractedText);
    }
}
