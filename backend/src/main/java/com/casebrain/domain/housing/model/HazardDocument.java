package com.casebrain.domain.housing.model;

/**
 * A case document whose text has already been extracted upstream.
 *
 * @param name          document name, always part of the corpus
 * @param type          optional document type (nullable, not used for matching)
 * @param extractedText optional extracted text (nullable)
 */
public record HazardDocument(
        String name,
        String type,
        String extractedText
) {}
