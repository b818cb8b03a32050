package com.casebrain.infrastructure.hazard.preprocessing;

import com.casebrain.domain.housing.model.HazardDocument;
import com.casebrain.domain.housing.model.HazardInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the lower-cased text corpus that every lexicon and HHSRS check scans:
 * title, notes, then "name extractedText" for each document, joined by single spaces.
 * Missing parts contribute an empty string rather than being skipped.
 */
@Component
public class CorpusBuilder {

    public String build(HazardInput input) {
        List<String> parts = new ArrayList<>(input.documents().size() + 2);
        parts.add(nullToEmpty(input.caseTitle()));
        parts.add(nullToEmpty(input.notes()));
        for (HazardDocument document : input.documents()) {
            parts.add(nullToEmpty(document.name()) + " " + nullToEmpty(document.extractedText()));
        }
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
