package com.casebrain.infrastructure.hazard.preprocessing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses the caller-supplied first-complaint date.
 *
 * Accepted forms (tried in order):
 * - ISO date "2024-03-01" (UTC midnight)
 * - ISO instant "2024-03-01T09:30:00Z"
 * - offset date-time "2024-03-01T09:30:00+01:00"
 * - local date-time "2024-03-01T09:30:00" (read as UTC)
 *
 * Anything else is reported as absent so an invalid date never reaches deadline arithmetic.
 */
@Slf4j
@Component
public class ComplaintDateParser {

    private static final List<Function<String, Instant>> FORMATS = List.of(
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant(),
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC)
    );

    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        String trimmed = raw.strip();
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> format : FORMATS) {
            try {
                return Optional.of(format.apply(trimmed));
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }

        log.warn("[ComplaintDateParser] Unparseable first complaint date '{}', deadline treated as absent: {}",
                trimmed, lastFailure.getMessage());
        return Optional.empty();
    }
}
