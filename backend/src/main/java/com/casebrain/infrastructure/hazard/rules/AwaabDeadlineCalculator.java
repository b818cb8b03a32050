package com.casebrain.infrastructure.hazard.rules;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Awaab's Law countdown from the first complaint.
 */
@Component
public class AwaabDeadlineCalculator {

    /** 14 days to investigate + 7 days to begin remedial works. */
    public static final int AWAAB_WINDOW_DAYS = 21;

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    /**
     * Whole days elapsed, floored (a complaint in the future gives a negative count).
     * Works on epoch seconds so any two {@link Instant}s are in range.
     */
    public long daysSinceComplaint(Instant complaint, Instant now) {
        long elapsedSeconds = now.getEpochSecond() - complaint.getEpochSecond();
        return Math.floorDiv(elapsedSeconds, SECONDS_PER_DAY);
    }

    /**
     * @return {@code max(0, 21 - daysSinceComplaint)}, capped at {@link Integer#MAX_VALUE}
     */
    public int daysRemaining(Instant complaint, Instant now) {
        long remaining = AWAAB_WINDOW_DAYS - daysSinceComplaint(complaint, now);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0, remaining));
    }
}
