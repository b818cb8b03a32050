package com.casebrain.domain.housing.model;

/**
 * Ordinal risk level shared by every hazard dimension.
 * Order is LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL and is defined by {@link #rank()}, never by name.
 */
public enum Severity {
    LOW(0),
    MEDIUM(1),
    HIGH(2),
    CRITICAL(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(Severity other) {
        return rank >= other.rank;
    }

    public boolean isHigherThan(Severity other) {
        return rank > other.rank;
    }

    public Severity max(Severity other) {
        return other.rank > rank ? other : this;
    }

    public static Severity highest(Severity... severities) {
        Severity result = LOW;
        for (Severity severity : severities) {
            result = result.max(severity);
        }
        return result;
    }
}
