package com.casebrain.domain.housing.exception;

/**
 * An indicator pack is structurally broken (missing or non-list phrase lists).
 * Signals a configuration bug, never a "no evidence" case.
 */
public class InvalidIndicatorPackException extends RuntimeException {

    public InvalidIndicatorPackException(String message) {
        super(message);
    }

    public InvalidIndicatorPackException(String message, Throwable cause) {
        super(message, cause);
    }
}
