package com.iimsoft.allocation.domain;

/**
 * Raised when input records violate the data contract (negative or fractional quantities,
 * duplicate ids, unknown tiers...). Inputs are rejected, never repaired.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
