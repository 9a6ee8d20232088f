package com.iimsoft.allocation.engine;

/**
 * Fatal computation error, e.g. a running sum that no longer fits its type.
 */
public class AllocationComputationException extends RuntimeException {

    public AllocationComputationException(String message) {
        super(message);
    }

    public AllocationComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
