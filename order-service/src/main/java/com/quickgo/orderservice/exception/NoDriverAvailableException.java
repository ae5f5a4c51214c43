package com.quickgo.orderservice.exception;

/**
 * Internal signal: no eligible driver for an operator-requested assignment.
 * Customers never see it; their order just stays READY.
 * HTTP Status: 409 Conflict (operator endpoints only)
 */
public class NoDriverAvailableException extends RuntimeException {

    public NoDriverAvailableException(String message) {
        super(message);
    }
}
