package com.quickgo.orderservice.exception;

/**
 * The driver's assignment slot was taken by another order while accepting.
 * HTTP Status: 409 Conflict
 */
public class AssignmentConflictException extends RuntimeException {

    public AssignmentConflictException(String message) {
        super(message);
    }
}
