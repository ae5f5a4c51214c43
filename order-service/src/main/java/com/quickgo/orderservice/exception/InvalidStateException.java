package com.quickgo.orderservice.exception;

/**
 * Driver availability rule violated, e.g. going online while unavailable.
 * Also used for one-shot operations repeated on the same order (second rating).
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String message) {
        super(message);
    }
}
