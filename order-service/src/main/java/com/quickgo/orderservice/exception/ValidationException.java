package com.quickgo.orderservice.exception;

/**
 * Bad input detected before anything is persisted: empty cart, unknown or unavailable
 * product, invalid coordinates, restaurant not accepting orders, total mismatch.
 * HTTP Status: 400 Bad Request
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
