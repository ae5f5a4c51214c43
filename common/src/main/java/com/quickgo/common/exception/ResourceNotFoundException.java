package com.quickgo.common.exception;

/**
 * Exception thrown when an order, offer, driver record or catalog entry does not exist
 * HTTP Status: 404 Not Found (set in GlobalExceptionHandler)
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
