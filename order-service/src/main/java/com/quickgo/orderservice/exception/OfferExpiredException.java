package com.quickgo.orderservice.exception;

/**
 * The offer is past its deadline or was already decided by another writer.
 * HTTP Status: 409 Conflict
 */
public class OfferExpiredException extends RuntimeException {

    public OfferExpiredException(String message) {
        super(message);
    }
}
