package com.quickgo.common.exception;

/**
 * The authenticated actor may not touch this order, offer or issue: wrong role, or not the
 * owning customer, restaurant or assigned driver. Mapped to 403.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }

    public static AccessDeniedException operatorsOnly(String action) {
        return new AccessDeniedException("Only operators can " + action);
    }
}
