package com.quickgo.orderservice.model;

public enum OfferOutcome {
    PENDING,
    ACCEPTED,
    REJECTED,
    EXPIRED
}
