package com.quickgo.orderservice.model;

/**
 * Why an order is visible on the operator escalation board.
 */
public enum EscalationReason {
    // READY order found no eligible driver in the last round, retry is scheduled
    NO_DRIVER_AVAILABLE,
    // max dispatch rounds reached, needs manual assignment
    DISPATCH_EXHAUSTED,
    // PENDING longer than the confirmation SLA
    CONFIRMATION_OVERDUE
}
