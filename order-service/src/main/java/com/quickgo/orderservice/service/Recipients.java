package com.quickgo.orderservice.service;

/**
 * Channel addresses understood by the push/in-app delivery side.
 */
public final class Recipients {

    public static final String OPERATORS = "operators";

    private Recipients() {
    }

    public static String customer(Long customerId) {
        return "customer:" + customerId;
    }

    public static String driver(Long driverId) {
        return "driver:" + driverId;
    }

    public static String restaurant(Long restaurantId) {
        return "restaurant:" + restaurantId;
    }
}
