package com.quickgo.orderservice.model;

public enum IssueType {
    TRAFFIC,
    WEATHER,
    VEHICLE,
    ACCIDENT,
    WRONG_ADDRESS,
    CUSTOMER_ISSUE,
    RESTAURANT_DELAY,
    OTHER
}
