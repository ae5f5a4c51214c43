package com.quickgo.orderservice.security;

public enum ActorRole {
    CUSTOMER,
    RESTAURANT,
    DRIVER,
    ADMIN,
    // Internal callers: timer callbacks, sweeper, message listeners
    SYSTEM
}
