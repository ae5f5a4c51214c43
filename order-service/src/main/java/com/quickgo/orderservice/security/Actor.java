package com.quickgo.orderservice.security;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Who is asking. Services receive an Actor instead of the raw JWT.
 */
@Getter
@ToString
@AllArgsConstructor
public class Actor {

    private static final Actor SYSTEM = new Actor(null, ActorRole.SYSTEM, null);

    private final Long userId;
    private final ActorRole role;

    // Only set for RESTAURANT staff
    private final Long restaurantId;

    public static Actor system() {
        return SYSTEM;
    }

    public static Actor customer(Long userId) {
        return new Actor(userId, ActorRole.CUSTOMER, null);
    }

    public static Actor driver(Long userId) {
        return new Actor(userId, ActorRole.DRIVER, null);
    }

    public static Actor restaurant(Long userId, Long restaurantId) {
        return new Actor(userId, ActorRole.RESTAURANT, restaurantId);
    }

    public static Actor admin(Long userId) {
        return new Actor(userId, ActorRole.ADMIN, null);
    }

    public boolean is(ActorRole expected) {
        return role == expected;
    }

    public boolean isPrivileged() {
        return role == ActorRole.ADMIN || role == ActorRole.SYSTEM;
    }
}
