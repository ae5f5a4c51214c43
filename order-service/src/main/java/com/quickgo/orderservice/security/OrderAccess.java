package com.quickgo.orderservice.security;

import com.quickgo.orderservice.model.Order;

/**
 * Who may see or act on an order, by relationship to it.
 */
public final class OrderAccess {

    private OrderAccess() {
    }

    /**
     * Admins and the system see everything; otherwise the owning customer, the order's
     * restaurant and the assigned driver.
     */
    public static boolean canView(Order order, Actor actor) {
        return actor.isPrivileged()
                || isOwner(order, actor)
                || isOrderRestaurant(order, actor)
                || isAssignedDriver(order, actor);
    }

    public static boolean isOwner(Order order, Actor actor) {
        return actor.is(ActorRole.CUSTOMER) && order.getCustomerId().equals(actor.getUserId());
    }

    public static boolean isOrderRestaurant(Order order, Actor actor) {
        return actor.is(ActorRole.RESTAURANT) && order.getRestaurantId().equals(actor.getRestaurantId());
    }

    public static boolean isAssignedDriver(Order order, Actor actor) {
        return actor.is(ActorRole.DRIVER) && actor.getUserId().equals(order.getDriverId());
    }
}
