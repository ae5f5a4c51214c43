package com.quickgo.orderservice.service;

import com.quickgo.common.exception.AccessDeniedException;
import com.quickgo.common.exception.ResourceNotFoundException;
import com.quickgo.orderservice.dto.DeliveryLocationResponse;
import com.quickgo.orderservice.dto.DeliveryTrackingResponse;
import com.quickgo.orderservice.dto.DriverStatisticsResponse;
import com.quickgo.orderservice.exception.ValidationException;
import com.quickgo.orderservice.mapper.DispatchMapper;
import com.quickgo.orderservice.mapper.OrderMapper;
import com.quickgo.orderservice.model.DeliveryLocation;
import com.quickgo.orderservice.model.DriverAvailability;
import com.quickgo.orderservice.model.GeoPoint;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.repository.DeliveryLocationRepository;
import com.quickgo.orderservice.repository.DriverAvailabilityRepository;
import com.quickgo.orderservice.repository.OrderRepository;
import com.quickgo.orderservice.repository.OrderStatusHistoryRepository;
import com.quickgo.orderservice.security.Actor;
import com.quickgo.orderservice.security.ActorRole;
import com.quickgo.orderservice.security.OrderAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read side of a delivery in progress: where the driver is, the trail so far and
 * per-driver delivery figures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryTrackingService {

    static final int DEFAULT_TRAIL_LIMIT = 50;
    static final int MAX_TRAIL_LIMIT = 500;

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final DeliveryLocationRepository deliveryLocationRepository;
    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final OrderMapper orderMapper;
    private final DispatchMapper dispatchMapper;
    private final TimerService timerService;

    @Transactional(readOnly = true)
    public DeliveryTrackingResponse getTracking(Long orderId, Actor actor) {
        Order order = findVisibleOrder(orderId, actor);
        Instant now = timerService.now();

        DeliveryTrackingResponse response = new DeliveryTrackingResponse();
        response.setOrderId(order.getId());
        response.setOrderNumber(order.getOrderNumber());
        response.setStatus(order.getStatus());
        response.setDriverId(order.getDriverId());
        response.setPickupLocation(order.getPickupLocation());
        response.setDeliveryAddress(order.getDeliveryAddress());
        response.setEstimatedDeliveryTime(order.getEstimatedDeliveryTime());
        response.setDelayed(order.isDelayed(now));
        response.setTimeline(orderMapper.toStatusHistoryResponses(
                historyRepository.findByOrderIdOrderByCreatedAtAscIdAsc(order.getId())));

        // the position stops being shared once the order is closed
        if (order.getDriverId() != null && !order.getStatus().isTerminal()) {
            currentDriverLocation(order).ifPresent(location -> {
                response.setDriverLocation(location);
                GeoPoint destination = GeoPoint.of(order.getDeliveryAddress().getLatitude(),
                        order.getDeliveryAddress().getLongitude());
                double km = GeoUtils.distanceKm(GeoPoint.of(location.getLatitude(), location.getLongitude()), destination);
                response.setDistanceToDestinationKm(Math.round(km * 100.0) / 100.0);
            });
        }
        return response;
    }

    /**
     * The order's GPS trail, newest fix first.
     */
    @Transactional(readOnly = true)
    public List<DeliveryLocationResponse> getLocations(Long orderId, Integer limit, Actor actor) {
        int size = limit == null ? DEFAULT_TRAIL_LIMIT : limit;
        if (size < 1 || size > MAX_TRAIL_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_TRAIL_LIMIT);
        }
        Order order = findVisibleOrder(orderId, actor);
        return deliveryLocationRepository.findByOrderIdOrderByRecordedAtDescIdDesc(order.getId(), PageRequest.of(0, size))
                .stream()
                .map(dispatchMapper::toLocationResponse)
                .toList();
    }

    /**
     * Delivery figures for one driver. Drivers see their own, operators anyone's.
     */
    @Transactional(readOnly = true)
    public DriverStatisticsResponse getDriverStatistics(Long driverId, Actor actor) {
        boolean self = actor.is(ActorRole.DRIVER) && driverId.equals(actor.getUserId());
        if (!self && !actor.isPrivileged()) {
            throw AccessDeniedException.operatorsOnly("view another driver's statistics");
        }
        DriverAvailability driver = driverAvailabilityRepository.findById(driverId)
                .orElseThrow(() -> new ResourceNotFoundException("No availability record for driver: " + driverId));

        Instant startOfDay = timerService.now().truncatedTo(ChronoUnit.DAYS);
        List<Order> delivered = orderRepository.findByDriverIdAndStatusInOrderByCreatedAtDesc(
                driverId, EnumSet.of(OrderStatus.DELIVERED));
        List<Order> deliveredToday = delivered.stream()
                .filter(o -> o.getDeliveredAt() != null && !o.getDeliveredAt().isBefore(startOfDay))
                .toList();

        DriverStatisticsResponse stats = new DriverStatisticsResponse();
        stats.setDriverId(driverId);
        stats.setTotalDeliveries(driver.getTotalDeliveries());
        stats.setActiveDeliveries(orderRepository.countByDriverIdAndStatusIn(driverId, OrderStatus.activeStatuses()));
        stats.setDeliveriesToday(deliveredToday.size());
        stats.setTipsEarned(sumTips(delivered));
        stats.setTipsToday(sumTips(deliveredToday));
        stats.setAverageDeliveryMinutes(averageDeliveryMinutes(delivered));

        log.debug("Driver statistics computed: driverId={}, total={}, today={}",
                driverId, stats.getTotalDeliveries(), stats.getDeliveriesToday());
        return stats;
    }

    private Optional<DeliveryLocationResponse> currentDriverLocation(Order order) {
        List<DeliveryLocation> latest = deliveryLocationRepository.findByOrderIdOrderByRecordedAtDescIdDesc(
                order.getId(), PageRequest.of(0, 1));
        if (!latest.isEmpty()) {
            return Optional.of(dispatchMapper.toLocationResponse(latest.get(0)));
        }
        // no fix since the assignment yet, fall back to the last known position
        return driverAvailabilityRepository.findById(order.getDriverId())
                .filter(DriverAvailability::hasLocation)
                .map(driver -> {
                    DeliveryLocationResponse location = new DeliveryLocationResponse();
                    location.setLatitude(driver.getLatitude());
                    location.setLongitude(driver.getLongitude());
                    location.setRecordedAt(driver.getLocationUpdatedAt());
                    return location;
                });
    }

    private Order findVisibleOrder(Long orderId, Actor actor) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));
        if (!OrderAccess.canView(order, actor)) {
            throw new AccessDeniedException("You do not have permission to track this order");
        }
        return order;
    }

    private static BigDecimal sumTips(List<Order> orders) {
        return orders.stream()
                .map(Order::getTip)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(Order.MONEY_SCALE);
    }

    private static Double averageDeliveryMinutes(List<Order> orders) {
        OptionalDouble seconds = orders.stream()
                .filter(o -> o.getAssignedAt() != null && o.getDeliveredAt() != null)
                .mapToLong(o -> Duration.between(o.getAssignedAt(), o.getDeliveredAt()).toSeconds())
                .average();
        // minutes, one decimal
        return seconds.isPresent() ? Math.round(seconds.getAsDouble() / 6.0) / 10.0 : null;
    }
}
