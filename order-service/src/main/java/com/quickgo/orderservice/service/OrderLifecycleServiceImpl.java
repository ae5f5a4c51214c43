package com.quickgo.orderservice.service;

import com.quickgo.common.exception.AccessDeniedException;
import com.quickgo.common.exception.ResourceNotFoundException;
import com.quickgo.orderservice.dto.CreateOrderRequest;
import com.quickgo.orderservice.dto.OrderItemRequest;
import com.quickgo.orderservice.dto.OrderResponse;
import com.quickgo.orderservice.dto.RatingRequest;
import com.quickgo.orderservice.dto.RatingResponse;
import com.quickgo.orderservice.dto.TransitionMetadata;
import com.quickgo.orderservice.exception.InvalidStateException;
import com.quickgo.orderservice.exception.InvalidTransitionException;
import com.quickgo.orderservice.exception.NotCancellableException;
import com.quickgo.orderservice.exception.OrderNotReadyException;
import com.quickgo.orderservice.exception.ValidationException;
import com.quickgo.orderservice.mapper.OrderMapper;
import com.quickgo.orderservice.model.CancellationReason;
import com.quickgo.orderservice.model.DeliveryAddress;
import com.quickgo.orderservice.model.DispatchOffer;
import com.quickgo.orderservice.model.EscalationReason;
import com.quickgo.orderservice.model.GeoPoint;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderItem;
import com.quickgo.orderservice.model.OrderRating;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.model.OrderStatusHistory;
import com.quickgo.orderservice.model.PaymentMethod;
import com.quickgo.orderservice.model.ProductSnapshot;
import com.quickgo.orderservice.model.RestaurantSnapshot;
import com.quickgo.orderservice.repository.DispatchOfferRepository;
import com.quickgo.orderservice.repository.OrderRatingRepository;
import com.quickgo.orderservice.repository.OrderRepository;
import com.quickgo.orderservice.repository.OrderStatusHistoryRepository;
import com.quickgo.orderservice.repository.ProductSnapshotRepository;
import com.quickgo.orderservice.repository.RestaurantSnapshotRepository;
import com.quickgo.orderservice.security.Actor;
import com.quickgo.orderservice.security.ActorRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.quickgo.orderservice.security.OrderAccess.canView;
import static com.quickgo.orderservice.security.OrderAccess.isAssignedDriver;
import static com.quickgo.orderservice.security.OrderAccess.isOrderRestaurant;
import static com.quickgo.orderservice.security.OrderAccess.isOwner;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLifecycleServiceImpl implements OrderLifecycleService {

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final OrderRatingRepository ratingRepository;
    private final ProductSnapshotRepository productSnapshotRepository;
    private final RestaurantSnapshotRepository restaurantSnapshotRepository;
    private final DispatchOfferRepository offerRepository;
    private final DriverAvailabilityService driverAvailabilityService;
    private final DispatchService dispatchService;
    private final PricingService pricingService;
    private final OrderNumberGenerator orderNumberGenerator;
    private final NotificationDispatcher notificationDispatcher;
    private final TimerService timerService;
    private final OrderMapper orderMapper;

    @Autowired
    @Lazy
    private OrderLifecycleServiceImpl self;

    @Override
    @Transactional
    public OrderResponse create(CreateOrderRequest request, Actor actor) {
        if (!actor.is(ActorRole.CUSTOMER)) {
            throw new AccessDeniedException("Only customers can place orders");
        }
        log.info("Order creation started: customerId={}, restaurantId={}", actor.getUserId(), request.getRestaurantId());

        if (request.getItems() == null || request.getItems().isEmpty()) {
            throw new ValidationException("Order must contain at least one item");
        }
        validateDeliveryAddress(request.getDeliveryAddress());

        RestaurantSnapshot restaurant = restaurantSnapshotRepository.findById(request.getRestaurantId())
                .orElseThrow(() -> new ResourceNotFoundException("Restaurant not found: " + request.getRestaurantId()));
        if (!restaurant.isAcceptingOrders()) {
            log.warn("Restaurant not accepting orders: restaurantId={}", restaurant.getRestaurantId());
            throw new ValidationException("Restaurant is not accepting orders: " + restaurant.getName());
        }

        BigDecimal tip = request.getTip() == null ? BigDecimal.ZERO : request.getTip();
        if (tip.signum() < 0) {
            throw new ValidationException("Tip cannot be negative");
        }

        Instant now = timerService.now();
        Order order = new Order();
        order.setCustomerId(actor.getUserId());
        order.setRestaurantId(restaurant.getRestaurantId());
        order.setDeliveryAddress(request.getDeliveryAddress());
        order.setPickupLocation(restaurant.location());
        order.setPaymentMethod(request.getPaymentMethod() == null ? PaymentMethod.CASH : request.getPaymentMethod());
        order.setSpecialInstructions(request.getSpecialInstructions());
        order.setStatus(OrderStatus.PENDING);
        order.setCreatedAt(now);
        order.setOrderNumber(orderNumberGenerator.next(now));

        buildItems(request.getItems(), restaurant.getRestaurantId()).forEach(order::addItem);
        pricingService.price(order, restaurant, tip);

        if (order.getTotal().signum() < 0) {
            throw new ValidationException("Order total cannot be negative");
        }
        if (request.getExpectedTotal() != null && request.getExpectedTotal().compareTo(order.getTotal()) != 0) {
            log.warn("Total mismatch: expected={}, computed={}, customerId={}",
                    request.getExpectedTotal(), order.getTotal(), actor.getUserId());
            throw new ValidationException("Expected total " + request.getExpectedTotal()
                    + " does not match computed total " + order.getTotal());
        }

        GeoPoint destination = GeoPoint.of(request.getDeliveryAddress().getLatitude(),
                request.getDeliveryAddress().getLongitude());
        order.setEstimatedDeliveryTime(pricingService.estimateDeliveryTime(now, restaurant, destination));

        Order saved = orderRepository.save(order);
        appendHistory(saved, OrderStatus.PENDING, actor, "Order placed", now);
        log.info("Order created: orderId={}, orderNumber={}, total={}", saved.getId(), saved.getOrderNumber(),
                saved.getTotal());

        notificationDispatcher.notify(Recipients.restaurant(saved.getRestaurantId()),
                NotificationEventType.ORDER_CREATED, saved);
        notificationDispatcher.notify(Recipients.customer(saved.getCustomerId()),
                NotificationEventType.ORDER_CREATED, saved);

        return toResponse(saved);
    }

    @Override
    public OrderResponse transition(Long orderId, OrderStatus targetStatus, Actor actor, TransitionMetadata metadata) {
        TransitionResult result;
        try {
            result = self.applyTransition(orderId, targetStatus, actor,
                    metadata == null ? TransitionMetadata.empty() : metadata);
        } catch (OptimisticLockingFailureException e) {
            // A concurrent writer won; identical target means the request already took effect
            OrderResponse latest = self.getOrder(orderId, Actor.system());
            if (latest.getStatus() != targetStatus) {
                throw e;
            }
            log.info("Concurrent duplicate transition resolved as no-op: orderId={}, status={}, actorRole={}",
                    orderId, targetStatus, actor.getRole());
            return latest;
        }

        if (result.isChanged() && targetStatus == OrderStatus.READY) {
            try {
                dispatchService.requestDispatch(orderId);
            } catch (Exception e) {
                // Order stays READY, the sweeper re-dispatches stalled orders
                log.error("Dispatch trigger failed after READY: orderId={}, error={}", orderId, e.getMessage(), e);
            }
        }
        return result.getOrder();
    }

    /**
     * Validates and applies one status change as a single versioned write.
     * Side effects that run bulk updates (offer withdrawal, driver release) come last,
     * after the response is built, because they clear the persistence context.
     */
    @Transactional
    public TransitionResult applyTransition(Long orderId, OrderStatus target, Actor actor, TransitionMetadata metadata) {
        Order order = findOrder(orderId);
        OrderStatus current = order.getStatus();

        if (current == target) {
            log.info("Transition is a no-op, order already in target status: orderId={}, status={}", orderId, target);
            return new TransitionResult(toResponse(order), false);
        }
        if (target == OrderStatus.CANCELLED && !order.canBeCancelled()) {
            log.warn("Rejected cancellation: orderId={}, status={}, actorRole={}",
                    orderId, current, actor.getRole());
            throw new NotCancellableException(orderId, current);
        }
        if (!current.canTransitionTo(target)) {
            log.warn("Rejected transition: orderId={}, from={}, to={}, actorRole={}",
                    orderId, current, target, actor.getRole());
            throw new InvalidTransitionException(orderId, current, target);
        }
        authorizeTransition(order, target, actor);
        if (target == OrderStatus.PICKED_UP && order.getDriverId() == null) {
            throw new OrderNotReadyException("Order " + orderId + " has no assigned driver yet");
        }

        Instant now = timerService.now();
        order.applyStatus(target, now);

        switch (target) {
            case CONFIRMED -> {
                if (order.getEscalationReason() == EscalationReason.CONFIRMATION_OVERDUE) {
                    order.clearEscalation();
                }
            }
            case CANCELLED -> {
                order.setCancellationReason(metadata.getCancellationReason() != null
                        ? metadata.getCancellationReason()
                        : CancellationReason.OTHER);
                order.setCancellationNotes(metadata.getCancellationNotes());
                order.clearEscalation();
            }
            case DELIVERED -> {
                if (order.getPaymentMethod() == PaymentMethod.CASH && !order.isPaid()) {
                    order.setPaid(true);
                    order.setPaidAt(now);
                }
            }
            default -> {
                // timestamp only
            }
        }

        Order saved = orderRepository.saveAndFlush(order);
        appendHistory(saved, target, actor, historyNotes(target, metadata), now);
        log.info("Order transitioned: orderId={}, from={}, to={}, actorRole={}, actorId={}",
                orderId, current, target, actor.getRole(), actor.getUserId());

        OrderResponse response = toResponse(saved);
        notifyStatusChange(saved);

        Long driverId = saved.getDriverId();
        if (target == OrderStatus.CANCELLED) {
            List<DispatchOffer> pending = offerRepository.findByOrderIdOrderByOfferedAtAsc(orderId).stream()
                    .filter(DispatchOffer::isPending)
                    .toList();
            pending.forEach(offer -> notificationDispatcher.notify(Recipients.driver(offer.getDriverId()),
                    NotificationEventType.OFFER_WITHDRAWN, saved, Map.of("offerId", offer.getId())));

            int withdrawn = offerRepository.expirePendingForOrder(orderId, now);
            if (withdrawn > 0) {
                log.info("Outstanding offers withdrawn on cancel: orderId={}, count={}", orderId, withdrawn);
            }
            if (driverId != null) {
                driverAvailabilityService.releaseAssignment(driverId, orderId);
            }
        } else if (target == OrderStatus.DELIVERED && driverId != null) {
            driverAvailabilityService.completeAssignment(driverId, orderId);
        }

        return new TransitionResult(response, true);
    }

    @Override
    public OrderResponse cancel(Long orderId, CancellationReason reason, String notes, Actor actor) {
        TransitionMetadata metadata = TransitionMetadata.builder()
                .notes(notes)
                .cancellationReason(reason)
                .cancellationNotes(notes)
                .build();
        return transition(orderId, OrderStatus.CANCELLED, actor, metadata);
    }

    @Override
    @Transactional
    public RatingResponse recordRating(Long orderId, RatingRequest request, Actor actor) {
        Order order = findOrder(orderId);

        if (!actor.is(ActorRole.CUSTOMER) || !order.getCustomerId().equals(actor.getUserId())) {
            throw new AccessDeniedException("Only the customer who placed the order can rate it");
        }
        if (order.getStatus() != OrderStatus.DELIVERED) {
            throw new InvalidStateException("Only delivered orders can be rated, current status: " + order.getStatus());
        }
        if (ratingRepository.existsByOrderId(orderId)) {
            throw new InvalidStateException("Order " + orderId + " has already been rated");
        }

        OrderRating rating = OrderRating.builder()
                .orderId(orderId)
                .customerId(order.getCustomerId())
                .driverId(order.getDriverId())
                .overallRating(request.getOverallRating())
                .foodRating(request.getFoodRating())
                .deliveryRating(request.getDeliveryRating())
                .driverRating(order.getDriverId() != null ? request.getDriverRating() : null)
                .driverComment(order.getDriverId() != null ? request.getDriverComment() : null)
                .comment(request.getComment())
                .wouldOrderAgain(request.isWouldOrderAgain())
                .createdAt(timerService.now())
                .build();

        OrderRating saved = ratingRepository.save(rating);
        log.info("Order rated: orderId={}, overall={}", orderId, saved.getOverallRating());
        return orderMapper.toRatingResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrder(Long orderId, Actor actor) {
        Order order = findOrder(orderId);
        if (!canView(order, actor)) {
            throw new AccessDeniedException("You do not have permission to view this order");
        }
        return toResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getActiveOrders(Actor actor) {
        return findForActor(actor, OrderStatus.activeStatuses()).stream()
                .map(this::toResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getHistory(Actor actor) {
        return findForActor(actor, OrderStatus.terminalStatuses()).stream()
                .map(this::toResponse)
                .toList();
    }

    @Override
    @Transactional
    public OrderResponse markPaid(Long orderId, Actor actor) {
        Order order = findOrder(orderId);

        boolean owner = actor.is(ActorRole.CUSTOMER) && order.getCustomerId().equals(actor.getUserId());
        if (!owner && !actor.isPrivileged()) {
            throw new AccessDeniedException("You do not have permission to pay for this order");
        }
        if (order.getStatus() == OrderStatus.CANCELLED) {
            throw new InvalidStateException("Cancelled orders cannot be paid");
        }
        if (order.isPaid()) {
            log.info("Order already paid, nothing to do: orderId={}", orderId);
            return toResponse(order);
        }

        order.setPaid(true);
        order.setPaidAt(timerService.now());
        Order saved = orderRepository.save(order);
        log.info("Order marked paid: orderId={}, method={}", orderId, saved.getPaymentMethod());
        return toResponse(saved);
    }

    @Override
    @Transactional
    public boolean flagConfirmationOverdue(Long orderId) {
        Order order = findOrder(orderId);
        if (order.getStatus() != OrderStatus.PENDING || order.isEscalated()) {
            return false;
        }

        order.escalate(EscalationReason.CONFIRMATION_OVERDUE, timerService.now());
        Order saved = orderRepository.save(order);

        Map<String, Object> payload = Map.of("createdAt", saved.getCreatedAt());
        notificationDispatcher.notify(Recipients.OPERATORS, NotificationEventType.CONFIRMATION_OVERDUE, saved, payload);
        notificationDispatcher.notify(Recipients.restaurant(saved.getRestaurantId()),
                NotificationEventType.CONFIRMATION_OVERDUE, saved, payload);
        log.warn("Order waiting too long for confirmation: orderId={}, createdAt={}", orderId, saved.getCreatedAt());
        return true;
    }

    private List<OrderItem> buildItems(List<OrderItemRequest> requests, Long restaurantId) {
        List<Long> productIds = requests.stream().map(OrderItemRequest::getProductId).toList();

        // Single query for the whole cart
        Map<Long, ProductSnapshot> products = productSnapshotRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(ProductSnapshot::getProductId, Function.identity()));

        return requests.stream().map(line -> {
            ProductSnapshot product = products.get(line.getProductId());
            if (product == null) {
                log.warn("Product not found in local snapshot: productId={}", line.getProductId());
                throw new ValidationException("Product not found: " + line.getProductId());
            }
            if (!product.getRestaurantId().equals(restaurantId)) {
                throw new ValidationException("Product " + line.getProductId()
                        + " does not belong to restaurant " + restaurantId);
            }
            if (!product.isAvailable()) {
                throw new ValidationException("Product is not available: " + product.getName());
            }
            if (product.getPrice() == null || product.getPrice().signum() < 0) {
                throw new ValidationException("Product has an invalid price: " + product.getName());
            }
            if (line.getQuantity() == null || line.getQuantity() < 1) {
                throw new ValidationException("Quantity must be at least 1 for product " + line.getProductId());
            }

            OrderItem item = new OrderItem();
            item.setProductId(product.getProductId());
            item.setProductName(product.getName());
            item.setUnitPrice(product.getPrice());
            item.setQuantity(line.getQuantity());
            item.setCustomizations(line.getCustomizations());
            item.setSpecialNotes(line.getSpecialNotes());
            return item;
        }).toList();
    }

    private void validateDeliveryAddress(DeliveryAddress address) {
        if (address == null || address.getAddress() == null || address.getAddress().isBlank()) {
            throw new ValidationException("Delivery address is required");
        }
        if (!GeoPoint.isValid(address.getLatitude(), address.getLongitude())) {
            throw new ValidationException("Delivery coordinates out of range: lat="
                    + address.getLatitude() + ", lon=" + address.getLongitude());
        }
    }

    private void authorizeTransition(Order order, OrderStatus target, Actor actor) {
        boolean allowed = switch (target) {
            case CONFIRMED, PREPARING, READY -> actor.isPrivileged() || isOrderRestaurant(order, actor);
            case PICKED_UP, IN_TRANSIT, DELIVERED -> actor.is(ActorRole.ADMIN) || isAssignedDriver(order, actor);
            case CANCELLED -> actor.isPrivileged() || isOwner(order, actor) || isOrderRestaurant(order, actor);
            case PENDING -> false;
        };
        if (!allowed) {
            log.warn("Transition not permitted: orderId={}, to={}, actorRole={}, actorId={}",
                    order.getId(), target, actor.getRole(), actor.getUserId());
            throw new AccessDeniedException("You are not allowed to move this order to " + target);
        }
    }

    private List<Order> findForActor(Actor actor, Collection<OrderStatus> statuses) {
        return switch (actor.getRole()) {
            case CUSTOMER -> orderRepository.findByCustomerIdAndStatusInOrderByCreatedAtDesc(actor.getUserId(), statuses);
            case RESTAURANT -> orderRepository.findByRestaurantIdAndStatusInOrderByCreatedAtDesc(
                    actor.getRestaurantId(), statuses);
            case DRIVER -> orderRepository.findByDriverIdAndStatusInOrderByCreatedAtDesc(actor.getUserId(), statuses);
            case ADMIN, SYSTEM -> orderRepository.findByStatusInOrderByCreatedAtDesc(statuses);
        };
    }

    private void notifyStatusChange(Order order) {
        NotificationEventType type = NotificationEventType.forStatus(order.getStatus());
        notificationDispatcher.notify(Recipients.customer(order.getCustomerId()), type, order);
        notificationDispatcher.notify(Recipients.restaurant(order.getRestaurantId()), type, order);
        if (order.getDriverId() != null) {
            notificationDispatcher.notify(Recipients.driver(order.getDriverId()), type, order);
        }
    }

    private String historyNotes(OrderStatus target, TransitionMetadata metadata) {
        if (target == OrderStatus.CANCELLED && metadata.getCancellationReason() != null) {
            String reason = "Cancelled: " + metadata.getCancellationReason();
            return metadata.getCancellationNotes() == null ? reason : reason + " - " + metadata.getCancellationNotes();
        }
        return metadata.getNotes();
    }

    private void appendHistory(Order order, OrderStatus status, Actor actor, String notes, Instant now) {
        historyRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .status(status)
                .actorId(actor.getUserId())
                .actorRole(actor.getRole())
                .notes(notes)
                .createdAt(now)
                .build());
    }

    private OrderResponse toResponse(Order order) {
        OrderResponse response = orderMapper.toOrderResponse(order);
        response.setCanBeCancelled(order.canBeCancelled());
        response.setDelayed(order.isDelayed(timerService.now()));
        response.setStatusHistory(orderMapper.toStatusHistoryResponses(
                historyRepository.findByOrderIdOrderByCreatedAtAscIdAsc(order.getId())));
        return response;
    }

    private Order findOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));
    }
}
