package com.quickgo.orderservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "orders")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    public static final int MONEY_SCALE = 2;

    public static final String ID_SEQUENCE = "orders_seq";

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = ID_SEQUENCE)
    @SequenceGenerator(name = ID_SEQUENCE, sequenceName = ID_SEQUENCE, allocationSize = 1)
    @ToString.Include
    private Long id;

    @Column(name = "order_number", nullable = false, unique = true, updatable = false)
    @ToString.Include
    private String orderNumber;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private Long customerId;

    @Column(name = "restaurant_id", nullable = false, updatable = false)
    private Long restaurantId;

    // Unset until a dispatch offer is accepted (or an operator assigns manually)
    @Column(name = "driver_id")
    private Long driverId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private OrderStatus status;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(name = "delivery_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal deliveryFee = BigDecimal.ZERO;

    @Column(name = "service_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal serviceFee = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal tax = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal discount = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal tip = BigDecimal.ZERO;

    // Derived, only written by recalculateTotals()
    @Setter(AccessLevel.NONE)
    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal total = BigDecimal.ZERO;

    @Embedded
    private DeliveryAddress deliveryAddress;

    // Snapshot of the restaurant location at creation time, used as dispatch origin
    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "pickup_latitude")),
            @AttributeOverride(name = "longitude", column = @Column(name = "pickup_longitude"))
    })
    private GeoPoint pickupLocation;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false)
    private PaymentMethod paymentMethod;

    @Column(nullable = false)
    private boolean paid;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "special_instructions", length = 1000)
    private String specialInstructions;

    @Column(name = "estimated_delivery_time")
    private Instant estimatedDeliveryTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "preparing_at")
    private Instant preparingAt;

    @Column(name = "ready_at")
    private Instant readyAt;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "picked_up_at")
    private Instant pickedUpAt;

    @Column(name = "in_transit_at")
    private Instant inTransitAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancellation_reason")
    private CancellationReason cancellationReason;

    @Column(name = "cancellation_notes", length = 1000)
    private String cancellationNotes;

    @Column(name = "dispatch_rounds", nullable = false)
    private int dispatchRounds;

    @Column(nullable = false)
    private boolean escalated;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalation_reason")
    private EscalationReason escalationReason;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    // Optimistic locking: every single-order write is a compare-and-swap on version,
    // so a concurrent cancel and confirm cannot both win
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }

    /**
     * Recomputes subtotal from the line items and total from the fee fields:
     * total = subtotal + deliveryFee + serviceFee + tax + tip - discount
     */
    public void recalculateTotals() {
        BigDecimal lines = BigDecimal.ZERO;
        for (OrderItem item : items) {
            item.recalculateSubtotal();
            lines = lines.add(item.getSubtotal());
        }
        this.subtotal = money(lines);
        this.total = money(subtotal
                .add(money(deliveryFee))
                .add(money(serviceFee))
                .add(money(tax))
                .add(money(tip))
                .subtract(money(discount)));
    }

    /**
     * Moves the order to the given status and stamps the matching timestamp.
     * A timestamp that is already set is never overwritten.
     */
    public void applyStatus(OrderStatus target, Instant now) {
        this.status = target;
        switch (target) {
            case CONFIRMED -> confirmedAt = firstNonNull(confirmedAt, now);
            case PREPARING -> preparingAt = firstNonNull(preparingAt, now);
            case READY -> readyAt = firstNonNull(readyAt, now);
            case PICKED_UP -> pickedUpAt = firstNonNull(pickedUpAt, now);
            case IN_TRANSIT -> inTransitAt = firstNonNull(inTransitAt, now);
            case DELIVERED -> deliveredAt = firstNonNull(deliveredAt, now);
            case CANCELLED -> cancelledAt = firstNonNull(cancelledAt, now);
            default -> {
                // PENDING carries createdAt only
            }
        }
    }

    public void escalate(EscalationReason reason, Instant now) {
        this.escalated = true;
        this.escalationReason = reason;
        this.escalatedAt = now;
    }

    public void clearEscalation() {
        this.escalated = false;
        this.escalationReason = null;
        this.escalatedAt = null;
    }

    public boolean canBeCancelled() {
        return status != null && status.isCancellable();
    }

    public boolean isDelayed(Instant now) {
        return estimatedDeliveryTime != null
                && status != null
                && !status.isTerminal()
                && now.isAfter(estimatedDeliveryTime);
    }

    public int getTotalItems() {
        return items.stream().mapToInt(OrderItem::getQuantity).sum();
    }

    public boolean isDispatchExhausted() {
        return escalated && escalationReason == EscalationReason.DISPATCH_EXHAUSTED;
    }

    private static Instant firstNonNull(Instant current, Instant candidate) {
        return current != null ? current : candidate;
    }

    public static BigDecimal money(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
