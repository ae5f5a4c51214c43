package com.quickgo.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @Column(name = "product_id", nullable = false)
    @ToString.Include
    private Long productId;

    // Name and price are captured at order time, later catalog changes never touch them
    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false)
    @ToString.Include
    private Integer quantity;

    @Column(length = 1000)
    private String customizations;

    @Column(name = "special_notes", length = 500)
    private String specialNotes;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    public void recalculateSubtotal() {
        this.subtotal = Order.money(unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }
}
