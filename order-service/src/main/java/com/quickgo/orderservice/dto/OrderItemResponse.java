package com.quickgo.orderservice.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class OrderItemResponse {
    private Long productId;
    private String productName;
    private BigDecimal unitPrice;
    private Integer quantity;
    private String customizations;
    private String specialNotes;
    private BigDecimal subtotal;
}
