package com.quickgo.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Contract for product.updated and product.deleted events from the catalog.
 * For product.deleted only productId is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductEventContract {
    private Long productId;
    private Long restaurantId;
    private String name;
    private BigDecimal price;
    private boolean available;
}
