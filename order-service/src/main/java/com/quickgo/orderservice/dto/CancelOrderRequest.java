package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.CancellationReason;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelOrderRequest {

    @NotNull(message = "Cancellation reason cannot be null")
    private CancellationReason reason;

    @Size(max = 1000)
    private String notes;
}
