package com.quickgo.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AvailabilityRequest {

    @NotNull(message = "available flag is required")
    private Boolean available;
}
