package com.quickgo.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class OnlineRequest {

    @NotNull(message = "online flag is required")
    private Boolean online;
}
