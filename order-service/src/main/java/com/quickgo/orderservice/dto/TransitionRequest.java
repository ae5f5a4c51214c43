package com.quickgo.orderservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class TransitionRequest {

    @Size(max = 1000)
    private String notes;
}
