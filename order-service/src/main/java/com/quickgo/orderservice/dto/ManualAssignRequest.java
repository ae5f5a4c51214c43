package com.quickgo.orderservice.dto;

import lombok.Data;

@Data
public class ManualAssignRequest {

    // Empty means: pick the best eligible driver now
    private Long driverId;
}
