package com.quickgo.orderservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RatingRequest {

    @NotNull
    @Min(1)
    @Max(5)
    private Integer overallRating;

    @NotNull
    @Min(1)
    @Max(5)
    private Integer foodRating;

    @NotNull
    @Min(1)
    @Max(5)
    private Integer deliveryRating;

    @Min(1)
    @Max(5)
    private Integer driverRating;

    @Size(max = 1000)
    private String driverComment;

    @Size(max = 2000)
    private String comment;

    private boolean wouldOrderAgain;
}
