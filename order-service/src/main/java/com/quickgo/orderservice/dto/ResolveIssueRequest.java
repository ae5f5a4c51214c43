package com.quickgo.orderservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ResolveIssueRequest {

    @NotBlank(message = "Resolution notes cannot be blank")
    @Size(max = 2000)
    private String resolutionNotes;
}
