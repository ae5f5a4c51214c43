package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.IssueType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportIssueRequest {

    @NotNull(message = "Issue type cannot be null")
    private IssueType issueType;

    @NotBlank(message = "Description cannot be blank")
    @Size(max = 2000)
    private String description;
}
