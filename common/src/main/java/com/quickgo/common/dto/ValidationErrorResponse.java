package com.quickgo.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 400 body for rejected request payloads. Field paths follow the request JSON,
 * e.g. {@code items[0].quantity} or {@code deliveryAddress.latitude}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ValidationErrorResponse {

    private int status;
    private String error;
    private String message;
    private String path;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime timestamp;

    // every violated constraint per field, a field can fail more than one
    private Map<String, List<String>> validationErrors;

    // class-level constraints that belong to no single field
    private List<String> globalErrors;

    private String errorCode;

    private String correlationId;
}
