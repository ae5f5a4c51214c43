package com.quickgo.orderservice.controller;

import com.quickgo.orderservice.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Edge cases of the REST surface: authentication, malformed input, role mismatches.
 */
@AutoConfigureMockMvc
class OrderControllerEdgeCaseTest extends AbstractIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  private static Map<String, Object> roles(String role) {
    return Map.of("quickgo-backend", Map.of("roles", List.of(role)));
  }

  @Test
  void should_return_401_when_no_authentication_provided() throws Exception {
    mockMvc.perform(get("/api/v1/orders/active"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.errorCode").value("UNAUTHENTICATED"));
  }

  @Test
  void should_reject_empty_cart_with_field_errors() throws Exception {
    String body = """
        {"restaurantId": 7,
         "deliveryAddress": {"address": "Main St 1", "latitude": 41.0, "longitude": 29.0},
         "items": [],
         "paymentMethod": "CASH"}
        """;

    mockMvc.perform(post("/api/v1/orders")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body)
            .with(jwt().jwt(builder -> builder.subject("1").claim("resource_access", roles("CUSTOMER")))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.validationErrors.items").isArray())
        .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
  }

  @Test
  void should_reject_out_of_range_coordinates() throws Exception {
    String body = """
        {"restaurantId": 7,
         "deliveryAddress": {"address": "Nowhere", "latitude": 123.0, "longitude": 29.0},
         "items": [{"productId": 11, "quantity": 1}],
         "paymentMethod": "CASH"}
        """;

    mockMvc.perform(post("/api/v1/orders")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body)
            .with(jwt().jwt(builder -> builder.subject("1").claim("resource_access", roles("CUSTOMER")))))
        .andExpect(status().isBadRequest());
  }

  @Test
  void should_return_400_for_non_numeric_order_id() throws Exception {
    mockMvc.perform(get("/api/v1/orders/not-a-number")
            .with(jwt().jwt(builder -> builder.subject("1").claim("resource_access", roles("CUSTOMER")))))
        .andExpect(status().isBadRequest());
  }

  @Test
  void should_return_404_for_unknown_order() throws Exception {
    mockMvc.perform(get("/api/v1/orders/987654321")
            .with(jwt().jwt(builder -> builder.subject("1").claim("resource_access", roles("ADMIN")))))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
  }

  @Test
  void should_return_403_when_customer_calls_driver_endpoint() throws Exception {
    mockMvc.perform(get("/api/v1/drivers/me/offers")
            .with(jwt().jwt(builder -> builder.subject("1").claim("resource_access", roles("CUSTOMER")))))
        .andExpect(status().isForbidden());
  }

  @Test
  void should_return_403_for_token_without_quickgo_role() throws Exception {
    mockMvc.perform(get("/api/v1/orders/active")
            .with(jwt().jwt(builder -> builder.subject("1"))))
        .andExpect(status().isForbidden());
  }
}
