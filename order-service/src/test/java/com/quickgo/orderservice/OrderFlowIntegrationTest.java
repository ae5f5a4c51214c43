package com.quickgo.orderservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickgo.orderservice.dto.CreateOrderRequest;
import com.quickgo.orderservice.dto.OrderItemRequest;
import com.quickgo.orderservice.model.DeliveryAddress;
import com.quickgo.orderservice.model.DriverAvailability;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.model.OutboxEvent;
import com.quickgo.orderservice.model.PaymentMethod;
import com.quickgo.orderservice.model.ProductSnapshot;
import com.quickgo.orderservice.model.RestaurantSnapshot;
import com.quickgo.orderservice.repository.DeliveryIssueRepository;
import com.quickgo.orderservice.repository.DispatchOfferRepository;
import com.quickgo.orderservice.repository.DriverAvailabilityRepository;
import com.quickgo.orderservice.repository.OrderRatingRepository;
import com.quickgo.orderservice.repository.OrderRepository;
import com.quickgo.orderservice.repository.OrderStatusHistoryRepository;
import com.quickgo.orderservice.repository.OutboxRepository;
import com.quickgo.orderservice.repository.ProductSnapshotRepository;
import com.quickgo.orderservice.repository.RestaurantSnapshotRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
public class OrderFlowIntegrationTest extends AbstractIntegrationTest {

    private static final long CUSTOMER_ID = 1001L;
    private static final long RESTAURANT_ID = 7L;
    private static final long RESTAURANT_STAFF_ID = 2001L;
    private static final long DRIVER_ID = 3001L;
    private static final long PRODUCT_ID = 11L;

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrderRepository orderRepository;
    @Autowired
    private OrderStatusHistoryRepository historyRepository;
    @Autowired
    private OrderRatingRepository ratingRepository;
    @Autowired
    private DeliveryIssueRepository issueRepository;
    @Autowired
    private DispatchOfferRepository offerRepository;
    @Autowired
    private DriverAvailabilityRepository driverAvailabilityRepository;
    @Autowired
    private OutboxRepository outboxRepository;
    @Autowired
    private RestaurantSnapshotRepository restaurantSnapshotRepository;
    @Autowired
    private ProductSnapshotRepository productSnapshotRepository;

    @BeforeEach
    void seedCatalog() {
        RestaurantSnapshot restaurant = new RestaurantSnapshot();
        restaurant.setRestaurantId(RESTAURANT_ID);
        restaurant.setName("Lambda Burgers");
        restaurant.setLatitude(41.0082);
        restaurant.setLongitude(28.9784);
        restaurant.setAcceptingOrders(true);
        restaurant.setDeliveryFee(new BigDecimal("2.00"));
        restaurant.setPreparationMinutes(15);
        restaurantSnapshotRepository.save(restaurant);

        ProductSnapshot burger = new ProductSnapshot();
        burger.setProductId(PRODUCT_ID);
        burger.setRestaurantId(RESTAURANT_ID);
        burger.setName("Double burger");
        burger.setPrice(new BigDecimal("5.00"));
        burger.setAvailable(true);
        productSnapshotRepository.save(burger);
    }

    @AfterEach
    void tearDown() {
        historyRepository.deleteAll();
        ratingRepository.deleteAll();
        issueRepository.deleteAll();
        offerRepository.deleteAll();
        orderRepository.deleteAll();
        driverAvailabilityRepository.deleteAll();
        outboxRepository.deleteAll();
        productSnapshotRepository.deleteAll();
        restaurantSnapshotRepository.deleteAll();
    }

    @Test
    void should_take_an_order_from_checkout_to_delivery() throws Exception {
        // driver waiting about 1 km from the restaurant
        driverAvailabilityRepository.save(DriverAvailability.builder()
                .driverId(DRIVER_ID)
                .available(true)
                .online(true)
                .latitude(41.0150)
                .longitude(28.9800)
                .build());

        // 1. customer checks out: 2 x 5.00 + 2.00 delivery + 0.50 service + 1.20 tax
        MvcResult created = mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(checkout()))
                        .with(customer()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.total").value(13.70))
                .andReturn();
        long orderId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        // 2. restaurant works the order
        for (String step : List.of("confirm", "preparing", "ready")) {
            mockMvc.perform(post("/api/v1/orders/" + orderId + "/" + step).with(restaurant()))
                    .andExpect(status().isOk());
        }

        // 3. entering READY offered the order to the nearby driver
        MvcResult offers = mockMvc.perform(get("/api/v1/drivers/me/offers").with(driver()))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode offerList = objectMapper.readTree(offers.getResponse().getContentAsString());
        assertEquals(1, offerList.size());
        assertEquals(orderId, offerList.get(0).get("orderId").asLong());

        mockMvc.perform(post("/api/v1/drivers/me/offers/" + offerList.get(0).get("id").asText() + "/accept")
                        .with(driver()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ACCEPTED"));

        assertEquals(orderId, driverAvailabilityRepository.findById(DRIVER_ID).orElseThrow().getCurrentOrderId());

        // 4. driver completes the delivery
        for (String step : List.of("pickup", "in-transit", "deliver")) {
            mockMvc.perform(post("/api/v1/orders/" + orderId + "/" + step).with(driver()))
                    .andExpect(status().isOk());
        }

        Order delivered = orderRepository.findById(orderId).orElseThrow();
        assertEquals(OrderStatus.DELIVERED, delivered.getStatus());
        assertEquals(DRIVER_ID, delivered.getDriverId());
        assertTrue(delivered.isPaid(), "cash orders are paid on delivery");
        assertNotNull(delivered.getDeliveredAt());

        DriverAvailability driverAfter = driverAvailabilityRepository.findById(DRIVER_ID).orElseThrow();
        assertNull(driverAfter.getCurrentOrderId());
        assertEquals(1, driverAfter.getTotalDeliveries());

        // created, six status changes and the assignment
        assertEquals(8, historyRepository.findByOrderIdOrderByCreatedAtAscIdAsc(orderId).size());

        List<String> eventTypes = outboxRepository
                .findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc("ORDER", String.valueOf(orderId)).stream()
                .map(OutboxEvent::getType)
                .toList();
        assertTrue(eventTypes.contains("notification.order_created"));
        assertTrue(eventTypes.contains("notification.offer_created"));
        assertTrue(eventTypes.contains("notification.driver_assigned"));
    }

    @Test
    void should_reject_cancellation_once_the_kitchen_has_started() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(checkout()))
                        .with(customer()))
                .andExpect(status().isCreated())
                .andReturn();
        long orderId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(post("/api/v1/orders/" + orderId + "/confirm").with(restaurant()))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/orders/" + orderId + "/preparing").with(restaurant()))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/orders/" + orderId + "/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"CUSTOMER_REQUEST\"}")
                        .with(customer()))
                .andExpect(status().isUnprocessableEntity());

        assertEquals(OrderStatus.PREPARING, orderRepository.findById(orderId).orElseThrow().getStatus());
    }

    @Test
    void should_hide_an_order_from_other_customers() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(checkout()))
                        .with(customer()))
                .andExpect(status().isCreated())
                .andReturn();
        long orderId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(get("/api/v1/orders/" + orderId)
                        .with(jwt().jwt(builder -> builder
                                .subject("9999")
                                .claim("resource_access", roles("CUSTOMER")))))
                .andExpect(status().isForbidden());
    }

    private CreateOrderRequest checkout() {
        CreateOrderRequest request = new CreateOrderRequest();
        request.setRestaurantId(RESTAURANT_ID);
        request.setDeliveryAddress(new DeliveryAddress("Istiklal Cd. 10", "3rd floor", 41.0340, 28.9770));
        request.setItems(List.of(new OrderItemRequest(PRODUCT_ID, 2, null, null)));
        request.setPaymentMethod(PaymentMethod.CASH);
        return request;
    }

    private static Map<String, Object> roles(String... roles) {
        return Map.of("quickgo-backend", Map.of("roles", List.of(roles)));
    }

    private static JwtRequestPostProcessor customer() {
        return jwt().jwt(builder -> builder
                .subject(String.valueOf(CUSTOMER_ID))
                .claim("resource_access", roles("CUSTOMER")));
    }

    private static JwtRequestPostProcessor restaurant() {
        return jwt().jwt(builder -> builder
                .subject(String.valueOf(RESTAURANT_STAFF_ID))
                .claim("restaurant_id", RESTAURANT_ID)
                .claim("resource_access", roles("RESTAURANT")));
    }

    private static JwtRequestPostProcessor driver() {
        return jwt().jwt(builder -> builder
                .subject(String.valueOf(DRIVER_ID))
                .claim("resource_access", roles("DRIVER")));
    }
}
