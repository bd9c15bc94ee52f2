package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.CreateOrderRequest;
import com.agrilink.community.api.dto.OrderResponse;
import com.agrilink.community.api.exception.GlobalExceptionHandler;
import com.agrilink.community.domain.model.Order;
import com.agrilink.community.domain.model.Order.OrderStatus;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.InvalidStateTransitionException;
import com.agrilink.community.exception.OutOfStockException;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.service.OrderService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static com.agrilink.community.testutil.TestDataBuilder.authenticateAs;
import static com.agrilink.community.testutil.TestDataBuilder.order;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for OrderController using MockMvc.
 */
@WebMvcTest(OrderController.class)
@AutoConfigureMockMvc(addFilters = false)
@ContextConfiguration(classes = {OrderController.class, GlobalExceptionHandler.class})
@DisplayName("OrderController Tests")
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrderService orderService;

    @MockBean
    private CloudWatchMetricsService metricsService;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    // ========================================
    // POST /api/orders Tests
    // ========================================

    @Test
    @DisplayName("POST - Valid snake_case order returns 201 Created")
    void createOrder_ValidRequest_Returns201() throws Exception {
        // Given
        AuthenticatedUser actor = authenticateAs(1L, Role.CUSTOMER);
        String requestBody = """
                {
                    "items": [{"product_id": 10, "quantity": 2}],
                    "shipping_address": "Plot 12, Nakuru",
                    "phone_number": "+254700000000"
                }
                """;
        Order order = order().id(100L).userId(1L)
                .item(1000L, 10L, 2L, 2, new BigDecimal("120.00"))
                .build();
        when(orderService.createOrder(eq(actor), any(CreateOrderRequest.class)))
                .thenReturn(OrderResponse.fromEntity(order));

        // When / Then
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(100))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].product_id").value(10));
    }

    @Test
    @DisplayName("POST - Empty items returns 422 with field errors")
    void createOrder_NoItems_Returns422() throws Exception {
        // Given
        authenticateAs(1L, Role.CUSTOMER);
        String requestBody = """
                {
                    "items": [],
                    "shipping_address": "Plot 12, Nakuru",
                    "phone_number": "+254700000000"
                }
                """;

        // When / Then
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.fieldErrors.items").exists());

        verify(orderService, never()).createOrder(any(), any());
    }

    @Test
    @DisplayName("POST - Insufficient stock returns 409 Conflict")
    void createOrder_OutOfStock_Returns409() throws Exception {
        // Given
        authenticateAs(1L, Role.CUSTOMER);
        String requestBody = """
                {
                    "items": [{"product_id": 10, "quantity": 500}],
                    "shipping_address": "Plot 12, Nakuru",
                    "phone_number": "+254700000000"
                }
                """;
        when(orderService.createOrder(any(), any())).thenThrow(new OutOfStockException(10L, 500, 50));

        // When / Then
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isConflict());
    }

    // ========================================
    // GET /api/orders/my-orders Tests
    // ========================================

    @Test
    @DisplayName("GET /my-orders - Returns the caller's orders")
    void listMyOrders_Returns200() throws Exception {
        // Given
        authenticateAs(1L, Role.CUSTOMER);
        when(orderService.listOrdersForUser(1L)).thenReturn(List.of(
                OrderResponse.fromEntity(order().id(100L).userId(1L).build()),
                OrderResponse.fromEntity(order().id(101L).userId(1L).processing().build())));

        // When / Then
        mockMvc.perform(get("/api/orders/my-orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].status").value("processing"));
    }

    // ========================================
    // PATCH /api/orders/{id}/status Tests
    // ========================================

    @Test
    @DisplayName("PATCH /{id}/status - Lowercase status is parsed")
    void updateOrderStatus_Returns200() throws Exception {
        // Given
        AuthenticatedUser actor = authenticateAs(9L, Role.ADMIN);
        when(orderService.updateOrderStatus(actor, 100L, OrderStatus.COMPLETED))
                .thenReturn(OrderResponse.fromEntity(order().id(100L).status(OrderStatus.COMPLETED).build()));

        // When / Then
        mockMvc.perform(patch("/api/orders/100/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"completed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));
    }

    @Test
    @DisplayName("PATCH /{id}/status - Unknown status returns 422")
    void updateOrderStatus_UnknownStatus_Returns422() throws Exception {
        // Given
        authenticateAs(9L, Role.ADMIN);

        // When / Then
        mockMvc.perform(patch("/api/orders/100/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"shipped\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.fieldErrors.status").exists());

        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("PATCH /{id}/status - Illegal transition returns 422")
    void updateOrderStatus_IllegalTransition_Returns422() throws Exception {
        // Given
        AuthenticatedUser actor = authenticateAs(9L, Role.ADMIN);
        when(orderService.updateOrderStatus(actor, 100L, OrderStatus.PENDING))
                .thenThrow(new InvalidStateTransitionException("Order", "completed", "pending"));

        // When / Then
        mockMvc.perform(patch("/api/orders/100/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"pending\"}"))
                .andExpect(status().isUnprocessableEntity());
    }
}
