package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.CreateOrderRequest;
import com.agrilink.community.api.dto.OrderResponse;
import com.agrilink.community.api.dto.UpdateStatusRequest;
import com.agrilink.community.domain.model.Order.OrderStatus;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.OrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for marketplace orders.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/orders")
@PreAuthorize("isAuthenticated()")
@Tag(name = "Orders", description = "Checkout and order fulfilment")
@SecurityRequirement(name = "bearerAuth")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * Place an order. Stock for every line is reserved in the same transaction;
     * a single unavailable product fails the whole order.
     *
     * @param request Items and shipping details
     * @return The created order
     */
    @PostMapping
    @Operation(summary = "Place an order")
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        AuthenticatedUser actor = SecurityUtils.requireCurrentUser();
        logger.debug("User {} placing order with {} items", actor.getId(), request.getItems().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(orderService.createOrder(actor, request));
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "List all orders (admin)")
    public ResponseEntity<List<OrderResponse>> listAllOrders() {
        return ResponseEntity.ok(orderService.listAllOrders());
    }

    @GetMapping("/my-orders")
    @Operation(summary = "List the caller's orders")
    public ResponseEntity<List<OrderResponse>> listMyOrders() {
        return ResponseEntity.ok(orderService.listOrdersForUser(SecurityUtils.requireCurrentUser().getId()));
    }

    /**
     * Get an order. Authorization: the buyer or an admin.
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get an order")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable Long id) {
        return ResponseEntity.ok(orderService.getOrder(SecurityUtils.requireCurrentUser(), id));
    }

    /**
     * Move an order to a new status. Admins drive the lifecycle; buyers may only cancel a pending order.
     */
    @PatchMapping("/{id}/status")
    @Operation(summary = "Change an order's status")
    public ResponseEntity<OrderResponse> updateOrderStatus(@PathVariable Long id,
                                                           @Valid @RequestBody UpdateStatusRequest request) {
        OrderStatus target = OrderStatus.fromValue(request.getStatus());
        return ResponseEntity.ok(orderService.updateOrderStatus(SecurityUtils.requireCurrentUser(), id, target));
    }

    /**
     * Move one order line to a new status. Authorization: an admin or the product's seller.
     */
    @PatchMapping("/{orderId}/items/{itemId}/status")
    @Operation(summary = "Change an order item's status")
    public ResponseEntity<OrderResponse> updateItemStatus(@PathVariable Long orderId,
                                                          @PathVariable Long itemId,
                                                          @Valid @RequestBody UpdateStatusRequest request) {
        OrderStatus target = OrderStatus.fromValue(request.getStatus());
        return ResponseEntity.ok(orderService.updateItemStatus(SecurityUtils.requireCurrentUser(), orderId, itemId, target));
    }
}
