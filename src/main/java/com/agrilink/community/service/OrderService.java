package com.agrilink.community.service;

import com.agrilink.community.api.dto.CreateOrderRequest;
import com.agrilink.community.api.dto.CreateOrderRequest.OrderItemRequest;
import com.agrilink.community.api.dto.OrderResponse;
import com.agrilink.community.domain.model.Order;
import com.agrilink.community.domain.model.Order.OrderStatus;
import com.agrilink.community.domain.model.OrderItem;
import com.agrilink.community.domain.model.Product;
import com.agrilink.community.exception.OutOfStockException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.OrderEvent;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.repository.OrderRepository;
import com.agrilink.community.repository.ProductRepository;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Service for marketplace orders.
 * Placing an order takes stock atomically per line; any failure rolls back the whole order.
 *
 * @author AgriLink Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public OrderService(
            OrderRepository orderRepository,
            ProductRepository productRepository,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Place an order for the acting user.
     * Flow:
     * 1. Resolve each product
     * 2. Take stock with a conditional update (fails when insufficient)
     * 3. Price the lines at the current product price
     * 4. Persist the order with its items
     * 5. Publish the order created event
     *
     * @param actor Buyer
     * @param request Items and shipping details
     * @return Created order
     * @throws ResourceNotFoundException if a product does not exist
     * @throws OutOfStockException if a product has insufficient stock
     */
    @Transactional
    public OrderResponse createOrder(AuthenticatedUser actor, CreateOrderRequest request) {
        long startTime = System.currentTimeMillis();
        logger.info("Creating order for user {} with {} items", actor.getId(), request.getItems().size());

        try {
            Order order = Order.builder()
                    .userId(actor.getId())
                    .shippingAddress(request.getShippingAddress())
                    .phoneNumber(request.getPhoneNumber())
                    .notes(request.getNotes())
                    .status(OrderStatus.PENDING)
                    .totalAmount(BigDecimal.ZERO)
                    .build();

            BigDecimal total = BigDecimal.ZERO;
            for (OrderItemRequest line : request.getItems()) {
                Product product = productRepository.findById(line.getProductId())
                        .orElseThrow(() -> new ResourceNotFoundException("Product", line.getProductId()));

                int updated = productRepository.decrementStock(product.getId(), line.getQuantity(), Instant.now());
                if (updated == 0) {
                    throw new OutOfStockException(product.getId(), line.getQuantity(), product.getStock());
                }

                BigDecimal lineTotal = product.getPrice().multiply(BigDecimal.valueOf(line.getQuantity()));
                order.addItem(OrderItem.builder()
                        .productId(product.getId())
                        .productName(product.getName())
                        .sellerId(product.getUserId())
                        .quantity(line.getQuantity())
                        .unitPrice(product.getPrice())
                        .totalPrice(lineTotal)
                        .status(OrderStatus.PENDING)
                        .build());
                total = total.add(lineTotal);
            }
            order.setTotalAmount(total);

            order = orderRepository.save(order);

            kafkaProducerService.publishOrderEvent(new OrderEvent(
                    order.getId(), order.getUserId(), order.getStatus().getValue(),
                    order.getTotalAmount(), order.getItems().size(), OrderEvent.EventType.CREATED));

            long duration = System.currentTimeMillis() - startTime;
            metricsService.recordOrderCreated(order.getItems().size(), duration);
            logger.info("Created order {} for user {}: total {} in {}ms",
                    order.getId(), actor.getId(), total, duration);

            return OrderResponse.fromEntity(order);

        } catch (OutOfStockException e) {
            metricsService.recordOrderFailure("OUT_OF_STOCK");
            logger.warn("Order rejected for user {}: {}", actor.getId(), e.getMessage());
            throw e;
        } catch (ResourceNotFoundException e) {
            metricsService.recordOrderFailure("PRODUCT_NOT_FOUND");
            logger.warn("Order rejected for user {}: {}", actor.getId(), e.getMessage());
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> listAllOrders() {
        return orderRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(OrderResponse::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> listOrdersForUser(Long userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(OrderResponse::fromEntity)
                .collect(Collectors.toList());
    }

    /**
     * @throws AccessDeniedException unless the actor placed the order or is an admin
     */
    @Transactional(readOnly = true)
    public OrderResponse getOrder(AuthenticatedUser actor, Long orderId) {
        Order order = findOrder(orderId);
        SecurityUtils.verifyOwnerOrAdmin(actor, order.getUserId(), "view this order");
        return OrderResponse.fromEntity(order);
    }

    /**
     * Move an order to a new status.
     * Admins may make any allowed transition; the buyer may only cancel a pending order.
     * Cancelling returns the stock of lines that were not completed.
     *
     * @throws com.agrilink.community.exception.InvalidStateTransitionException if the transition is not allowed
     */
    @Transactional
    public OrderResponse updateOrderStatus(AuthenticatedUser actor, Long orderId, OrderStatus target) {
        Order order = findOrder(orderId);

        boolean ownerCancellingPending = order.isOwnedBy(actor.getId())
                && target == OrderStatus.CANCELLED
                && order.getStatus() == OrderStatus.PENDING;
        if (!actor.isAdmin() && !ownerCancellingPending) {
            throw new AccessDeniedException("You are not allowed to change the status of this order");
        }

        OrderStatus previous = order.getStatus();
        List<OrderItem> restockable = order.getItems().stream()
                .filter(item -> !item.getStatus().isFinal())
                .collect(Collectors.toList());

        order.transitionTo(target);

        if (target == OrderStatus.CANCELLED) {
            restockable.forEach(item -> productRepository.incrementStock(item.getProductId(), item.getQuantity(), Instant.now()));
            logger.info("Returned stock for {} lines of cancelled order {}", restockable.size(), orderId);
        }

        order = orderRepository.save(order);

        kafkaProducerService.publishOrderEvent(new OrderEvent(
                order.getId(), order.getUserId(), target.getValue(),
                order.getTotalAmount(), order.getItems().size(), OrderEvent.EventType.STATUS_CHANGED));
        metricsService.recordOrderStatusChange(target.getValue());
        logger.info("Order {} moved from {} to {} by user {}", orderId, previous, target, actor.getId());

        return OrderResponse.fromEntity(order);
    }

    /**
     * Move one order line to a new status. Allowed for admins and the seller of the line's product.
     * The order completes once all of its lines are completed.
     */
    @Transactional
    public OrderResponse updateItemStatus(AuthenticatedUser actor, Long orderId, Long itemId, OrderStatus target) {
        Order order = findOrder(orderId);
        OrderItem item = order.getItems().stream()
                .filter(candidate -> candidate.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Order item", itemId));

        if (!actor.isAdmin() && !actor.is(item.getSellerId())) {
            throw new AccessDeniedException("You are not allowed to change the status of this order item");
        }

        item.transitionTo(target);
        if (target == OrderStatus.CANCELLED) {
            productRepository.incrementStock(item.getProductId(), item.getQuantity(), Instant.now());
        }
        if (order.getStatus() == OrderStatus.PENDING && target == OrderStatus.PROCESSING) {
            order.setStatus(OrderStatus.PROCESSING);
        }
        Optional<OrderStatus> closedAs = order.finishIfAllItemsFinal();

        order = orderRepository.save(order);

        OrderEvent event = new OrderEvent(order.getId(), order.getUserId(), target.getValue(),
                order.getTotalAmount(), order.getItems().size(), OrderEvent.EventType.ITEM_STATUS_CHANGED);
        event.setItemId(itemId);
        kafkaProducerService.publishOrderEvent(event);
        metricsService.recordOrderStatusChange(target.getValue());

        logger.info("Order item {} of order {} moved to {} by user {}", itemId, orderId, target, actor.getId());
        closedAs.ifPresent(status -> logger.info("Order {} closed as {} after all items were finalised", orderId, status));

        return OrderResponse.fromEntity(order);
    }

    private Order findOrder(Long orderId) {
        return orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
