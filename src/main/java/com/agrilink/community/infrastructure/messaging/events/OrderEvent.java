package com.agrilink.community.infrastructure.messaging.events;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order lifecycle event published to the orders topic.
 *
 * Event Types:
 * - CREATED: order placed, stock taken
 * - STATUS_CHANGED: order moved to a new status
 * - ITEM_STATUS_CHANGED: a single line moved to a new status
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class OrderEvent {

    private Long orderId;
    private Long userId;
    private Long itemId;
    private String status;
    private BigDecimal totalAmount;
    private Integer itemCount;
    private EventType eventType;
    private Instant timestamp;

    public OrderEvent(Long orderId, Long userId, String status, BigDecimal totalAmount,
                      Integer itemCount, EventType eventType) {
        this.orderId = orderId;
        this.userId = userId;
        this.status = status;
        this.totalAmount = totalAmount;
        this.itemCount = itemCount;
        this.eventType = eventType;
        this.timestamp = Instant.now();
    }

    public enum EventType {
        CREATED,
        STATUS_CHANGED,
        ITEM_STATUS_CHANGED
    }
}
