package com.agrilink.community.domain.model;

import com.agrilink.community.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Marketplace order placed by a customer.
 * Items are owned by the order and persisted with it.
 *
 * @author AgriLink Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_id", columnList = "user_id"),
    @Index(name = "idx_orders_status", columnList = "status"),
    @Index(name = "idx_orders_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "shipping_address", nullable = false, columnDefinition = "TEXT")
    private String shippingAddress;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @ToString.Exclude
    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (status == null) {
            status = OrderStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }

    /**
     * Move the order to a new status.
     * Items that are not yet final follow the order.
     *
     * @param target New status
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public void transitionTo(OrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("order", status.getValue(), target.getValue());
        }
        this.status = target;
        for (OrderItem item : items) {
            if (!item.getStatus().isFinal()) {
                item.setStatus(target);
            }
        }
    }

    /**
     * Close the order once every item has reached a final status. The order ends COMPLETED when
     * at least one item was completed and CANCELLED when every item was cancelled.
     *
     * @return the status the order was closed with, or empty if it is still open
     */
    public Optional<OrderStatus> finishIfAllItemsFinal() {
        if (status.isFinal() || items.isEmpty()) {
            return Optional.empty();
        }
        boolean allFinal = items.stream().allMatch(item -> item.getStatus().isFinal());
        if (!allFinal) {
            return Optional.empty();
        }
        boolean anyCompleted = items.stream().anyMatch(item -> item.getStatus() == OrderStatus.COMPLETED);
        this.status = anyCompleted ? OrderStatus.COMPLETED : OrderStatus.CANCELLED;
        return Optional.of(this.status);
    }

    public boolean isOwnedBy(Long candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public boolean isFinalState() {
        return status.isFinal();
    }

    /**
     * Order and order item status.
     * PENDING -> PROCESSING -> COMPLETED, and PENDING | PROCESSING -> CANCELLED.
     */
    public enum OrderStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        CANCELLED;

        public boolean canTransitionTo(OrderStatus target) {
            return allowedTargets().contains(target);
        }

        public boolean isFinal() {
            return this == COMPLETED || this == CANCELLED;
        }

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        private Set<OrderStatus> allowedTargets() {
            switch (this) {
                case PENDING:
                    return EnumSet.of(PROCESSING, CANCELLED);
                case PROCESSING:
                    return EnumSet.of(COMPLETED, CANCELLED);
                default:
                    return EnumSet.noneOf(OrderStatus.class);
            }
        }

        /**
         * Parse a status name case-insensitively.
         *
         * @throws IllegalArgumentException if the name is unknown
         */
        public static OrderStatus fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Status is required");
            }
            return OrderStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
