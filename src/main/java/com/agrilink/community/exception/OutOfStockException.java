package com.agrilink.community.exception;

/**
 * Exception thrown when an order asks for more units than a product has in stock.
 *
 * @author AgriLink Team
 */
public class OutOfStockException extends RuntimeException {

    private final Long productId;
    private final Integer requestedQuantity;
    private final Integer availableQuantity;

    public OutOfStockException(Long productId, Integer requestedQuantity, Integer availableQuantity) {
        super(String.format("Product %d has insufficient stock. Requested: %d, Available: %d",
                productId, requestedQuantity, availableQuantity));
        this.productId = productId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public Long getProductId() {
        return productId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }

    public Integer getAvailableQuantity() {
        return availableQuantity;
    }
}
