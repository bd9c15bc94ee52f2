package com.agrilink.community.repository;

import com.agrilink.community.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Repository interface for Product entity.
 * Stock changes go through atomic update queries so concurrent orders cannot oversell.
 *
 * @author AgriLink Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    /**
     * Find products matching the optional filters, newest first.
     * A null filter is ignored.
     */
    @Query("SELECT p FROM Product p WHERE " +
           "(:minPrice IS NULL OR p.price >= :minPrice) AND " +
           "(:maxPrice IS NULL OR p.price <= :maxPrice) AND " +
           "(:categoryId IS NULL OR p.categoryId = :categoryId) AND " +
           "(:createdAfter IS NULL OR p.createdAt >= :createdAfter) AND " +
           "(:createdBefore IS NULL OR p.createdAt <= :createdBefore) " +
           "ORDER BY p.createdAt DESC, p.id DESC")
    List<Product> search(@Param("minPrice") BigDecimal minPrice,
                         @Param("maxPrice") BigDecimal maxPrice,
                         @Param("categoryId") Long categoryId,
                         @Param("createdAfter") Instant createdAfter,
                         @Param("createdBefore") Instant createdBefore);

    List<Product> findByFeaturedTrueOrderByCreatedAtDesc();

    List<Product> findByCategoryId(Long categoryId);

    /**
     * Atomically take stock for an order line.
     *
     * @param productId Product ID
     * @param quantity Quantity to take
     * @param now Modification time
     * @return Number of rows updated (0 if the product has insufficient stock)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock - :quantity, p.updatedAt = :now " +
           "WHERE p.id = :productId AND p.stock >= :quantity")
    int decrementStock(@Param("productId") Long productId, @Param("quantity") int quantity,
                       @Param("now") Instant now);

    /**
     * Return stock of a cancelled order line.
     *
     * @param productId Product ID
     * @param quantity Quantity to return
     * @param now Modification time
     * @return Number of rows updated (0 if the product no longer exists)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock + :quantity, p.updatedAt = :now " +
           "WHERE p.id = :productId")
    int incrementStock(@Param("productId") Long productId, @Param("quantity") int quantity,
                       @Param("now") Instant now);
}
