package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.Product;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for marketplace products, with category and seller resolved.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class ProductResponse {

    private Long id;
    private String name;
    private String description;
    private BigDecimal price;
    private Long categoryId;
    private CategoryResponse category;
    private String image;
    private Boolean isFeatured;
    private Long userId;
    private UserSummary seller;
    private Integer stock;
    private String location;
    private Instant createdAt;
    private Instant updatedAt;

    public static ProductResponse fromEntity(Product product, CategoryResponse category, UserSummary seller) {
        ProductResponse response = new ProductResponse();
        response.setId(product.getId());
        response.setName(product.getName());
        response.setDescription(product.getDescription());
        response.setPrice(product.getPrice());
        response.setCategoryId(product.getCategoryId());
        response.setCategory(category);
        response.setImage(product.getImage());
        response.setIsFeatured(product.getFeatured());
        response.setUserId(product.getUserId());
        response.setSeller(seller);
        response.setStock(product.getStock());
        response.setLocation(product.getLocation());
        response.setCreatedAt(product.getCreatedAt());
        response.setUpdatedAt(product.getUpdatedAt());
        return response;
    }
}
