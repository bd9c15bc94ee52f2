package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.ApiMessage;
import com.agrilink.community.api.dto.ProductForm;
import com.agrilink.community.api.dto.ProductResponse;
import com.agrilink.community.api.validation.FormValidator;
import com.agrilink.community.api.validation.LenientBoolean;
import com.agrilink.community.api.validation.OnCreate;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.ProductService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * REST controller for marketplace products.
 * Writes use multipart form data so the product image travels with the fields.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/products")
@Tag(name = "Products", description = "Marketplace listings")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;
    private final FormValidator formValidator;

    public ProductController(ProductService productService, FormValidator formValidator) {
        this.productService = productService;
        this.formValidator = formValidator;
    }

    /**
     * List products, newest first.
     *
     * @param minPrice Inclusive lower price bound
     * @param maxPrice Inclusive upper price bound
     * @param categoryId Category filter
     * @param createdAfter ISO-8601 instant, inclusive
     * @param createdBefore ISO-8601 instant, inclusive
     */
    @GetMapping
    @Operation(summary = "List products")
    public ResponseEntity<List<ProductResponse>> listProducts(
            @RequestParam(name = "min_price", required = false) BigDecimal minPrice,
            @RequestParam(name = "max_price", required = false) BigDecimal maxPrice,
            @RequestParam(name = "category_id", required = false) Long categoryId,
            @RequestParam(name = "created_after", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdAfter,
            @RequestParam(name = "created_before", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdBefore
    ) {
        return ResponseEntity.ok(productService.listProducts(minPrice, maxPrice, categoryId, createdAfter, createdBefore));
    }

    @GetMapping("/featured")
    @Operation(summary = "List featured products")
    public ResponseEntity<List<ProductResponse>> listFeatured() {
        return ResponseEntity.ok(productService.listFeatured());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a product")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable Long id) {
        return ResponseEntity.ok(productService.getProduct(id));
    }

    /**
     * List a product for sale. The caller becomes the seller.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Create a product", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ProductResponse> createProduct(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String description,
            @RequestParam(required = false) BigDecimal price,
            @RequestParam(name = "category_id", required = false) Long categoryId,
            @RequestParam(required = false) MultipartFile image,
            @RequestParam(name = "is_featured", required = false) String featured,
            @RequestParam(required = false) Integer stock,
            @RequestParam(required = false) String location
    ) {
        ProductForm form = form(name, description, price, categoryId, image, featured, stock, location);
        formValidator.validate(form, OnCreate.class);

        ProductResponse product = productService.createProduct(SecurityUtils.requireCurrentUser(), form);
        return ResponseEntity.status(HttpStatus.CREATED).body(product);
    }

    /**
     * Partial update; only the fields that are sent change.
     */
    @PostMapping(value = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Update a product", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable Long id,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String description,
            @RequestParam(required = false) BigDecimal price,
            @RequestParam(name = "category_id", required = false) Long categoryId,
            @RequestParam(required = false) MultipartFile image,
            @RequestParam(name = "is_featured", required = false) String featured,
            @RequestParam(required = false) Integer stock,
            @RequestParam(required = false) String location
    ) {
        ProductForm form = form(name, description, price, categoryId, image, featured, stock, location);
        formValidator.validate(form);

        logger.debug("Updating product {}", id);
        return ResponseEntity.ok(productService.updateProduct(SecurityUtils.requireCurrentUser(), id, form));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Delete a product", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ApiMessage> deleteProduct(@PathVariable Long id) {
        productService.deleteProduct(SecurityUtils.requireCurrentUser(), id);
        return ResponseEntity.ok(new ApiMessage("Product deleted successfully"));
    }

    private static ProductForm form(String name, String description, BigDecimal price, Long categoryId,
                                    MultipartFile image, String featured, Integer stock, String location) {
        return ProductForm.builder()
                .name(name)
                .description(description)
                .price(price)
                .categoryId(categoryId)
                .image(image == null || image.isEmpty() ? null : image)
                .featured(LenientBoolean.parse(featured, "is_featured"))
                .stock(stock)
                .location(location)
                .build();
    }
}
