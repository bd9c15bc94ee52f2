package com.agrilink.community.service;

import com.agrilink.community.api.dto.CategoryResponse;
import com.agrilink.community.api.dto.ProductForm;
import com.agrilink.community.api.dto.ProductResponse;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.Category;
import com.agrilink.community.domain.model.Product;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import com.agrilink.community.infrastructure.storage.StoredFile;
import com.agrilink.community.infrastructure.storage.UploadPolicy;
import com.agrilink.community.repository.CategoryRepository;
import com.agrilink.community.repository.ProductRepository;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for marketplace products.
 * Handles listing with filters, seller-owned create/update/delete and product images.
 *
 * @author AgriLink Team
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final UserDirectory userDirectory;
    private final FileStorageService fileStorageService;

    public ProductService(
            ProductRepository productRepository,
            CategoryRepository categoryRepository,
            UserDirectory userDirectory,
            FileStorageService fileStorageService
    ) {
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.userDirectory = userDirectory;
        this.fileStorageService = fileStorageService;
    }

    /**
     * List products matching the optional filters, newest first.
     */
    @Transactional(readOnly = true)
    public List<ProductResponse> listProducts(BigDecimal minPrice, BigDecimal maxPrice, Long categoryId,
                                              Instant createdAfter, Instant createdBefore) {
        logger.debug("Listing products: price [{}, {}], category {}, created [{}, {}]",
                minPrice, maxPrice, categoryId, createdAfter, createdBefore);
        return toResponses(productRepository.search(minPrice, maxPrice, categoryId, createdAfter, createdBefore));
    }

    @Transactional(readOnly = true)
    public List<ProductResponse> listFeatured() {
        return toResponses(productRepository.findByFeaturedTrueOrderByCreatedAtDesc());
    }

    @Transactional(readOnly = true)
    public ProductResponse getProduct(Long id) {
        return toResponse(findProduct(id));
    }

    /**
     * Create a product sold by the acting user.
     *
     * @param actor Seller
     * @param form Validated form; the image is required
     * @return Created product
     */
    @Transactional
    public ProductResponse createProduct(AuthenticatedUser actor, ProductForm form) {
        requireCategory(form.getCategoryId());

        StoredFile image = fileStorageService.store(form.getImage(), StorageFolder.PRODUCT_IMAGES, UploadPolicy.IMAGE);

        Product product = Product.builder()
                .name(form.getName().trim())
                .description(form.getDescription())
                .price(form.getPrice())
                .categoryId(form.getCategoryId())
                .image(image.relativePath())
                .featured(Boolean.TRUE.equals(form.getFeatured()))
                .userId(actor.getId())
                .stock(form.getStock() == null ? 0 : form.getStock())
                .location(form.getLocation())
                .build();

        AfterTransaction.rollback(() -> fileStorageService.delete(image.relativePath()));
        product = productRepository.save(product);

        logger.info("User {} created product {} ({})", actor.getId(), product.getId(), product.getName());
        return toResponse(product);
    }

    /**
     * Apply the present fields of a product update. A new image replaces the old file.
     *
     * @throws org.springframework.security.access.AccessDeniedException if the actor is neither seller nor admin
     */
    @Transactional
    public ProductResponse updateProduct(AuthenticatedUser actor, Long id, ProductForm form) {
        Product product = findProduct(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, product.getUserId(), "update this product");

        if (form.getCategoryId() != null) {
            requireCategory(form.getCategoryId());
            product.setCategoryId(form.getCategoryId());
        }
        if (form.getName() != null) {
            product.setName(form.getName().trim());
        }
        if (form.getDescription() != null) {
            product.setDescription(form.getDescription());
        }
        if (form.getPrice() != null) {
            product.setPrice(form.getPrice());
        }
        if (form.getFeatured() != null) {
            product.setFeatured(form.getFeatured());
        }
        if (form.getStock() != null) {
            product.setStock(form.getStock());
        }
        if (form.getLocation() != null) {
            product.setLocation(form.getLocation());
        }

        String replacedImage = null;
        if (form.getImage() != null && !form.getImage().isEmpty()) {
            StoredFile image = fileStorageService.store(form.getImage(), StorageFolder.PRODUCT_IMAGES, UploadPolicy.IMAGE);
            AfterTransaction.rollback(() -> fileStorageService.delete(image.relativePath()));
            replacedImage = product.getImage();
            product.setImage(image.relativePath());
        }

        product = productRepository.save(product);
        if (replacedImage != null) {
            String obsolete = replacedImage;
            AfterTransaction.commit(() -> fileStorageService.delete(obsolete));
        }

        logger.info("User {} updated product {}", actor.getId(), id);
        return toResponse(product);
    }

    @Transactional
    public void deleteProduct(AuthenticatedUser actor, Long id) {
        Product product = findProduct(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, product.getUserId(), "delete this product");

        productRepository.delete(product);
        AfterTransaction.commit(() -> fileStorageService.delete(product.getImage()));

        logger.info("User {} deleted product {}", actor.getId(), id);
    }

    private Product findProduct(Long id) {
        return productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Product", id));
    }

    private void requireCategory(Long categoryId) {
        if (!categoryRepository.existsById(categoryId)) {
            throw new FieldValidationException("category_id", "The selected category id is invalid.");
        }
    }

    private ProductResponse toResponse(Product product) {
        CategoryResponse category = categoryRepository.findById(product.getCategoryId())
                .map(CategoryResponse::fromEntity)
                .orElse(null);
        return ProductResponse.fromEntity(product, category, userDirectory.summary(product.getUserId()));
    }

    private List<ProductResponse> toResponses(List<Product> products) {
        Map<Long, CategoryResponse> categories = categoryRepository.findAllById(
                        products.stream().map(Product::getCategoryId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Category::getId, CategoryResponse::fromEntity));
        Map<Long, UserSummary> sellers = userDirectory.summaries(
                products.stream().map(Product::getUserId).collect(Collectors.toSet()));

        return products.stream()
                .map(product -> ProductResponse.fromEntity(product,
                        categories.get(product.getCategoryId()), sellers.get(product.getUserId())))
                .collect(Collectors.toList());
    }
}
