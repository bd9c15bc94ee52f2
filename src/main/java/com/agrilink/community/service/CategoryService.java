package com.agrilink.community.service;

import com.agrilink.community.api.dto.CategoryRequest;
import com.agrilink.community.api.dto.CategoryResponse;
import com.agrilink.community.domain.model.Category;
import com.agrilink.community.domain.model.Product;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.repository.CategoryRepository;
import com.agrilink.community.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for marketplace product categories.
 *
 * @author AgriLink Team
 */
@Service
public class CategoryService {

    private static final Logger logger = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;
    private final FileStorageService fileStorageService;

    public CategoryService(
            CategoryRepository categoryRepository,
            ProductRepository productRepository,
            FileStorageService fileStorageService
    ) {
        this.categoryRepository = categoryRepository;
        this.productRepository = productRepository;
        this.fileStorageService = fileStorageService;
    }

    @Transactional(readOnly = true)
    public List<CategoryResponse> listCategories() {
        return categoryRepository.findAllByOrderByNameAsc().stream()
                .map(CategoryResponse::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CategoryResponse getCategory(Long id) {
        return CategoryResponse.fromEntity(findCategory(id));
    }

    @Transactional
    public CategoryResponse createCategory(CategoryRequest request) {
        Category category = Category.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .build();
        category = categoryRepository.save(category);
        logger.info("Created category {} ({})", category.getId(), category.getName());
        return CategoryResponse.fromEntity(category);
    }

    @Transactional
    public CategoryResponse updateCategory(Long id, CategoryRequest request) {
        Category category = findCategory(id);
        if (request.getName() != null) {
            category.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            category.setDescription(request.getDescription());
        }
        category = categoryRepository.save(category);
        logger.info("Updated category {}", id);
        return CategoryResponse.fromEntity(category);
    }

    /**
     * Delete a category together with its products and their images.
     */
    @Transactional
    public void deleteCategory(Long id) {
        Category category = findCategory(id);

        List<Product> products = productRepository.findByCategoryId(id);
        productRepository.deleteAll(products);
        categoryRepository.delete(category);
        AfterTransaction.commit(() -> products.forEach(product -> fileStorageService.delete(product.getImage())));

        logger.info("Deleted category {} and {} products", id, products.size());
    }

    Category findCategory(Long id) {
        return categoryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Category", id));
    }
}
