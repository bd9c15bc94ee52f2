package com.agrilink.community.service;

import com.agrilink.community.api.dto.ProductForm;
import com.agrilink.community.api.dto.ProductResponse;
import com.agrilink.community.domain.model.Product;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import com.agrilink.community.infrastructure.storage.StoredFile;
import com.agrilink.community.infrastructure.storage.UploadPolicy;
import com.agrilink.community.repository.CategoryRepository;
import com.agrilink.community.repository.ProductRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.access.AccessDeniedException;

import java.math.BigDecimal;
import java.util.Optional;

import static com.agrilink.community.testutil.TestDataBuilder.actor;
import static com.agrilink.community.testutil.TestDataBuilder.product;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProductService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProductService Unit Tests")
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private FileStorageService fileStorageService;

    @InjectMocks
    private ProductService productService;

    private static MockMultipartFile jpeg(String name) {
        return new MockMultipartFile("image", name, "image/jpeg", new byte[]{1, 2, 3});
    }

    // ========================================
    // createProduct() Tests
    // ========================================

    @Test
    @DisplayName("createProduct - Success: Stores the image and sells as the caller")
    void createProduct_Success() {
        // Given
        MockMultipartFile image = jpeg("tomatoes.jpg");
        ProductForm form = new ProductForm();
        form.setName(" Organic Tomatoes ");
        form.setPrice(new BigDecimal("120.00"));
        form.setCategoryId(1L);
        form.setImage(image);

        when(categoryRepository.existsById(1L)).thenReturn(true);
        when(fileStorageService.store(image, StorageFolder.PRODUCT_IMAGES, UploadPolicy.IMAGE))
                .thenReturn(new StoredFile("productImages/abc.jpg", "tomatoes.jpg", "image/jpeg", 3));
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> {
            Product saved = invocation.getArgument(0);
            saved.setId(10L);
            return saved;
        });

        // When
        ProductResponse response = productService.createProduct(actor(2L, Role.FARMER), form);

        // Then
        assertThat(response.getId()).isEqualTo(10L);
        assertThat(response.getName()).isEqualTo("Organic Tomatoes");
        assertThat(response.getImage()).isEqualTo("productImages/abc.jpg");
        assertThat(response.getUserId()).isEqualTo(2L);
        assertThat(response.getStock()).isZero();
        assertThat(response.getIsFeatured()).isFalse();
    }

    @Test
    @DisplayName("createProduct - Failure: Unknown category is rejected before storing the image")
    void createProduct_UnknownCategory() {
        // Given
        ProductForm form = new ProductForm();
        form.setName("Tomatoes");
        form.setCategoryId(99L);
        form.setImage(jpeg("tomatoes.jpg"));
        when(categoryRepository.existsById(99L)).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> productService.createProduct(actor(2L, Role.FARMER), form))
                .isInstanceOf(FieldValidationException.class);
        verifyNoInteractions(fileStorageService);
    }

    // ========================================
    // updateProduct() / deleteProduct() Tests
    // ========================================

    @Test
    @DisplayName("updateProduct - Success: New image replaces and removes the old file")
    void updateProduct_ReplacesImage() {
        // Given
        Product product = product().id(10L).seller(2L).build();
        String oldImage = product.getImage();
        MockMultipartFile image = jpeg("new.jpg");
        ProductForm form = new ProductForm();
        form.setPrice(new BigDecimal("99.50"));
        form.setImage(image);

        when(productRepository.findById(10L)).thenReturn(Optional.of(product));
        when(fileStorageService.store(image, StorageFolder.PRODUCT_IMAGES, UploadPolicy.IMAGE))
                .thenReturn(new StoredFile("productImages/new.jpg", "new.jpg", "image/jpeg", 3));
        when(productRepository.save(product)).thenReturn(product);

        // When
        ProductResponse response = productService.updateProduct(actor(2L, Role.FARMER), 10L, form);

        // Then
        assertThat(response.getPrice()).isEqualByComparingTo("99.50");
        assertThat(response.getName()).isEqualTo("Organic Tomatoes");
        assertThat(response.getImage()).isEqualTo("productImages/new.jpg");
        verify(fileStorageService).delete(oldImage);
    }

    @Test
    @DisplayName("updateProduct - Failure: Only the seller or an admin may edit")
    void updateProduct_NotSeller() {
        // Given
        when(productRepository.findById(10L)).thenReturn(Optional.of(product().id(10L).seller(2L).build()));

        // When / Then
        assertThatThrownBy(() -> productService.updateProduct(actor(5L, Role.CUSTOMER), 10L, new ProductForm()))
                .isInstanceOf(AccessDeniedException.class);
        verify(productRepository, never()).save(any());
    }

    @Test
    @DisplayName("deleteProduct - Success: Admin deletes the row and then the image file")
    void deleteProduct_Admin() {
        // Given
        Product product = product().id(10L).seller(2L).build();
        when(productRepository.findById(10L)).thenReturn(Optional.of(product));

        // When
        productService.deleteProduct(actor(9L, Role.ADMIN), 10L);

        // Then
        verify(productRepository).delete(product);
        verify(fileStorageService).delete(product.getImage());
    }

    @Test
    @DisplayName("getProduct - Failure: Missing product is not found")
    void getProduct_NotFound() {
        // Given
        when(productRepository.findById(404L)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> productService.getProduct(404L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("createProduct - Image is kept as the relative path returned by storage")
    void createProduct_CapturesEntity() {
        // Given
        MockMultipartFile image = jpeg("beans.png");
        ProductForm form = new ProductForm();
        form.setName("Beans");
        form.setPrice(new BigDecimal("80"));
        form.setCategoryId(4L);
        form.setImage(image);
        form.setFeatured(true);
        form.setStock(12);
        form.setLocation("Eldoret");
        when(categoryRepository.existsById(4L)).thenReturn(true);
        when(fileStorageService.store(image, StorageFolder.PRODUCT_IMAGES, UploadPolicy.IMAGE))
                .thenReturn(new StoredFile("productImages/b.png", "beans.png", "image/png", 3));
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        productService.createProduct(actor(2L, Role.FARMER), form);

        // Then
        ArgumentCaptor<Product> captor = ArgumentCaptor.forClass(Product.class);
        verify(productRepository).save(captor.capture());
        assertThat(captor.getValue().getFeatured()).isTrue();
        assertThat(captor.getValue().getStock()).isEqualTo(12);
        assertThat(captor.getValue().getLocation()).isEqualTo("Eldoret");
        assertThat(captor.getValue().getImage()).isEqualTo("productImages/b.png");
    }
}
