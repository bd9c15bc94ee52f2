package com.agrilink.community.api.dto;

import com.agrilink.community.api.validation.OnCreate;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;

/**
 * Product fields posted as multipart form data.
 * On update every field is optional and only present fields are applied.
 *
 * @author AgriLink Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductForm {

    @NotBlank(groups = OnCreate.class, message = "The name field is required")
    @Size(max = 255, message = "The name must not exceed 255 characters")
    private String name;

    @NotBlank(groups = OnCreate.class, message = "The description field is required")
    private String description;

    @NotNull(groups = OnCreate.class, message = "The price field is required")
    @DecimalMin(value = "0.00", message = "The price must be at least 0")
    @Digits(integer = 8, fraction = 2, message = "The price must have at most 8 integer digits and 2 decimals")
    private BigDecimal price;

    @NotNull(groups = OnCreate.class, message = "The category id field is required")
    private Long categoryId;

    @NotNull(groups = OnCreate.class, message = "The image field is required")
    private MultipartFile image;

    private Boolean featured;

    @Min(value = 0, message = "The stock must be at least 0")
    private Integer stock;

    @Size(max = 255, message = "The location must not exceed 255 characters")
    private String location;
}
