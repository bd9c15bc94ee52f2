package com.agrilink.community.api.dto;

import com.agrilink.community.api.validation.OnCreate;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Success story fields posted as multipart form data.
 * Captions are matched to images by position.
 *
 * @author AgriLink Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoryForm {

    @NotBlank(groups = OnCreate.class, message = "The title field is required")
    @Size(max = 255, message = "The title must not exceed 255 characters")
    private String title;

    @NotBlank(groups = OnCreate.class, message = "The content field is required")
    private String content;

    @Size(max = 255, message = "The location must not exceed 255 characters")
    private String location;

    @Size(max = 255, message = "The crop type must not exceed 255 characters")
    private String cropType;

    @DecimalMin(value = "0", message = "The yield improvement must be at least 0")
    private BigDecimal yieldImprovement;

    @Size(max = 50, message = "The yield unit must not exceed 50 characters")
    private String yieldUnit;

    @Builder.Default
    private List<MultipartFile> images = new ArrayList<>();

    @Builder.Default
    private List<@Size(max = 255, message = "Captions must not exceed 255 characters") String> captions = new ArrayList<>();
}
