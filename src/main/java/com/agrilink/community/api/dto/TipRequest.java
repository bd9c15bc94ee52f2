package com.agrilink.community.api.dto;

import com.agrilink.community.api.validation.OnCreate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for creating or updating a tip. Absent fields are left unchanged on update.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TipRequest {

    @NotBlank(groups = OnCreate.class, message = "Title is required")
    @Size(min = 1, max = 255, message = "Title must be between 1 and 255 characters")
    private String title;

    @NotBlank(groups = OnCreate.class, message = "Content is required")
    @Size(min = 1, message = "Content must not be empty")
    private String content;

    @NotNull(groups = OnCreate.class, message = "Category ID is required")
    private Long categoryId;

    private List<@NotBlank(message = "Tags must not be blank") @Size(max = 50, message = "Tags must not exceed 50 characters") String> tags;

    private Boolean isFeatured;
}
