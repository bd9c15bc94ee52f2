package com.agrilink.community.api.dto;

import com.agrilink.community.api.validation.OnCreate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TipCategoryRequest {

    @NotBlank(groups = OnCreate.class, message = "Name is required")
    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    private String description;

    @Size(max = 255, message = "Icon must not exceed 255 characters")
    private String icon;
}
