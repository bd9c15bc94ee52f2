package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.TipCategory;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class TipCategoryResponse {

    private Long id;
    private String name;
    private String slug;
    private String description;
    private String icon;
    private Long tipsCount;
    private Instant createdAt;
    private Instant updatedAt;

    public static TipCategoryResponse fromEntity(TipCategory category, Long tipsCount) {
        if (category == null) {
            return null;
        }
        TipCategoryResponse response = new TipCategoryResponse();
        response.setId(category.getId());
        response.setName(category.getName());
        response.setSlug(category.getSlug());
        response.setDescription(category.getDescription());
        response.setIcon(category.getIcon());
        response.setTipsCount(tipsCount);
        response.setCreatedAt(category.getCreatedAt());
        response.setUpdatedAt(category.getUpdatedAt());
        return response;
    }
}
