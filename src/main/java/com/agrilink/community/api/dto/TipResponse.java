package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.Tip;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for tips. {@code is_liked} and {@code is_saved} are relative to the caller
 * and false for anonymous requests.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class TipResponse {

    private Long id;
    private Long userId;
    private UserSummary user;
    private Long categoryId;
    private TipCategoryResponse category;
    private String title;
    private String slug;
    private String content;
    private Boolean isFeatured;
    private Integer viewsCount;
    private Integer likesCount;
    private List<String> tags;
    private Boolean isLiked;
    private Boolean isSaved;
    private Instant createdAt;
    private Instant updatedAt;

    public static TipResponse fromEntity(Tip tip, UserSummary author, TipCategoryResponse category,
                                         boolean liked, boolean saved) {
        TipResponse response = new TipResponse();
        response.setId(tip.getId());
        response.setUserId(tip.getUserId());
        response.setUser(author);
        response.setCategoryId(tip.getCategoryId());
        response.setCategory(category);
        response.setTitle(tip.getTitle());
        response.setSlug(tip.getSlug());
        response.setContent(tip.getContent());
        response.setIsFeatured(tip.getFeatured());
        response.setViewsCount(tip.getViewsCount());
        response.setLikesCount(tip.getLikesCount());
        response.setTags(tip.getTags() == null ? new ArrayList<>() : new ArrayList<>(tip.getTags()));
        response.setIsLiked(liked);
        response.setIsSaved(saved);
        response.setCreatedAt(tip.getCreatedAt());
        response.setUpdatedAt(tip.getUpdatedAt());
        return response;
    }
}
