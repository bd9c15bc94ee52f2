package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.SuccessStory;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Response DTO for success stories. Comments are only filled on the detail view.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class StoryResponse {

    private Long id;
    private Long userId;
    private UserSummary user;
    private String title;
    private String content;
    private String location;
    private String cropType;
    private BigDecimal yieldImprovement;
    private String yieldUnit;
    private Boolean isFeatured;
    private Integer viewsCount;
    private Integer likesCount;
    private Integer commentsCount;
    private Boolean isLiked;
    private List<StoryImageResponse> images;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<StoryCommentResponse> comments;

    private Instant createdAt;
    private Instant updatedAt;

    public static StoryResponse fromEntity(SuccessStory story, UserSummary author,
                                           List<StoryImageResponse> images, boolean liked) {
        StoryResponse response = new StoryResponse();
        response.setId(story.getId());
        response.setUserId(story.getUserId());
        response.setUser(author);
        response.setTitle(story.getTitle());
        response.setContent(story.getContent());
        response.setLocation(story.getLocation());
        response.setCropType(story.getCropType());
        response.setYieldImprovement(story.getYieldImprovement());
        response.setYieldUnit(story.getYieldUnit());
        response.setIsFeatured(story.getFeatured());
        response.setViewsCount(story.getViewsCount());
        response.setLikesCount(story.getLikesCount());
        response.setCommentsCount(story.getCommentsCount());
        response.setIsLiked(liked);
        response.setImages(images);
        response.setCreatedAt(story.getCreatedAt());
        response.setUpdatedAt(story.getUpdatedAt());
        return response;
    }
}
