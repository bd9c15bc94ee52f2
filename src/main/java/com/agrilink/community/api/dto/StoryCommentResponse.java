package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.StoryComment;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A story comment with its nested replies.
 */
@Data
@NoArgsConstructor
public class StoryCommentResponse {

    private Long id;
    private Long storyId;
    private Long userId;
    private UserSummary user;
    private String comment;
    private Long parentId;
    private List<StoryCommentResponse> replies = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;

    public static StoryCommentResponse fromEntity(StoryComment comment, UserSummary author) {
        StoryCommentResponse response = new StoryCommentResponse();
        response.setId(comment.getId());
        response.setStoryId(comment.getStoryId());
        response.setUserId(comment.getUserId());
        response.setUser(author);
        response.setComment(comment.getComment());
        response.setParentId(comment.getParentId());
        response.setCreatedAt(comment.getCreatedAt());
        response.setUpdatedAt(comment.getUpdatedAt());
        return response;
    }
}
