package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.CommunityMessage;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for community messages. Replies are only filled on the detail view.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class CommunityMessageResponse {

    private Long id;
    private Long userId;
    private UserSummary user;
    private String title;
    private String content;
    private String category;
    private List<String> tags;
    private Boolean isPinned;
    private Boolean isAnnouncement;
    private Integer viewsCount;
    private Integer likesCount;
    private Integer repliesCount;
    private Instant lastReplyAt;
    private Boolean isLiked;
    private List<AttachmentResponse> attachments;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<ReplyResponse> replies;

    private Instant createdAt;
    private Instant updatedAt;

    public static CommunityMessageResponse fromEntity(CommunityMessage message, UserSummary author,
                                                      List<AttachmentResponse> attachments, boolean liked) {
        CommunityMessageResponse response = new CommunityMessageResponse();
        response.setId(message.getId());
        response.setUserId(message.getUserId());
        response.setUser(author);
        response.setTitle(message.getTitle());
        response.setContent(message.getContent());
        response.setCategory(message.getCategory());
        response.setTags(message.getTags() == null ? new ArrayList<>() : new ArrayList<>(message.getTags()));
        response.setIsPinned(message.getPinned());
        response.setIsAnnouncement(message.getAnnouncement());
        response.setViewsCount(message.getViewsCount());
        response.setLikesCount(message.getLikesCount());
        response.setRepliesCount(message.getRepliesCount());
        response.setLastReplyAt(message.getLastReplyAt());
        response.setIsLiked(liked);
        response.setAttachments(attachments);
        response.setCreatedAt(message.getCreatedAt());
        response.setUpdatedAt(message.getUpdatedAt());
        return response;
    }
}
