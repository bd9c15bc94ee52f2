package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.MessageReply;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A reply with its nested replies. Depth 0 is a top-level reply.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class ReplyResponse {

    private Long id;
    private Long messageId;
    private Long userId;
    private UserSummary user;
    private String content;
    private Long parentReplyId;
    private Integer likesCount;
    private Boolean isLiked;
    private int depth;
    private List<ReplyResponse> replies = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;

    public static ReplyResponse fromEntity(MessageReply reply, UserSummary author, boolean liked, int depth) {
        ReplyResponse response = new ReplyResponse();
        response.setId(reply.getId());
        response.setMessageId(reply.getMessageId());
        response.setUserId(reply.getUserId());
        response.setUser(author);
        response.setContent(reply.getContent());
        response.setParentReplyId(reply.getParentReplyId());
        response.setLikesCount(reply.getLikesCount());
        response.setIsLiked(liked);
        response.setDepth(depth);
        response.setCreatedAt(reply.getCreatedAt());
        response.setUpdatedAt(reply.getUpdatedAt());
        return response;
    }
}
