package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.MessageReply;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplyRequest {

    @NotBlank(message = "Content is required")
    @Size(max = MessageReply.MAX_CONTENT_LENGTH, message = "Content must not exceed 5000 characters")
    private String content;

    /**
     * Only read when creating a reply.
     */
    private Long parentReplyId;
}
