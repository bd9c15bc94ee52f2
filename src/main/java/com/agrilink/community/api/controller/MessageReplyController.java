package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.ApiMessage;
import com.agrilink.community.api.dto.PageResponse;
import com.agrilink.community.api.dto.ReplyRequest;
import com.agrilink.community.api.dto.ReplyResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.MessageReplyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for threaded replies under a community message.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/community/messages/{messageId}/replies")
@Tag(name = "Community replies")
public class MessageReplyController {

    private final MessageReplyService replyService;

    public MessageReplyController(MessageReplyService replyService) {
        this.replyService = replyService;
    }

    /**
     * Top-level replies oldest first, each carrying its nested replies.
     */
    @GetMapping
    @Operation(summary = "List replies to a message")
    public ResponseEntity<PageResponse<ReplyResponse>> listReplies(@PathVariable Long messageId,
                                                                   @RequestParam(required = false) Integer page) {
        return ResponseEntity.ok(replyService.listReplies(messageId, page, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Reply to a message or to another reply", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ReplyResponse> addReply(@PathVariable Long messageId,
                                                  @Valid @RequestBody ReplyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(replyService.addReply(SecurityUtils.requireCurrentUser(), messageId, request));
    }

    @PutMapping("/{replyId}")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Edit a reply", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ReplyResponse> updateReply(@PathVariable Long messageId, @PathVariable Long replyId,
                                                     @Valid @RequestBody ReplyRequest request) {
        return ResponseEntity.ok(replyService.updateReply(SecurityUtils.requireCurrentUser(), messageId, replyId, request));
    }

    /**
     * Delete a reply and everything beneath it.
     */
    @DeleteMapping("/{replyId}")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Delete a reply and its sub-replies", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ApiMessage> deleteReply(@PathVariable Long messageId, @PathVariable Long replyId) {
        replyService.deleteReply(SecurityUtils.requireCurrentUser(), messageId, replyId);
        return ResponseEntity.ok(new ApiMessage("Reply deleted successfully"));
    }

    @PostMapping("/{replyId}/like")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Like or unlike a reply", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ToggleResponse> toggleLike(@PathVariable Long messageId, @PathVariable Long replyId) {
        return ResponseEntity.ok(replyService.toggleLike(SecurityUtils.requireCurrentUser(), messageId, replyId));
    }
}
