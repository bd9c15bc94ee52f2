package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.ApiMessage;
import com.agrilink.community.api.dto.CommunityMessageResponse;
import com.agrilink.community.api.dto.LatestMessagesResponse;
import com.agrilink.community.api.dto.MessageForm;
import com.agrilink.community.api.dto.MessagePageResponse;
import com.agrilink.community.api.dto.PollResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.api.validation.FormValidator;
import com.agrilink.community.api.validation.LenientBoolean;
import com.agrilink.community.api.validation.OnCreate;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.CommunityMessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.Instant;
import java.util.List;

/**
 * REST controller for the community discussion board.
 *
 * <p>Clients keep the board fresh by polling; listing and polling answers must never be cached,
 * so they carry explicit no-cache headers.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/community/messages")
@Tag(name = "Community", description = "Discussion board messages")
public class CommunityMessageController {

    private final CommunityMessageService messageService;
    private final FormValidator formValidator;

    public CommunityMessageController(CommunityMessageService messageService, FormValidator formValidator) {
        this.messageService = messageService;
        this.formValidator = formValidator;
    }

    /**
     * List messages, pinned first then newest.
     *
     * @param lastUpdated ISO-8601 instant; only messages updated after it
     */
    @GetMapping
    @Operation(summary = "List community messages")
    public ResponseEntity<MessagePageResponse> listMessages(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String pinned,
            @RequestParam(required = false) String announcement,
            @RequestParam(name = "last_updated", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant lastUpdated,
            @RequestParam(required = false) Integer page
    ) {
        MessagePageResponse messages = messageService.listMessages(category, search,
                LenientBoolean.parse(pinned, "pinned"), LenientBoolean.parse(announcement, "announcement"),
                lastUpdated, page);
        return noCache().body(messages);
    }

    /**
     * Messages posted after {@code last_id}, newest first, at most ten.
     */
    @GetMapping("/latest")
    @Operation(summary = "Messages newer than a known id")
    public ResponseEntity<LatestMessagesResponse> latest(
            @RequestParam(name = "last_id", required = false, defaultValue = "0") Long lastId) {
        return ResponseEntity.ok(messageService.latest(lastId));
    }

    /**
     * Changes since the client's cursor: new ids after {@code last_id} and/or edits after {@code last_updated}.
     */
    @GetMapping("/poll")
    @Operation(summary = "Poll for new or updated messages")
    public ResponseEntity<PollResponse> poll(
            @RequestParam(name = "last_id", required = false, defaultValue = "0") Long lastId,
            @RequestParam(name = "last_updated", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant lastUpdated
    ) {
        return noCache().body(messageService.poll(lastId, lastUpdated));
    }

    /**
     * Read a message with attachments and replies; counts a view.
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get a community message")
    public ResponseEntity<CommunityMessageResponse> getMessage(@PathVariable Long id) {
        return ResponseEntity.ok(messageService.viewMessage(id, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Post a message", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<CommunityMessageResponse> createMessage(
            @RequestParam(required = false) String title,
            @RequestParam(required = false) String content,
            @RequestParam(required = false) String category,
            @RequestParam(name = "tags", required = false) List<String> tags,
            @RequestParam(name = "tags[]", required = false) List<String> bracketedTags,
            @RequestParam(name = "is_pinned", required = false) String pinned,
            @RequestParam(name = "is_announcement", required = false) String announcement,
            @RequestParam(name = "attachments", required = false) List<MultipartFile> attachments,
            @RequestParam(name = "attachments[]", required = false) List<MultipartFile> bracketedAttachments,
            @RequestParam(name = "captions", required = false) List<String> captions,
            @RequestParam(name = "captions[]", required = false) List<String> bracketedCaptions
    ) {
        MessageForm form = form(title, content, category, FormParams.tags(tags, bracketedTags), pinned, announcement,
                FormParams.either(attachments, bracketedAttachments), FormParams.either(captions, bracketedCaptions));
        formValidator.validate(form, OnCreate.class);
        CommunityMessageResponse message = messageService.createMessage(SecurityUtils.requireCurrentUser(), form);
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    /**
     * Edit a message. Content is required as on creation; tags and flags that are not sent keep their values.
     */
    @PutMapping(value = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Edit a message", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<CommunityMessageResponse> updateMessage(
            @PathVariable Long id,
            @RequestParam(required = false) String title,
            @RequestParam(required = false) String content,
            @RequestParam(required = false) String category,
            @RequestParam(name = "tags", required = false) List<String> tags,
            @RequestParam(name = "tags[]", required = false) List<String> bracketedTags,
            @RequestParam(name = "is_pinned", required = false) String pinned,
            @RequestParam(name = "is_announcement", required = false) String announcement,
            @RequestParam(name = "attachments", required = false) List<MultipartFile> attachments,
            @RequestParam(name = "attachments[]", required = false) List<MultipartFile> bracketedAttachments,
            @RequestParam(name = "captions", required = false) List<String> captions,
            @RequestParam(name = "captions[]", required = false) List<String> bracketedCaptions
    ) {
        MessageForm form = form(title, content, category, FormParams.tags(tags, bracketedTags), pinned, announcement,
                FormParams.either(attachments, bracketedAttachments), FormParams.either(captions, bracketedCaptions));
        formValidator.validate(form, OnCreate.class);
        return ResponseEntity.ok(messageService.updateMessage(SecurityUtils.requireCurrentUser(), id, form));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Delete a message", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ApiMessage> deleteMessage(@PathVariable Long id) {
        messageService.deleteMessage(SecurityUtils.requireCurrentUser(), id);
        return ResponseEntity.ok(new ApiMessage("Message deleted successfully"));
    }

    @PostMapping("/{id}/like")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Like or unlike a message", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ToggleResponse> toggleLike(@PathVariable Long id) {
        return ResponseEntity.ok(messageService.toggleLike(SecurityUtils.requireCurrentUser(), id));
    }

    private static ResponseEntity.BodyBuilder noCache() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0");
    }

    private static MessageForm form(String title, String content, String category, List<String> tags,
                                    String pinned, String announcement,
                                    List<MultipartFile> attachments, List<String> captions) {
        return MessageForm.builder()
                .title(title)
                .content(content)
                .category(category)
                .tags(tags)
                .pinned(LenientBoolean.parse(pinned, "is_pinned"))
                .announcement(LenientBoolean.parse(announcement, "is_announcement"))
                .attachments(attachments)
                .captions(captions)
                .build();
    }
}
