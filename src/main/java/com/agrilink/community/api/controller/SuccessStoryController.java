package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.ApiMessage;
import com.agrilink.community.api.dto.CommentRequest;
import com.agrilink.community.api.dto.PageResponse;
import com.agrilink.community.api.dto.StoryCommentResponse;
import com.agrilink.community.api.dto.StoryForm;
import com.agrilink.community.api.dto.StoryResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.api.validation.FormValidator;
import com.agrilink.community.api.validation.LenientBoolean;
import com.agrilink.community.api.validation.OnCreate;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.SuccessStoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
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
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.util.List;

/**
 * REST controller for farmer success stories, their photos, likes and comments.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/success-stories")
@Tag(name = "Success stories")
public class SuccessStoryController {

    private final SuccessStoryService storyService;
    private final FormValidator formValidator;

    public SuccessStoryController(SuccessStoryService storyService, FormValidator formValidator) {
        this.storyService = storyService;
        this.formValidator = formValidator;
    }

    /**
     * Search stories.
     *
     * @param search Matched against title, content and crop type
     * @param sort popular, views or latest (default)
     */
    @GetMapping
    @Operation(summary = "List success stories")
    public ResponseEntity<PageResponse<StoryResponse>> listStories(
            @RequestParam(required = false) String search,
            @RequestParam(name = "crop_type", required = false) String cropType,
            @RequestParam(required = false) String featured,
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) Integer page
    ) {
        return ResponseEntity.ok(storyService.listStories(search, cropType, LenientBoolean.parse(featured, "featured"),
                sort, page, SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/my-stories")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Stories written by the caller", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<PageResponse<StoryResponse>> listMyStories(@RequestParam(required = false) Integer page) {
        return ResponseEntity.ok(storyService.listMyStories(SecurityUtils.requireCurrentUser(), page));
    }

    /**
     * Read a story with its images and full comment tree; counts a view.
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get a success story")
    public ResponseEntity<StoryResponse> getStory(@PathVariable Long id) {
        return ResponseEntity.ok(storyService.viewStory(id, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Share a success story", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<StoryResponse> createStory(
            @RequestParam(required = false) String title,
            @RequestParam(required = false) String content,
            @RequestParam(required = false) String location,
            @RequestParam(name = "crop_type", required = false) String cropType,
            @RequestParam(name = "yield_improvement", required = false) BigDecimal yieldImprovement,
            @RequestParam(name = "yield_unit", required = false) String yieldUnit,
            @RequestParam(name = "images", required = false) List<MultipartFile> images,
            @RequestParam(name = "images[]", required = false) List<MultipartFile> bracketedImages,
            @RequestParam(name = "captions", required = false) List<String> captions,
            @RequestParam(name = "captions[]", required = false) List<String> bracketedCaptions
    ) {
        StoryForm form = form(title, content, location, cropType, yieldImprovement, yieldUnit,
                FormParams.either(images, bracketedImages), FormParams.either(captions, bracketedCaptions));
        formValidator.validate(form, OnCreate.class);
        return ResponseEntity.status(HttpStatus.CREATED).body(storyService.createStory(SecurityUtils.requireCurrentUser(), form));
    }

    /**
     * Update a story. Sent images are appended after the existing ones.
     */
    @PutMapping(value = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Update a success story", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<StoryResponse> updateStory(
            @PathVariable Long id,
            @RequestParam(required = false) String title,
            @RequestParam(required = false) String content,
            @RequestParam(required = false) String location,
            @RequestParam(name = "crop_type", required = false) String cropType,
            @RequestParam(name = "yield_improvement", required = false) BigDecimal yieldImprovement,
            @RequestParam(name = "yield_unit", required = false) String yieldUnit,
            @RequestParam(name = "images", required = false) List<MultipartFile> images,
            @RequestParam(name = "images[]", required = false) List<MultipartFile> bracketedImages,
            @RequestParam(name = "captions", required = false) List<String> captions,
            @RequestParam(name = "captions[]", required = false) List<String> bracketedCaptions
    ) {
        StoryForm form = form(title, content, location, cropType, yieldImprovement, yieldUnit,
                FormParams.either(images, bracketedImages), FormParams.either(captions, bracketedCaptions));
        formValidator.validate(form);
        return ResponseEntity.ok(storyService.updateStory(SecurityUtils.requireCurrentUser(), id, form));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Delete a success story", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ApiMessage> deleteStory(@PathVariable Long id) {
        storyService.deleteStory(SecurityUtils.requireCurrentUser(), id);
        return ResponseEntity.ok(new ApiMessage("Success story deleted successfully"));
    }

    @PostMapping("/{id}/like")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Like or unlike a story", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ToggleResponse> toggleLike(@PathVariable Long id) {
        return ResponseEntity.ok(storyService.toggleLike(SecurityUtils.requireCurrentUser(), id));
    }

    @GetMapping("/{id}/comments")
    @Operation(summary = "List top-level comments with their replies")
    public ResponseEntity<PageResponse<StoryCommentResponse>> listComments(@PathVariable Long id,
                                                                           @RequestParam(required = false) Integer page) {
        return ResponseEntity.ok(storyService.listComments(id, page));
    }

    @PostMapping("/{id}/comments")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Comment on a story or reply to a comment", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<StoryCommentResponse> addComment(@PathVariable Long id,
                                                           @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(storyService.addComment(SecurityUtils.requireCurrentUser(), id, request));
    }

    private static StoryForm form(String title, String content, String location, String cropType,
                                  BigDecimal yieldImprovement, String yieldUnit,
                                  List<MultipartFile> images, List<String> captions) {
        return StoryForm.builder()
                .title(title)
                .content(content)
                .location(location)
                .cropType(cropType)
                .yieldImprovement(yieldImprovement)
                .yieldUnit(yieldUnit)
                .images(images)
                .captions(captions)
                .build();
    }
}
