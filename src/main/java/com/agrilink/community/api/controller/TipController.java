package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.ApiMessage;
import com.agrilink.community.api.dto.PageResponse;
import com.agrilink.community.api.dto.TipRequest;
import com.agrilink.community.api.dto.TipResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.api.validation.LenientBoolean;
import com.agrilink.community.api.validation.OnCreate;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.TipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
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
 * REST controller for farming tips written by experts.
 * Listing endpoints are public; is_liked and is_saved are filled in when a token is sent.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/tips")
@Tag(name = "Tips", description = "Expert farming tips")
public class TipController {

    private final TipService tipService;

    public TipController(TipService tipService) {
        this.tipService = tipService;
    }

    /**
     * Search tips.
     *
     * @param category Tip category id
     * @param search Matched against title, content and tags
     * @param featured Lenient boolean filter
     * @param sort popular, views or latest (default)
     * @param page 1-based page number
     */
    @GetMapping
    @Operation(summary = "List tips")
    public ResponseEntity<PageResponse<TipResponse>> listTips(
            @RequestParam(required = false) Long category,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String featured,
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) Integer page
    ) {
        return ResponseEntity.ok(tipService.listTips(category, search, LenientBoolean.parse(featured, "featured"),
                sort, page, SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/featured")
    @Operation(summary = "List featured tips")
    public ResponseEntity<PageResponse<TipResponse>> listFeatured(@RequestParam(required = false) Integer page) {
        return ResponseEntity.ok(tipService.listFeatured(page, SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/saved")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Tips the caller saved", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<PageResponse<TipResponse>> listSaved(@RequestParam(required = false) Integer page) {
        return ResponseEntity.ok(tipService.listSaved(SecurityUtils.requireCurrentUser(), page));
    }

    @GetMapping("/my-tips")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Tips written by the calling expert", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<PageResponse<TipResponse>> listMyTips(@RequestParam(required = false) Integer page) {
        return ResponseEntity.ok(tipService.listMyTips(SecurityUtils.requireCurrentUser(), page));
    }

    /**
     * Read a tip; every read counts as a view.
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get a tip")
    public ResponseEntity<TipResponse> getTip(@PathVariable Long id) {
        return ResponseEntity.ok(tipService.viewTip(id, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Publish a tip (experts)", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<TipResponse> createTip(@Validated(OnCreate.class) @RequestBody TipRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tipService.createTip(SecurityUtils.requireCurrentUser(), request));
    }

    @PutMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Update a tip", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<TipResponse> updateTip(@PathVariable Long id, @Valid @RequestBody TipRequest request) {
        return ResponseEntity.ok(tipService.updateTip(SecurityUtils.requireCurrentUser(), id, request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Delete a tip", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ApiMessage> deleteTip(@PathVariable Long id) {
        tipService.deleteTip(SecurityUtils.requireCurrentUser(), id);
        return ResponseEntity.ok(new ApiMessage("Tip deleted successfully"));
    }

    @PostMapping("/{id}/like")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Like or unlike a tip", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ToggleResponse> toggleLike(@PathVariable Long id) {
        return ResponseEntity.ok(tipService.toggleLike(SecurityUtils.requireCurrentUser(), id));
    }

    @PostMapping("/{id}/save")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Save or unsave a tip", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ToggleResponse> toggleSave(@PathVariable Long id) {
        return ResponseEntity.ok(tipService.toggleSave(SecurityUtils.requireCurrentUser(), id));
    }
}
