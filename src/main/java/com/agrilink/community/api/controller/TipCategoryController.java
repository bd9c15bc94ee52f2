package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.TipCategoryListResponse;
import com.agrilink.community.api.dto.TipCategoryRequest;
import com.agrilink.community.api.dto.TipCategoryResponse;
import com.agrilink.community.api.validation.OnCreate;
import com.agrilink.community.service.TipCategoryService;
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
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for farming tip categories.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/tip-categories")
@Tag(name = "Tip categories")
public class TipCategoryController {

    private final TipCategoryService tipCategoryService;

    public TipCategoryController(TipCategoryService tipCategoryService) {
        this.tipCategoryService = tipCategoryService;
    }

    @GetMapping
    @Operation(summary = "List tip categories with tip counts")
    public ResponseEntity<TipCategoryListResponse> listCategories() {
        return ResponseEntity.ok(tipCategoryService.listCategories());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a tip category")
    public ResponseEntity<TipCategoryResponse> getCategory(@PathVariable Long id) {
        return ResponseEntity.ok(tipCategoryService.getCategory(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Create a tip category", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<TipCategoryResponse> createCategory(
            @Validated(OnCreate.class) @RequestBody TipCategoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tipCategoryService.createCategory(request));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update a tip category", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<TipCategoryResponse> updateCategory(@PathVariable Long id,
                                                              @Valid @RequestBody TipCategoryRequest request) {
        return ResponseEntity.ok(tipCategoryService.updateCategory(id, request));
    }

    /**
     * Delete a category and every tip filed under it.
     */
    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Delete a tip category and its tips", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<Void> deleteCategory(@PathVariable Long id) {
        tipCategoryService.deleteCategory(id);
        return ResponseEntity.noContent().build();
    }
}
