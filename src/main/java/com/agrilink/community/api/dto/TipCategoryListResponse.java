package com.agrilink.community.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tip categories with the overall totals shown on the tips landing page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TipCategoryListResponse {

    private List<TipCategoryResponse> data;
    private long totalCategories;
    private long totalTips;
}
