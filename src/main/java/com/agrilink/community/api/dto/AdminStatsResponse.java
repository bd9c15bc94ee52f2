package com.agrilink.community.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Dashboard totals for administrators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminStatsResponse {

    private long totalUsers;
    private Map<String, Long> usersByRole;
    private long totalProducts;
    private long totalOrders;
    private Map<String, Long> ordersByStatus;
    private long totalConsultations;
    private Map<String, Long> consultationsByStatus;
    private long totalTips;
    private long totalSuccessStories;
    private long totalCommunityMessages;
}
