package com.agrilink.community.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Result of a poll for new or changed community messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollResponse {

    private List<CommunityMessageResponse> data;
    private Long lastId;
    private Instant serverTime;
    private boolean hasNewMessages;
    private long pollingInterval;
}
