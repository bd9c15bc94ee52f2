package com.agrilink.community.api.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Page of community messages with the polling hints clients use to schedule their next poll.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class MessagePageResponse extends PageResponse<CommunityMessageResponse> {

    private Instant serverTime;
    private long pollingInterval;

    public MessagePageResponse(List<CommunityMessageResponse> data, int currentPage, int perPage, long total,
                               Instant serverTime, long pollingInterval) {
        super(data, currentPage, perPage, total);
        this.serverTime = serverTime;
        this.pollingInterval = pollingInterval;
    }
}
