package com.agrilink.community.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LatestMessagesResponse {

    private List<CommunityMessageResponse> data;
    private Long lastId;
}
