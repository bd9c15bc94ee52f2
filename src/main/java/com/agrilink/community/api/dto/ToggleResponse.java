package com.agrilink.community.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a like or save toggle. Saves carry no counter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToggleResponse {

    private Boolean isLiked;
    private Boolean isSaved;
    private Integer likesCount;

    public static ToggleResponse liked(boolean liked, int likesCount) {
        return new ToggleResponse(liked, null, likesCount);
    }

    public static ToggleResponse saved(boolean saved) {
        return new ToggleResponse(null, saved, null);
    }
}
