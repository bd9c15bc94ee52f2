package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.StoryImage;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class StoryImageResponse {

    private Long id;
    private String imagePath;
    private String caption;
    private Integer sortOrder;

    public static StoryImageResponse fromEntity(StoryImage image) {
        StoryImageResponse response = new StoryImageResponse();
        response.setId(image.getId());
        response.setImagePath(image.getImagePath());
        response.setCaption(image.getCaption());
        response.setSortOrder(image.getSortOrder());
        return response;
    }
}
