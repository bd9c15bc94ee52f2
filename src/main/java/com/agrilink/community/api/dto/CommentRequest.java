package com.agrilink.community.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommentRequest {

    @NotBlank(message = "Comment is required")
    @Size(max = 5000, message = "Comment must not exceed 5000 characters")
    private String comment;

    private Long parentId;
}
