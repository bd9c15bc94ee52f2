package com.agrilink.community.api.dto;

import com.agrilink.community.api.validation.OnCreate;
import com.agrilink.community.domain.model.CommunityMessage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Community message fields posted as multipart form data.
 * Tags arrive either repeated or as one comma-separated value.
 *
 * @author AgriLink Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageForm {

    @Size(max = 255, message = "The title must not exceed 255 characters")
    private String title;

    @NotBlank(groups = OnCreate.class, message = "The content field is required")
    @Size(max = CommunityMessage.MAX_CONTENT_LENGTH, message = "The content must not exceed 10000 characters")
    private String content;

    @Size(max = 100, message = "The category must not exceed 100 characters")
    private String category;

    private List<@Size(max = 50, message = "Tags must not exceed 50 characters") String> tags;

    private Boolean pinned;

    private Boolean announcement;

    @Builder.Default
    private List<MultipartFile> attachments = new ArrayList<>();

    @Builder.Default
    private List<@Size(max = 255, message = "Captions must not exceed 255 characters") String> captions = new ArrayList<>();
}
