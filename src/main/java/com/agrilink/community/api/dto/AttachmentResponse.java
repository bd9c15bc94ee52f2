package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.MessageAttachment;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class AttachmentResponse {

    private Long id;
    private String fileName;
    private String filePath;
    private String fileType;
    private String mimeType;
    private Long fileSize;
    private String caption;
    private Integer sortOrder;

    public static AttachmentResponse fromEntity(MessageAttachment attachment) {
        AttachmentResponse response = new AttachmentResponse();
        response.setId(attachment.getId());
        response.setFileName(attachment.getFileName());
        response.setFilePath(attachment.getFilePath());
        response.setFileType(attachment.getFileType().getValue());
        response.setMimeType(attachment.getMimeType());
        response.setFileSize(attachment.getFileSize());
        response.setCaption(attachment.getCaption());
        response.setSortOrder(attachment.getSortOrder());
        return response;
    }
}
