package com.agrilink.community.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * File attached to a community message.
 *
 * @author AgriLink Team
 */
@Entity
@Table(name = "message_attachments", indexes = {
    @Index(name = "idx_attachments_message", columnList = "message_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageAttachment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    /**
     * Name of the file as uploaded by the client.
     */
    @Column(name = "file_name", nullable = false, length = 255)
    private String fileName;

    @Column(name = "file_path", nullable = false, length = 500)
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(name = "file_type", nullable = false, length = 20)
    private FileType fileType;

    @Column(name = "mime_type", length = 100)
    private String mimeType;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "caption", length = 500)
    private String caption;

    @Column(name = "sort_order", nullable = false)
    @Builder.Default
    private Integer sortOrder = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public enum FileType {
        IMAGE,
        VIDEO,
        AUDIO,
        DOCUMENT;

        /**
         * Derive the attachment type from a MIME type. Anything that is not image, video or audio
         * is a document.
         */
        public static FileType fromMimeType(String mimeType) {
            if (mimeType == null) {
                return DOCUMENT;
            }
            String normalized = mimeType.toLowerCase(Locale.ROOT);
            if (normalized.startsWith("image/")) {
                return IMAGE;
            }
            if (normalized.startsWith("video/")) {
                return VIDEO;
            }
            if (normalized.startsWith("audio/")) {
                return AUDIO;
            }
            return DOCUMENT;
        }

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
