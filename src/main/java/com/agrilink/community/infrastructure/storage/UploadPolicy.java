package com.agrilink.community.infrastructure.storage;

import java.util.Locale;
import java.util.Set;

/**
 * Accepted extensions and maximum size for one kind of upload.
 *
 * @author AgriLink Team
 */
public final class UploadPolicy {

    private static final long MB = 1024L * 1024L;

    /**
     * Pictures (products, profile images, story images).
     */
    public static final UploadPolicy IMAGE = new UploadPolicy(
            Set.of("jpg", "jpeg", "png", "gif", "bmp", "webp"), 5 * MB, true);

    /**
     * Community message attachments.
     */
    public static final UploadPolicy ATTACHMENT = new UploadPolicy(
            Set.of("jpg", "jpeg", "png", "gif", "pdf", "doc", "docx", "txt", "mp4", "avi", "mov", "mp3", "wav"),
            10 * MB, false);

    private final Set<String> allowedExtensions;
    private final long maxSizeBytes;
    private final boolean imageOnly;

    private UploadPolicy(Set<String> allowedExtensions, long maxSizeBytes, boolean imageOnly) {
        this.allowedExtensions = allowedExtensions;
        this.maxSizeBytes = maxSizeBytes;
        this.imageOnly = imageOnly;
    }

    public boolean allowsExtension(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Image uploads must also declare an image content type.
     */
    public boolean allowsContentType(String contentType) {
        if (!imageOnly) {
            return true;
        }
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("image/");
    }

    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }
}
