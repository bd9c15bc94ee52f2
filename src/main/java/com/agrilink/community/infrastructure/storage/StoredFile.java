package com.agrilink.community.infrastructure.storage;

/**
 * Result of storing an upload.
 *
 * @param relativePath Path below the storage root, e.g. "productImages/3f2a....jpg"
 * @param originalName File name sent by the client
 * @param mimeType Content type
 * @param size Size in bytes
 */
public record StoredFile(String relativePath, String originalName, String mimeType, long size) {
}
