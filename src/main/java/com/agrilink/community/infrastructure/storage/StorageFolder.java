package com.agrilink.community.infrastructure.storage;

/**
 * Public upload folders. Each folder is served statically under its own name.
 *
 * @author AgriLink Team
 */
public enum StorageFolder {
    PRODUCT_IMAGES("productImages"),
    USER_IMAGES("userImage"),
    SUCCESS_STORIES("success_stories"),
    COMMUNITY_FILES("communityfiles");

    private final String directory;

    StorageFolder(String directory) {
        this.directory = directory;
    }

    public String getDirectory() {
        return directory;
    }
}
