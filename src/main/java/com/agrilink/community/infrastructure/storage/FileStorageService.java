package com.agrilink.community.infrastructure.storage;

import com.agrilink.community.exception.FileStorageException;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Stores uploads on the local file system below a public root directory.
 *
 * <p>Files get a random name that keeps the original extension. Callers persist the returned
 * relative path; the same path is the public URL path of the file.
 *
 * @author AgriLink Team
 */
@Service
public class FileStorageService {

    private static final Logger logger = LoggerFactory.getLogger(FileStorageService.class);

    private final Path rootLocation;
    private final CloudWatchMetricsService metricsService;

    public FileStorageService(
            @Value("${agrilink.storage.root:./storage/public}") String root,
            CloudWatchMetricsService metricsService
    ) {
        this.rootLocation = Paths.get(root).toAbsolutePath().normalize();
        this.metricsService = metricsService;
    }

    public Path getRootLocation() {
        return rootLocation;
    }

    /**
     * Validate and store an upload.
     *
     * @param file Uploaded file
     * @param folder Target folder
     * @param policy Accepted extensions and size
     * @return Stored file description
     * @throws FileStorageException if the upload is rejected or cannot be written
     */
    public StoredFile store(MultipartFile file, StorageFolder folder, UploadPolicy policy) {
        if (file == null || file.isEmpty()) {
            throw FileStorageException.rejected("File is empty");
        }

        String originalName = StringUtils.cleanPath(
                file.getOriginalFilename() == null ? "" : file.getOriginalFilename());
        String extension = StringUtils.getFilenameExtension(originalName);

        if (!policy.allowsExtension(extension)) {
            throw FileStorageException.rejected(
                    "File type not allowed: " + originalName + ". Allowed: " + policy.getAllowedExtensions());
        }
        String mimeType = resolveMimeType(file, originalName);
        if (!policy.allowsContentType(mimeType)) {
            throw FileStorageException.rejected("File must be an image: " + originalName);
        }
        if (file.getSize() > policy.getMaxSizeBytes()) {
            throw FileStorageException.rejected(String.format(
                    "File %s exceeds the maximum size of %d KB", originalName, policy.getMaxSizeBytes() / 1024));
        }

        String storedName = UUID.randomUUID() + "." + extension.toLowerCase(Locale.ROOT);
        String relativePath = folder.getDirectory() + "/" + storedName;

        try {
            Path directory = rootLocation.resolve(folder.getDirectory());
            Files.createDirectories(directory);
            try (InputStream inputStream = file.getInputStream()) {
                Files.copy(inputStream, directory.resolve(storedName), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw FileStorageException.writeFailed("Failed to store file " + originalName, e);
        }

        metricsService.recordUpload(folder.getDirectory(), file.getSize());
        logger.info("Stored upload {} as {} ({} bytes)", originalName, relativePath, file.getSize());

        return new StoredFile(relativePath, originalName, mimeType, file.getSize());
    }

    /**
     * Delete a stored file. A missing file is logged and ignored.
     *
     * @param relativePath Path returned by {@link #store}
     * @return true if a file was deleted
     */
    public boolean delete(String relativePath) {
        if (!StringUtils.hasText(relativePath)) {
            return false;
        }
        Path target = rootLocation.resolve(relativePath).normalize();
        if (!target.startsWith(rootLocation)) {
            logger.warn("Refusing to delete {} outside the storage root", relativePath);
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(target);
            if (deleted) {
                logger.info("Deleted stored file {}", relativePath);
            } else {
                logger.warn("Stored file {} was already missing", relativePath);
            }
            return deleted;
        } catch (IOException e) {
            logger.error("Failed to delete stored file {}", relativePath, e);
            return false;
        }
    }

    private String resolveMimeType(MultipartFile file, String originalName) {
        String contentType = file.getContentType();
        if (StringUtils.hasText(contentType) && !"application/octet-stream".equals(contentType)) {
            return contentType;
        }
        String guessed = URLConnection.guessContentTypeFromName(originalName);
        return guessed != null ? guessed : "application/octet-stream";
    }
}
