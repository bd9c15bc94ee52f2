package com.agrilink.community.config;

import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves each upload folder under its own URL prefix (e.g. /productImages/abc.jpg).
 *
 * @author AgriLink Team
 */
@Configuration
public class StorageConfig implements WebMvcConfigurer {

    private final FileStorageService fileStorageService;

    public StorageConfig(FileStorageService fileStorageService) {
        this.fileStorageService = fileStorageService;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        for (StorageFolder folder : StorageFolder.values()) {
            String location = fileStorageService.getRootLocation()
                    .resolve(folder.getDirectory())
                    .toUri()
                    .toString();
            registry.addResourceHandler("/" + folder.getDirectory() + "/**")
                    .addResourceLocations(location.endsWith("/") ? location : location + "/");
        }
    }
}
