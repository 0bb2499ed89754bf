package net.imagetools.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Typed configuration for upload admission.
 */
@Component
@ConfigurationProperties(prefix = "imagetools.upload")
public class UploadProperties {

    private DataSize maxSize = DataSize.ofMegabytes(20);

    private List<String> allowedExtensions = new ArrayList<>(
        List.of("jpg", "jpeg", "png", "gif", "bmp", "webp", "tiff"));

    public DataSize getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(DataSize maxSize) {
        this.maxSize = maxSize;
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }
}
