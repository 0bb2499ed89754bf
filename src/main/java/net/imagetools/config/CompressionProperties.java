package net.imagetools.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Compression profiles keyed by id. The built-in {@code email}, {@code web} and
 * {@code web_hq} profiles can be overridden or extended from configuration.
 */
@Component
@ConfigurationProperties(prefix = "imagetools.compression")
public class CompressionProperties {

    private Map<String, Profile> profiles = new LinkedHashMap<>(Map.of(
        "email", new Profile("Email Optimized", 800, 800, 85, 500, "JPEG"),
        "web", new Profile("Web Standard", 1920, 1920, 90, 500, "JPEG"),
        "web_hq", new Profile("Web High Quality", 2560, 2560, 95, 1000, "PNG")
    ));

    public Map<String, Profile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, Profile> profiles) {
        this.profiles = profiles;
    }

    public static class Profile {
        private String name;
        private int maxWidth;
        private int maxHeight;
        private int quality = 85;
        private int targetSizeKb;
        private String format = "JPEG";
        private boolean retainAspectRatio = true;

        public Profile() {
        }

        public Profile(String name, int maxWidth, int maxHeight, int quality, int targetSizeKb, String format) {
            this.name = name;
            this.maxWidth = maxWidth;
            this.maxHeight = maxHeight;
            this.quality = quality;
            this.targetSizeKb = targetSizeKb;
            this.format = format;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getMaxWidth() {
            return maxWidth;
        }

        public void setMaxWidth(int maxWidth) {
            this.maxWidth = maxWidth;
        }

        public int getMaxHeight() {
            return maxHeight;
        }

        public void setMaxHeight(int maxHeight) {
            this.maxHeight = maxHeight;
        }

        public int getQuality() {
            return quality;
        }

        public void setQuality(int quality) {
            this.quality = quality;
        }

        public int getTargetSizeKb() {
            return targetSizeKb;
        }

        public void setTargetSizeKb(int targetSizeKb) {
            this.targetSizeKb = targetSizeKb;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public boolean isRetainAspectRatio() {
            return retainAspectRatio;
        }

        public void setRetainAspectRatio(boolean retainAspectRatio) {
            this.retainAspectRatio = retainAspectRatio;
        }
    }
}
