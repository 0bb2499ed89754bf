package net.imagetools.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for revision storage, thumbnails and garbage collection.
 */
@Component
@ConfigurationProperties(prefix = "imagetools.storage")
public class StorageProperties {

    /**
     * Root directory of the local disk backend.
     */
    private String root = "./storage";

    /**
     * Thumbnails fit in a square of this many pixels.
     */
    private int thumbnailSize = 300;

    /**
     * JPEG quality used for thumbnails (0.0-1.0).
     */
    private float thumbnailQuality = 0.80f;

    /**
     * Objects younger than this are never garbage collected, which protects
     * revisions written by an in-flight edit that has not been appended yet.
     */
    private Duration gcGracePeriod = Duration.ofMinutes(10);

    /**
     * Whether the scheduled revision garbage collection runs.
     */
    private boolean gcEnabled = true;

    /**
     * Cron expression for revision garbage collection.
     */
    private String gcCron = "0 30 * * * *";

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public int getThumbnailSize() {
        return thumbnailSize;
    }

    public void setThumbnailSize(int thumbnailSize) {
        this.thumbnailSize = thumbnailSize;
    }

    public float getThumbnailQuality() {
        return thumbnailQuality;
    }

    public void setThumbnailQuality(float thumbnailQuality) {
        this.thumbnailQuality = thumbnailQuality;
    }

    public Duration getGcGracePeriod() {
        return gcGracePeriod;
    }

    public void setGcGracePeriod(Duration gcGracePeriod) {
        this.gcGracePeriod = gcGracePeriod;
    }

    public boolean isGcEnabled() {
        return gcEnabled;
    }

    public void setGcEnabled(boolean gcEnabled) {
        this.gcEnabled = gcEnabled;
    }

    public String getGcCron() {
        return gcCron;
    }

    public void setGcCron(String gcCron) {
        this.gcCron = gcCron;
    }
}
