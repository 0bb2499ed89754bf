package net.imagetools.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for applying operations: locking, transform limits and the
 * background-removal model catalogue.
 */
@Component
@ConfigurationProperties(prefix = "imagetools.edit")
public class EditProperties {

    /**
     * How long a mutation waits for the image lock before failing as busy.
     */
    private Duration lockWaitTimeout = Duration.ofSeconds(30);

    /**
     * Upper bound for a single transform call; longer calls are cancelled.
     */
    private Duration transformTimeout = Duration.ofSeconds(60);

    /**
     * Attempts for retryable transform failures (1 disables retry).
     */
    private int transformMaxAttempts = 2;

    /**
     * Linear backoff base between transform attempts.
     */
    private Duration transformBackoff = Duration.ofMillis(200);

    /**
     * Threads available for transform work.
     */
    private int transformThreads = 4;

    /**
     * Largest width or height any operation may produce.
     */
    private int maxDimension = 10_000;

    /**
     * Encoder quality for lossy formats written by non-compress operations (0.0-1.0).
     */
    private float encodeQuality = 0.95f;

    /**
     * Background removal models callers may select.
     */
    private List<String> backgroundModels = new ArrayList<>(
        List.of("u2net", "u2net_human_seg", "isnet-general-use", "isnet-anime"));

    /**
     * Model used when a background removal request names none.
     */
    private String defaultBackgroundModel = "u2net";

    public Duration getLockWaitTimeout() {
        return lockWaitTimeout;
    }

    public void setLockWaitTimeout(Duration lockWaitTimeout) {
        this.lockWaitTimeout = lockWaitTimeout;
    }

    public Duration getTransformTimeout() {
        return transformTimeout;
    }

    public void setTransformTimeout(Duration transformTimeout) {
        this.transformTimeout = transformTimeout;
    }

    public int getTransformMaxAttempts() {
        return transformMaxAttempts;
    }

    public void setTransformMaxAttempts(int transformMaxAttempts) {
        this.transformMaxAttempts = transformMaxAttempts;
    }

    public Duration getTransformBackoff() {
        return transformBackoff;
    }

    public void setTransformBackoff(Duration transformBackoff) {
        this.transformBackoff = transformBackoff;
    }

    public int getTransformThreads() {
        return transformThreads;
    }

    public void setTransformThreads(int transformThreads) {
        this.transformThreads = transformThreads;
    }

    public int getMaxDimension() {
        return maxDimension;
    }

    public void setMaxDimension(int maxDimension) {
        this.maxDimension = maxDimension;
    }

    public float getEncodeQuality() {
        return encodeQuality;
    }

    public void setEncodeQuality(float encodeQuality) {
        this.encodeQuality = encodeQuality;
    }

    public List<String> getBackgroundModels() {
        return backgroundModels;
    }

    public void setBackgroundModels(List<String> backgroundModels) {
        this.backgroundModels = backgroundModels;
    }

    public String getDefaultBackgroundModel() {
        return defaultBackgroundModel;
    }

    public void setDefaultBackgroundModel(String defaultBackgroundModel) {
        this.defaultBackgroundModel = defaultBackgroundModel;
    }
}
