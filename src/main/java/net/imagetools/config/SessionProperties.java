package net.imagetools.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strongly typed configuration for session retention and the expiry sweep.
 */
@Component
@ConfigurationProperties(prefix = "imagetools.session")
public class SessionProperties {

    /**
     * How long a session (and every image it owns) lives after creation.
     */
    private Duration retention = Duration.ofDays(7);

    /**
     * Maximum number of images one session may own.
     */
    private int maxImagesPerSession = 5;

    /**
     * Whether the scheduled expiry sweep runs.
     */
    private boolean sweepEnabled = true;

    /**
     * Cron expression for the expiry sweep.
     */
    private String sweepCron = "0 0 2 * * *";

    /**
     * Run one sweep as soon as the application is ready.
     */
    private boolean sweepOnStartup = true;

    /**
     * How long swept image ids are remembered so late callers get an expiry error instead of not-found.
     */
    private Duration tombstoneTtl = Duration.ofDays(1);

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public int getMaxImagesPerSession() {
        return maxImagesPerSession;
    }

    public void setMaxImagesPerSession(int maxImagesPerSession) {
        this.maxImagesPerSession = maxImagesPerSession;
    }

    public boolean isSweepEnabled() {
        return sweepEnabled;
    }

    public void setSweepEnabled(boolean sweepEnabled) {
        this.sweepEnabled = sweepEnabled;
    }

    public String getSweepCron() {
        return sweepCron;
    }

    public void setSweepCron(String sweepCron) {
        this.sweepCron = sweepCron;
    }

    public boolean isSweepOnStartup() {
        return sweepOnStartup;
    }

    public void setSweepOnStartup(boolean sweepOnStartup) {
        this.sweepOnStartup = sweepOnStartup;
    }

    public Duration getTombstoneTtl() {
        return tombstoneTtl;
    }

    public void setTombstoneTtl(Duration tombstoneTtl) {
        this.tombstoneTtl = tombstoneTtl;
    }
}
