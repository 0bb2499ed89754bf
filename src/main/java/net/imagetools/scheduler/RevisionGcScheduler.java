package net.imagetools.scheduler;

import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.config.StorageProperties;
import net.imagetools.service.storage.GcReport;
import net.imagetools.service.storage.RevisionGarbageCollector;
import net.imagetools.util.LoggingUtils;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic revision garbage collection.
 */
@Component
@Slf4j
public class RevisionGcScheduler {

    private final StorageProperties storageProperties;
    private final RevisionGarbageCollector garbageCollector;

    public RevisionGcScheduler(StorageProperties storageProperties, RevisionGarbageCollector garbageCollector) {
        this.storageProperties = storageProperties;
        this.garbageCollector = garbageCollector;
    }

    @Scheduled(cron = "${imagetools.storage.gc-cron:0 30 * * * *}")
    public void collectGarbage() {
        if (!storageProperties.isGcEnabled()) {
            log.debug("Revision garbage collection skipped - disabled via configuration.");
            return;
        }
        Instant start = Instant.now();
        try {
            GcReport report = garbageCollector.collect();
            log.info("Revision garbage collection finished in {}ms (reclaimedEntries={}, deleted={}, retained={}, skippedImages={}).",
                Duration.between(start, Instant.now()).toMillis(),
                report.reclaimedEntries(), report.deletedObjects(), report.retainedObjects(), report.skippedImages());
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Revision garbage collection failed");
        }
    }
}
