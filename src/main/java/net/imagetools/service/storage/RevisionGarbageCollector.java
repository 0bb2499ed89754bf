package net.imagetools.service.storage;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.config.StorageProperties;
import net.imagetools.exception.ImageBusyException;
import net.imagetools.exception.NotFoundException;
import net.imagetools.model.HistoryEntry;
import net.imagetools.model.Image;
import net.imagetools.repository.ImageRepository;
import net.imagetools.service.EditMetrics;
import net.imagetools.service.history.HistoryLog;
import net.imagetools.service.history.ImageHistory;
import net.imagetools.support.lock.ImageMutationCoordinator;
import net.imagetools.util.LoggingUtils;
import org.springframework.stereotype.Service;

/**
 * Deletes stored objects nothing points at any more.
 *
 * <p>A pass first reclaims abandoned history entries, skipping images that are being
 * mutated, then removes every listed object that no image or live entry references and
 * that is older than the grace period. The grace period covers revisions written by an
 * edit that has not appended its entry yet.</p>
 */
@Slf4j
@Service
public class RevisionGarbageCollector {

    private final RevisionStore revisionStore;
    private final HistoryLog historyLog;
    private final ImageRepository imageRepository;
    private final ImageMutationCoordinator coordinator;
    private final StorageProperties properties;
    private final EditMetrics metrics;
    private final Clock clock;

    public RevisionGarbageCollector(RevisionStore revisionStore,
                                    HistoryLog historyLog,
                                    ImageRepository imageRepository,
                                    ImageMutationCoordinator coordinator,
                                    StorageProperties properties,
                                    EditMetrics metrics,
                                    Clock clock) {
        this.revisionStore = revisionStore;
        this.historyLog = historyLog;
        this.imageRepository = imageRepository;
        this.coordinator = coordinator;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public GcReport collect() {
        int reclaimed = 0;
        int skipped = 0;
        int deleted = 0;
        for (String imageId : historyLog.imageIds()) {
            List<HistoryEntry> entries;
            try {
                entries = coordinator.tryWithImageLock(imageId, () -> historyLog.reclaimAbandoned(imageId));
            } catch (ImageBusyException e) {
                skipped++;
                log.debug("Skipping reclaim of busy image {}", imageId);
                continue;
            } catch (NotFoundException e) {
                log.debug("Image {} was deleted before its history could be reclaimed", imageId);
                continue;
            }
            reclaimed += entries.size();
            for (HistoryEntry entry : entries) {
                deleted += deleteQuietly(entry.revision().key()) ? 1 : 0;
                deleted += deleteQuietly(entry.thumbnail().key()) ? 1 : 0;
            }
        }

        Set<String> referenced = referencedKeys();
        Instant cutoff = clock.instant().minus(properties.getGcGracePeriod());
        int retained = 0;
        for (StoredObject object : revisionStore.listObjects()) {
            if (referenced.contains(object.key())) {
                continue;
            }
            if (object.lastModified() != null && object.lastModified().isAfter(cutoff)) {
                retained++;
                continue;
            }
            if (deleteQuietly(object.key())) {
                deleted++;
            }
        }

        metrics.objectsCollected(deleted);
        GcReport report = new GcReport(reclaimed, deleted, retained, skipped);
        log.info("Revision garbage collection on {}: {}", revisionStore.backendName(), report);
        return report;
    }

    private boolean deleteQuietly(String key) {
        try {
            revisionStore.deleteKey(key);
            return true;
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Garbage collection could not delete {}", key);
            return false;
        }
    }

    private Set<String> referencedKeys() {
        Set<String> keys = new HashSet<>();
        for (Image image : imageRepository.findAll()) {
            keys.add(image.originalRevision().key());
            keys.add(image.currentRevision().key());
            keys.add(image.currentThumbnail().key());
        }
        for (String imageId : historyLog.imageIds()) {
            historyLog.find(imageId).map(ImageHistory::referencedKeys).ifPresent(keys::addAll);
        }
        return keys;
    }
}
