package net.imagetools.service.history;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.domain.operation.ImageOperation;
import net.imagetools.exception.NotFoundException;
import net.imagetools.model.HistoryEntry;
import net.imagetools.model.Revision;
import net.imagetools.support.lock.ImageMutationCoordinator;
import org.springframework.stereotype.Component;

/**
 * Owns the history of every live image.
 *
 * <p>Every mutator requires the caller to hold the image's lock from
 * {@link ImageMutationCoordinator}; reads need no lock and see a consistent snapshot.</p>
 */
@Slf4j
@Component
public class HistoryLog {

    private final Map<String, ImageHistory> histories = new ConcurrentHashMap<>();
    private final ImageMutationCoordinator coordinator;
    private final Clock clock;

    public HistoryLog(ImageMutationCoordinator coordinator, Clock clock) {
        this.coordinator = coordinator;
        this.clock = clock;
    }

    /**
     * Starts the history of a freshly uploaded image with its sequence 0 entry.
     */
    public HistoryEntry start(String imageId, Revision original, Revision thumbnail) {
        requireLock(imageId);
        HistoryEntry entry = HistoryEntry.original(imageId, original, thumbnail, clock.instant());
        if (histories.putIfAbsent(imageId, new ImageHistory(entry)) != null) {
            throw new IllegalStateException("History of image " + imageId + " already exists");
        }
        return entry;
    }

    public HistoryEntry append(String imageId, ImageOperation operation, Revision revision, Revision thumbnail) {
        requireLock(imageId);
        HistoryEntry entry = require(imageId).append(operation, revision, thumbnail, clock.instant());
        log.debug("Image {} appended {} as sequence {} (parent {})",
            imageId, entry.kind().wireName(), entry.sequence(), entry.parentSequence());
        return entry;
    }

    public boolean canUndo(String imageId) {
        return require(imageId).canUndo();
    }

    public HistoryEntry undo(String imageId) {
        requireLock(imageId);
        return require(imageId).undo();
    }

    public HistoryEntry restore(String imageId, long sequence) {
        requireLock(imageId);
        return require(imageId).restore(sequence);
    }

    /**
     * @return removed entries; their objects are deleted by the caller after the pointer swap
     */
    public List<HistoryEntry> clear(String imageId) {
        requireLock(imageId);
        return require(imageId).clear();
    }

    public List<HistoryEntry> reclaimAbandoned(String imageId) {
        requireLock(imageId);
        return require(imageId).reclaimAbandoned();
    }

    public void remove(String imageId) {
        requireLock(imageId);
        histories.remove(imageId);
    }

    public ImageHistory.Snapshot snapshot(String imageId) {
        return require(imageId).snapshot();
    }

    public List<HistoryEntry> entries(String imageId) {
        return snapshot(imageId).entries();
    }

    public Optional<ImageHistory> find(String imageId) {
        return Optional.ofNullable(histories.get(imageId));
    }

    public Set<String> imageIds() {
        return Set.copyOf(histories.keySet());
    }

    private ImageHistory require(String imageId) {
        ImageHistory history = histories.get(imageId);
        if (history == null) {
            throw NotFoundException.image(imageId);
        }
        return history;
    }

    private void requireLock(String imageId) {
        if (!coordinator.isHeldByCurrentThread(imageId)) {
            throw new IllegalStateException("History of image " + imageId + " mutated without holding its lock");
        }
    }
}
