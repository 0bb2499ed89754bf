package net.imagetools.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.domain.operation.ImageOperation;
import net.imagetools.exception.ImageBusyException;
import net.imagetools.exception.ImageToolsException;
import net.imagetools.model.HistoryEntry;
import net.imagetools.model.Image;
import net.imagetools.model.PixelData;
import net.imagetools.model.Revision;
import net.imagetools.model.Session;
import net.imagetools.model.StoredContent;
import net.imagetools.repository.ImageRepository;
import net.imagetools.service.edit.AiEditPlanParser;
import net.imagetools.service.edit.AppliedOperation;
import net.imagetools.service.edit.OperationExecutor;
import net.imagetools.service.edit.StoredRevision;
import net.imagetools.service.history.HistoryLog;
import net.imagetools.service.session.SessionLifecycleService;
import net.imagetools.service.storage.RevisionStore;
import net.imagetools.service.transform.ExifMetadataReader;
import net.imagetools.support.lock.ImageMutationCoordinator;
import net.imagetools.util.IdGenerator;
import net.imagetools.util.LoggingUtils;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything callers do with an image.
 *
 * <p>Every mutation runs under the image's lock and ends with a single pointer swap in
 * {@link ImageRepository}; anything that fails before the swap leaves the image exactly
 * as it was. Reads take no lock.</p>
 */
@Slf4j
@Service
public class ImageEditingService {

    private final ImageRepository imageRepository;
    private final HistoryLog historyLog;
    private final OperationExecutor operationExecutor;
    private final RevisionStore revisionStore;
    private final SessionLifecycleService sessionLifecycle;
    private final ImageMutationCoordinator coordinator;
    private final UploadValidator uploadValidator;
    private final AiEditPlanParser aiEditPlanParser;
    private final ExifMetadataReader exifReader;
    private final EditMetrics metrics;
    private final Clock clock;

    public ImageEditingService(ImageRepository imageRepository,
                               HistoryLog historyLog,
                               OperationExecutor operationExecutor,
                               RevisionStore revisionStore,
                               SessionLifecycleService sessionLifecycle,
                               ImageMutationCoordinator coordinator,
                               UploadValidator uploadValidator,
                               AiEditPlanParser aiEditPlanParser,
                               ExifMetadataReader exifReader,
                               EditMetrics metrics,
                               Clock clock) {
        this.imageRepository = imageRepository;
        this.historyLog = historyLog;
        this.operationExecutor = operationExecutor;
        this.revisionStore = revisionStore;
        this.sessionLifecycle = sessionLifecycle;
        this.coordinator = coordinator;
        this.uploadValidator = uploadValidator;
        this.aiEditPlanParser = aiEditPlanParser;
        this.exifReader = exifReader;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Stores an upload as the original (sequence 0) of a new image in the session. The EXIF
     * summary is read from the bytes as uploaded, before any orientation re-encode drops it.
     */
    public Image upload(String sessionId, String filename, byte[] bytes) {
        PixelData original = uploadValidator.validate(filename, bytes);
        Map<String, String> exifSummary = exifReader.summarize(bytes);
        sessionLifecycle.getActiveSession(sessionId);

        Image image = coordinator.withSessionLock(sessionId, () -> {
            Session session = sessionLifecycle.getActiveSession(sessionId);
            sessionLifecycle.enforceImageLimit(session);
            String imageId = IdGenerator.uuidV7();
            StoredRevision stored = operationExecutor.store(imageId, original);
            return coordinator.withImageLock(imageId, () -> {
                HistoryEntry entry = historyLog.start(imageId, stored.revision(), stored.thumbnail());
                Instant now = clock.instant();
                return imageRepository.save(new Image(imageId, sessionId, filename, stored.revision(),
                    entry.revision(), entry.thumbnail(), entry.sequence(), now, now, exifSummary));
            });
        });

        sessionLifecycle.recordActivity(sessionId);
        metrics.uploaded();
        log.info("Uploaded image {} ({} {}x{}, {} bytes) to session {}", image.id(), image.format(),
            image.width(), image.height(), image.byteSize(), sessionId);
        return image;
    }

    public Image getImage(String imageId) {
        return sessionLifecycle.requireLiveImage(imageId);
    }

    public List<Image> listSessionImages(String sessionId) {
        sessionLifecycle.getActiveSession(sessionId);
        return imageRepository.findBySessionId(sessionId);
    }

    /**
     * Applies one operation and appends it to the history.
     */
    public Image applyOperation(String imageId, ImageOperation operation) {
        return mutate(imageId, () -> {
            Image image = sessionLifecycle.requireLiveImage(imageId);
            AppliedOperation applied;
            try {
                applied = operationExecutor.apply(image, operation);
            } catch (ImageToolsException e) {
                if (operation != null) {
                    metrics.operationFailed(operation.kind(), e);
                }
                throw e;
            }
            HistoryEntry entry = historyLog.append(imageId, applied.recordedOperation(),
                applied.revision(), applied.thumbnail());
            metrics.operationApplied(entry.kind());
            return swap(image, entry);
        });
    }

    /**
     * Applies the edit plan carried by an assistant reply as one history entry.
     *
     * @return the updated image, or empty when the reply contains no operations
     */
    public Optional<Image> applyAiResponse(String imageId, String assistantReply) {
        sessionLifecycle.requireLiveImage(imageId);
        return aiEditPlanParser.parse(assistantReply)
            .map(plan -> applyOperation(imageId, plan));
    }

    public boolean canUndo(String imageId) {
        sessionLifecycle.requireLiveImage(imageId);
        return historyLog.canUndo(imageId);
    }

    /**
     * Moves the image back to the parent of its current entry, reusing that entry's stored revision.
     */
    public Image undo(String imageId) {
        return mutate(imageId, () -> {
            Image image = sessionLifecycle.requireLiveImage(imageId);
            HistoryEntry target = historyLog.undo(imageId);
            metrics.undone();
            return swap(image, target);
        });
    }

    public Image restoreToSequence(String imageId, long sequence) {
        return mutate(imageId, () -> {
            Image image = sessionLifecycle.requireLiveImage(imageId);
            HistoryEntry target = historyLog.restore(imageId, sequence);
            metrics.restored();
            return swap(image, target);
        });
    }

    /**
     * Resets the image to its original and discards every later entry with its stored objects.
     */
    public Image clearHistory(String imageId) {
        return mutate(imageId, () -> {
            Image image = sessionLifecycle.requireLiveImage(imageId);
            List<HistoryEntry> removed = historyLog.clear(imageId);
            Image updated = swap(image, historyLog.snapshot(imageId).current());
            for (HistoryEntry entry : removed) {
                deleteQuietly(entry.revision());
                deleteQuietly(entry.thumbnail());
            }
            log.info("Cleared {} history entries of image {}", removed.size(), imageId);
            return updated;
        });
    }

    public void delete(String imageId) {
        mutate(imageId, () -> {
            Image image = sessionLifecycle.requireLiveImage(imageId);
            sessionLifecycle.deleteImage(image);
            return null;
        });
    }

    public List<HistoryEntry> getHistory(String imageId) {
        sessionLifecycle.requireLiveImage(imageId);
        return historyLog.entries(imageId);
    }

    public StoredContent readCurrent(String imageId) {
        Image image = sessionLifecycle.requireLiveImage(imageId);
        return read(image.currentRevision());
    }

    public StoredContent readThumbnail(String imageId) {
        Image image = sessionLifecycle.requireLiveImage(imageId);
        return read(image.currentThumbnail());
    }

    private StoredContent read(Revision revision) {
        return new StoredContent(revisionStore.getBytes(revision), revision.format(), revision.versionToken());
    }

    private <T> T mutate(String imageId, Supplier<T> action) {
        T result;
        try {
            result = coordinator.withImageLock(imageId, action);
        } catch (ImageBusyException e) {
            metrics.busyRejected();
            throw e;
        }
        if (result instanceof Image image) {
            sessionLifecycle.recordActivity(image.sessionId());
        }
        return result;
    }

    private Image swap(Image image, HistoryEntry entry) {
        return imageRepository.save(image.pointingTo(entry, clock.instant()));
    }

    private void deleteQuietly(Revision revision) {
        try {
            revisionStore.delete(revision);
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Could not delete {}; garbage collection will reclaim it", revision.key());
        }
    }
}
