package net.imagetools.service.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.config.SessionProperties;
import net.imagetools.exception.ExpiredSessionException;
import net.imagetools.exception.NotFoundException;
import net.imagetools.exception.SessionImageLimitException;
import net.imagetools.exception.ValidationException;
import net.imagetools.model.Image;
import net.imagetools.model.Session;
import net.imagetools.repository.ImageRepository;
import net.imagetools.repository.SessionRepository;
import net.imagetools.service.EditMetrics;
import net.imagetools.service.history.HistoryLog;
import net.imagetools.service.storage.RevisionStore;
import net.imagetools.support.lock.ImageMutationCoordinator;
import net.imagetools.util.IdGenerator;
import net.imagetools.util.LoggingUtils;
import org.springframework.stereotype.Service;

/**
 * Creates sessions, enforces their image cap and removes them with everything they own
 * once they expire.
 *
 * <p>Swept sessions and images leave a tombstone for {@code imagetools.session.tombstone-ttl},
 * so a late request learns the session expired rather than that the image never existed.</p>
 */
@Slf4j
@Service
public class SessionLifecycleService {

    private final SessionRepository sessionRepository;
    private final ImageRepository imageRepository;
    private final HistoryLog historyLog;
    private final RevisionStore revisionStore;
    private final ImageMutationCoordinator coordinator;
    private final SessionProperties properties;
    private final EditMetrics metrics;
    private final Clock clock;

    private final Cache<String, Boolean> expiredSessions;
    // image id -> owning session id
    private final Cache<String, String> expiredImages;

    public SessionLifecycleService(SessionRepository sessionRepository,
                                   ImageRepository imageRepository,
                                   HistoryLog historyLog,
                                   RevisionStore revisionStore,
                                   ImageMutationCoordinator coordinator,
                                   SessionProperties properties,
                                   EditMetrics metrics,
                                   Clock clock) {
        this.sessionRepository = sessionRepository;
        this.imageRepository = imageRepository;
        this.historyLog = historyLog;
        this.revisionStore = revisionStore;
        this.coordinator = coordinator;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.expiredSessions = Caffeine.newBuilder()
            .expireAfterWrite(properties.getTombstoneTtl())
            .build();
        this.expiredImages = Caffeine.newBuilder()
            .expireAfterWrite(properties.getTombstoneTtl())
            .build();
    }

    public Session createSession() {
        return createSession(null);
    }

    /**
     * Creates a session, or extends the expiry of the live session that already uses
     * {@code requestedId}. A blank id gets a generated one.
     */
    public Session createSession(String requestedId) {
        String sessionId = requestedId == null || requestedId.isBlank() ? IdGenerator.uuidV7() : requestedId.trim();
        if (!IdGenerator.isKeySafe(sessionId)) {
            throw new ValidationException("sessionId", "Session id may only contain letters, digits, '-' and '_'");
        }
        return coordinator.withSessionLock(sessionId, () -> {
            Instant now = clock.instant();
            Instant expiresAt = now.plus(properties.getRetention());
            Optional<Session> extended = sessionRepository.update(sessionId,
                existing -> existing.withExpiry(expiresAt, now));
            if (extended.isPresent()) {
                log.debug("Extended session {} until {}", sessionId, expiresAt);
                return extended.get();
            }
            expiredSessions.invalidate(sessionId);
            Session created = sessionRepository.save(
                new Session(sessionId, now, expiresAt, now, properties.getMaxImagesPerSession()));
            log.info("Created session {} (expires {})", sessionId, expiresAt);
            return created;
        });
    }

    /**
     * @throws NotFoundException when the session does not exist
     * @throws ExpiredSessionException when it expired, whether or not it has been swept yet
     */
    public Session getActiveSession(String sessionId) {
        if (sessionId != null && expiredSessions.getIfPresent(sessionId) != null) {
            throw new ExpiredSessionException(sessionId);
        }
        Session session = sessionRepository.findById(sessionId == null ? "" : sessionId)
            .orElseThrow(() -> NotFoundException.session(sessionId));
        if (session.isExpiredAt(clock.instant())) {
            throw new ExpiredSessionException(sessionId);
        }
        return session;
    }

    /**
     * Resolves a live image, checking that its session is still active.
     */
    public Image requireLiveImage(String imageId) {
        String sweptSession = imageId == null ? null : expiredImages.getIfPresent(imageId);
        if (sweptSession != null) {
            throw new ExpiredSessionException(sweptSession);
        }
        Image image = imageRepository.findById(imageId == null ? "" : imageId)
            .orElseThrow(() -> NotFoundException.image(imageId));
        getActiveSession(image.sessionId());
        return image;
    }

    /**
     * Rejects an upload once the session owns its limit of images. Callers hold the session lock.
     */
    public void enforceImageLimit(Session session) {
        if (imageRepository.countBySessionId(session.id()) >= session.imageLimit()) {
            throw new SessionImageLimitException(session.id(), session.imageLimit());
        }
    }

    public void recordActivity(String sessionId) {
        Instant now = clock.instant();
        sessionRepository.update(sessionId, session -> session.touchedAt(now));
    }

    /**
     * Deletes the session and every image it owns.
     */
    public void revokeSession(String sessionId) {
        coordinator.withSessionLock(sessionId, () -> {
            Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> NotFoundException.session(sessionId));
            int failures = deleteImagesOf(session, false);
            if (failures > 0) {
                throw new IllegalStateException("Could not delete " + failures + " images of session " + sessionId);
            }
            sessionRepository.delete(sessionId);
            log.info("Revoked session {}", sessionId);
            return null;
        });
    }

    /**
     * Removes every expired session with its images. A failure on one image is logged and
     * the session is kept so the next sweep retries it.
     */
    public SweepReport expirySweep() {
        List<Session> expired = sessionRepository.findExpired(clock.instant());
        if (expired.isEmpty()) {
            return SweepReport.empty();
        }
        int sessions = 0;
        int images = 0;
        int failures = 0;
        for (Session candidate : expired) {
            SweepReport outcome;
            try {
                outcome = coordinator.withSessionLock(candidate.id(), () -> sweepSession(candidate.id()));
            } catch (RuntimeException e) {
                LoggingUtils.error(log, e, "Expiry sweep skipped session {}", candidate.id());
                continue;
            }
            sessions += outcome.sessionsExpired();
            images += outcome.imagesDeleted();
            failures += outcome.imageFailures();
        }
        metrics.sessionsExpired(sessions, images);
        log.info("Expiry sweep removed {} sessions and {} images ({} image failures)", sessions, images, failures);
        return new SweepReport(sessions, images, failures);
    }

    /**
     * Deletes an image with its history and stored objects. Callers hold the image lock.
     */
    public void deleteImage(Image image) {
        imageRepository.delete(image.id());
        historyLog.remove(image.id());
        try {
            revisionStore.deleteImage(image.id());
        } catch (RuntimeException e) {
            // The image is already unreachable; garbage collection removes what is left
            LoggingUtils.warn(log, e, "Stored objects of deleted image {} could not be removed", image.id());
        }
        log.info("Deleted image {} of session {}", image.id(), image.sessionId());
    }

    private SweepReport sweepSession(String sessionId) {
        Optional<Session> current = sessionRepository.findById(sessionId);
        // Re-check under the lock: the session may have been extended or revoked meanwhile
        if (current.isEmpty() || !current.get().isExpiredAt(clock.instant())) {
            return SweepReport.empty();
        }
        Session session = current.get();
        int before = (int) imageRepository.countBySessionId(sessionId);
        int failures = deleteImagesOf(session, true);
        if (failures > 0) {
            return new SweepReport(0, before - failures, failures);
        }
        sessionRepository.delete(sessionId);
        expiredSessions.put(sessionId, Boolean.TRUE);
        log.debug("Expired session {} with {} images", sessionId, before);
        return new SweepReport(1, before, 0);
    }

    private int deleteImagesOf(Session session, boolean tombstone) {
        int failures = 0;
        for (Image image : imageRepository.findBySessionId(session.id())) {
            try {
                coordinator.withImageLock(image.id(), () -> {
                    deleteImage(image);
                    return null;
                });
                if (tombstone) {
                    expiredImages.put(image.id(), session.id());
                }
            } catch (RuntimeException e) {
                failures++;
                LoggingUtils.error(log, e, "Failed to delete image {} of session {}", image.id(), session.id());
            }
        }
        return failures;
    }
}
