package net.imagetools.support.lock;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import net.imagetools.config.EditProperties;
import net.imagetools.exception.ImageBusyException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Serializes mutations per image (and per session for upload admission).
 *
 * <p>Locks are created on first use and held in a Caffeine cache with weak values, so a
 * lock that no thread holds or waits on can be collected. Callers that need both locks
 * take the session lock first; no code path takes a session lock while holding an image
 * lock.</p>
 */
@Component
public class ImageMutationCoordinator {

    private static final String IMAGE_KEY_PREFIX = "image:";
    private static final String SESSION_KEY_PREFIX = "session:";

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
        .weakValues()
        .build();

    private final Duration waitTimeout;

    @Autowired
    public ImageMutationCoordinator(EditProperties editProperties) {
        this(editProperties.getLockWaitTimeout());
    }

    public ImageMutationCoordinator(Duration waitTimeout) {
        if (waitTimeout == null || waitTimeout.isNegative()) {
            throw new IllegalArgumentException("Lock wait timeout must not be negative");
        }
        this.waitTimeout = waitTimeout;
    }

    /**
     * Runs {@code action} holding the image lock, waiting up to the configured timeout.
     *
     * @throws ImageBusyException when the lock could not be acquired in time
     */
    public <T> T withImageLock(String imageId, Supplier<T> action) {
        return runLocked(IMAGE_KEY_PREFIX + imageId, waitTimeout, action);
    }

    /**
     * Runs {@code action} only if the image lock is free right now.
     *
     * @throws ImageBusyException when another thread holds the lock
     */
    public <T> T tryWithImageLock(String imageId, Supplier<T> action) {
        return runLocked(IMAGE_KEY_PREFIX + imageId, Duration.ZERO, action);
    }

    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        return runLocked(SESSION_KEY_PREFIX + sessionId, waitTimeout, action);
    }

    public boolean isHeldByCurrentThread(String imageId) {
        ReentrantLock lock = locks.getIfPresent(IMAGE_KEY_PREFIX + imageId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    private <T> T runLocked(String key, Duration timeout, Supplier<T> action) {
        ReentrantLock lock = locks.get(key, ignored -> new ReentrantLock());
        if (!acquire(lock, key, timeout)) {
            throw new ImageBusyException(key, timeout);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static boolean acquire(ReentrantLock lock, String key, Duration timeout) {
        if (timeout.isZero()) {
            return lock.tryLock();
        }
        try {
            return lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for lock " + key, interruptedException);
        }
    }
}
