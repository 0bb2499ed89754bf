package net.imagetools.support.retry;

import java.time.Duration;
import java.util.function.Supplier;
import net.imagetools.exception.ImageToolsException;
import net.imagetools.util.LoggingUtils;
import org.slf4j.Logger;

/**
 * Executes transform calls with bounded retry and linear backoff.
 */
public final class TransformRetrySupport {

    /**
     * Retry parameters that are constant per call site.
     */
    public record RetryConfig(Logger logger, int maxAttempts, long baseBackoffMillis) {

        public static RetryConfig of(Logger logger, int maxAttempts, Duration baseBackoff) {
            return new RetryConfig(logger, maxAttempts, baseBackoff == null ? 0L : baseBackoff.toMillis());
        }
    }

    private TransformRetrySupport() {
    }

    /**
     * Runs the action, retrying only {@link ImageToolsException}s flagged retryable; every
     * other exception propagates immediately. Backoff is {@code baseBackoffMillis * attempt}.
     */
    public static <T> T execute(RetryConfig config, String operationLabel, Supplier<T> action) {
        int maxAttempts = config.maxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 for operation '" + operationLabel + "' but was " + maxAttempts
            );
        }
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ImageToolsException exception) {
                if (!exception.isRetryable() || attempt >= maxAttempts) {
                    throw exception;
                }
                long backoff = Math.max(config.baseBackoffMillis(), 1L) * attempt;
                config.logger().warn(
                    "Retryable failure during {} (attempt {}/{}): {}. Retrying in {}ms",
                    operationLabel,
                    attempt,
                    maxAttempts,
                    LoggingUtils.rootMessage(exception),
                    backoff
                );
                sleepUnchecked(backoff);
            }
        }
    }

    private static void sleepUnchecked(long durationMillis) {
        try {
            Thread.sleep(durationMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry transform", interruptedException);
        }
    }
}
