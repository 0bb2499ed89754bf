package net.imagetools.exception;

/**
 * Base exception for edit-history failures.
 * Subclasses indicate specific failure types so callers can decide whether to retry
 * and how to report the problem.
 */
public abstract class ImageToolsException extends RuntimeException {
    private final boolean retryable;

    protected ImageToolsException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    protected ImageToolsException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
