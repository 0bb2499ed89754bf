package net.imagetools.exception;

import java.time.Duration;

/**
 * Another mutation holds the image lock and the caller could not (or would not) wait.
 * RETRYABLE: Yes
 */
public class ImageBusyException extends ImageToolsException {
    private final String lockKey;

    public ImageBusyException(String lockKey, Duration waited) {
        super("Resource " + lockKey + " is busy (waited " + waited.toMillis() + "ms)", true);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
