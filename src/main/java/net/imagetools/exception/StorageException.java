package net.imagetools.exception;

/**
 * Revision or thumbnail I/O failed. The operation was aborted and the image
 * pointers keep their previous values.
 * RETRYABLE: Yes (transient storage issues), No for missing objects
 */
public class StorageException extends ImageToolsException {
    private final String key;

    public StorageException(String message, String key, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
        this.key = key;
    }

    public StorageException(String message, String key, Throwable cause) {
        this(message, key, true, cause);
    }

    public String getKey() {
        return key;
    }
}
