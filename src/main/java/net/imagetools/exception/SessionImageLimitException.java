package net.imagetools.exception;

/**
 * Upload rejected because the session already owns its maximum number of images.
 * RETRYABLE: No (delete an image first)
 */
public class SessionImageLimitException extends ImageToolsException {
    private final String sessionId;
    private final int limit;

    public SessionImageLimitException(String sessionId, int limit) {
        super("Session " + sessionId + " reached its limit of " + limit + " images", false);
        this.sessionId = sessionId;
        this.limit = limit;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getLimit() {
        return limit;
    }
}
