package net.imagetools.exception;

/**
 * The session owning the target image has expired (and may already have been swept).
 * RETRYABLE: No
 */
public class ExpiredSessionException extends ImageToolsException {
    private final String sessionId;

    public ExpiredSessionException(String sessionId) {
        super("Session " + sessionId + " has expired", false);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
