package net.imagetools.exception;

/**
 * Request parameters were rejected before any read or write happened.
 * RETRYABLE: No (the same request fails again until corrected)
 */
public class ValidationException extends ImageToolsException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message, false);
        this.field = field;
    }

    /** Name of the offending parameter, e.g. {@code width} or {@code steps[2].value}. */
    public String getField() {
        return field;
    }
}
