package net.imagetools.exception;

import net.imagetools.domain.operation.OperationKind;

/**
 * A pixel transform failed, timed out or was cancelled. Nothing was stored.
 * RETRYABLE: Yes for timeouts and engine failures, No for undecodable input
 */
public class TransformException extends ImageToolsException {
    private final OperationKind kind;

    public TransformException(OperationKind kind, String message, boolean retryable, Throwable cause) {
        super("Transform " + kind.wireName() + " failed: " + message, retryable, cause);
        this.kind = kind;
    }

    public TransformException(OperationKind kind, String message, boolean retryable) {
        this(kind, message, retryable, null);
    }

    public OperationKind getKind() {
        return kind;
    }
}
