package net.imagetools.domain.operation;

import java.util.Map;

/**
 * A validated edit request. The set of operations is closed: every kind is a record
 * carrying only its own parameters, and consumers dispatch through {@link Visitor}
 * so adding a kind breaks every dispatcher at compile time.
 */
public sealed interface ImageOperation
    permits ResizeOperation, RotateOperation, FlipOperation, CompressOperation,
            RemoveBackgroundOperation, AiEditOperation {

    OperationKind kind();

    /**
     * Parameters as plain values, used for history views and log lines.
     */
    Map<String, Object> parameters();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitResize(ResizeOperation operation);

        R visitRotate(RotateOperation operation);

        R visitFlip(FlipOperation operation);

        R visitCompress(CompressOperation operation);

        R visitRemoveBackground(RemoveBackgroundOperation operation);

        R visitAiEdit(AiEditOperation operation);
    }
}
