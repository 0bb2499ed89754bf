package net.imagetools.model;

import java.time.Instant;
import java.util.Map;
import net.imagetools.domain.operation.ImageOperation;
import net.imagetools.domain.operation.OperationKind;

/**
 * One logged operation and the revision it produced.
 *
 * @param imageId owning image
 * @param sequence position in the log, starting at 0
 * @param parentSequence cursor at append time, {@code -1} for the original upload
 * @param kind operation tag
 * @param operation recorded operation, {@code null} only for {@link OperationKind#ORIGINAL}
 * @param revision revision produced by the operation
 * @param thumbnail thumbnail derived from {@code revision}
 * @param createdAt append time
 * @param status lifecycle of the entry
 */
public record HistoryEntry(String imageId,
                           long sequence,
                           long parentSequence,
                           OperationKind kind,
                           ImageOperation operation,
                           Revision revision,
                           Revision thumbnail,
                           Instant createdAt,
                           HistoryEntryStatus status) {

    public static final long NO_PARENT = -1L;

    public static HistoryEntry original(String imageId, Revision revision, Revision thumbnail, Instant createdAt) {
        return new HistoryEntry(imageId, 0L, NO_PARENT, OperationKind.ORIGINAL, null,
            revision, thumbnail, createdAt, HistoryEntryStatus.ACTIVE);
    }

    public boolean isOriginal() {
        return sequence == 0L;
    }

    public boolean isRestorable() {
        return status != HistoryEntryStatus.RECLAIMED;
    }

    public Map<String, Object> parameters() {
        return operation == null ? Map.of() : operation.parameters();
    }

    public HistoryEntry withStatus(HistoryEntryStatus newStatus) {
        if (newStatus == status) {
            return this;
        }
        return new HistoryEntry(imageId, sequence, parentSequence, kind, operation,
            revision, thumbnail, createdAt, newStatus);
    }
}
