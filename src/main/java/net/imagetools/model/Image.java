package net.imagetools.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read model of an image. Instances are immutable; moving the current pointer means
 * publishing a new instance, so the revision and thumbnail a reader sees always
 * belong to the same history entry.
 */
public record Image(String id,
                    String sessionId,
                    String originalFilename,
                    Revision originalRevision,
                    Revision currentRevision,
                    Revision currentThumbnail,
                    long currentSequence,
                    Instant createdAt,
                    Instant lastModifiedAt,
                    Map<String, String> exifSummary) {

    public Image {
        exifSummary = exifSummary == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(exifSummary));
    }

    public int width() {
        return currentRevision.width();
    }

    public int height() {
        return currentRevision.height();
    }

    public ImageFormat format() {
        return currentRevision.format();
    }

    public long byteSize() {
        return currentRevision.sizeBytes();
    }

    /** Version token clients append to URLs of the current content. */
    public String versionToken() {
        return currentRevision.versionToken();
    }

    public Image pointingTo(HistoryEntry entry, Instant modifiedAt) {
        return new Image(id, sessionId, originalFilename, originalRevision,
            entry.revision(), entry.thumbnail(), entry.sequence(), createdAt, modifiedAt, exifSummary);
    }
}
