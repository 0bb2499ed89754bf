package net.imagetools.service.history;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.imagetools.domain.operation.ImageOperation;
import net.imagetools.exception.NotFoundException;
import net.imagetools.exception.NothingToUndoException;
import net.imagetools.model.HistoryEntry;
import net.imagetools.model.HistoryEntryStatus;
import net.imagetools.model.Revision;

/**
 * Entries and cursor of one image.
 *
 * <p>State is an immutable {@link Snapshot} published through a volatile field: mutators
 * (called under the image lock by {@link HistoryLog}) build a new snapshot and swap it in,
 * readers take whichever snapshot is current without locking. Entry {@code i} always sits
 * at list index {@code i}.</p>
 */
public final class ImageHistory {

    /**
     * Consistent view of the log at one instant.
     */
    public record Snapshot(List<HistoryEntry> entries, long cursor) {

        public Snapshot {
            entries = List.copyOf(entries);
        }

        public HistoryEntry current() {
            return entries.get((int) cursor);
        }

        public HistoryEntry entry(long sequence) {
            return entries.get((int) sequence);
        }
    }

    private final String imageId;
    private volatile Snapshot snapshot;

    ImageHistory(HistoryEntry original) {
        if (!original.isOriginal()) {
            throw new IllegalArgumentException("History must start with the sequence 0 entry");
        }
        this.imageId = original.imageId();
        this.snapshot = new Snapshot(List.of(original), 0L);
    }

    public String imageId() {
        return imageId;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public boolean canUndo() {
        return snapshot.cursor() > 0;
    }

    HistoryEntry append(ImageOperation operation, Revision revision, Revision thumbnail, Instant createdAt) {
        Snapshot before = snapshot;
        long oldCursor = before.cursor();
        long sequence = before.entries().size();
        HistoryEntry appended = new HistoryEntry(imageId, sequence, oldCursor, operation.kind(), operation,
            revision, thumbnail, createdAt, HistoryEntryStatus.ACTIVE);

        // Anything off the new entry's lineage is a dead branch, whatever its sequence
        Set<Long> lineage = lineageOf(before.entries(), oldCursor);
        List<HistoryEntry> entries = new ArrayList<>(before.entries().size() + 1);
        for (HistoryEntry entry : before.entries()) {
            if (!lineage.contains(entry.sequence()) && entry.status() == HistoryEntryStatus.ACTIVE) {
                entries.add(entry.withStatus(HistoryEntryStatus.ABANDONED));
            } else {
                entries.add(entry);
            }
        }
        entries.add(appended);
        snapshot = new Snapshot(entries, sequence);
        return appended;
    }

    HistoryEntry undo() {
        Snapshot before = snapshot;
        if (before.cursor() <= 0) {
            throw new NothingToUndoException(imageId);
        }
        HistoryEntry parent = before.entry(before.current().parentSequence());
        if (!parent.isRestorable()) {
            throw new IllegalStateException("Parent " + parent.sequence() + " of image " + imageId + " was reclaimed");
        }
        snapshot = new Snapshot(before.entries(), parent.sequence());
        return parent;
    }

    HistoryEntry restore(long sequence) {
        Snapshot before = snapshot;
        if (sequence < 0 || sequence >= before.entries().size()) {
            throw new NotFoundException(NotFoundException.ResourceType.SEQUENCE, imageId + "#" + sequence,
                "Image " + imageId + " has no history entry " + sequence
                    + " (valid range 0.." + (before.entries().size() - 1) + ")");
        }
        HistoryEntry target = before.entry(sequence);
        if (!target.isRestorable()) {
            throw new NotFoundException(NotFoundException.ResourceType.SEQUENCE, imageId + "#" + sequence,
                "History entry " + sequence + " of image " + imageId + " was reclaimed and can no longer be restored");
        }

        Set<Long> lineage = lineageOf(before.entries(), sequence);
        List<HistoryEntry> entries = new ArrayList<>(before.entries().size());
        for (HistoryEntry entry : before.entries()) {
            if (lineage.contains(entry.sequence()) && entry.status() == HistoryEntryStatus.ABANDONED) {
                entries.add(entry.withStatus(HistoryEntryStatus.ACTIVE));
            } else {
                entries.add(entry);
            }
        }
        snapshot = new Snapshot(entries, sequence);
        return snapshot.entry(sequence);
    }

    /**
     * Drops everything after the original.
     *
     * @return the removed entries, whose stored objects the caller deletes
     */
    List<HistoryEntry> clear() {
        Snapshot before = snapshot;
        List<HistoryEntry> removed = List.copyOf(before.entries().subList(1, before.entries().size()));
        snapshot = new Snapshot(List.of(before.entry(0)), 0L);
        return removed;
    }

    /**
     * Marks every abandoned entry reclaimed.
     *
     * @return the entries as they were before reclaiming, for object deletion
     */
    List<HistoryEntry> reclaimAbandoned() {
        Snapshot before = snapshot;
        List<HistoryEntry> reclaimed = new ArrayList<>();
        List<HistoryEntry> entries = new ArrayList<>(before.entries().size());
        for (HistoryEntry entry : before.entries()) {
            if (entry.status() == HistoryEntryStatus.ABANDONED) {
                reclaimed.add(entry);
                entries.add(entry.withStatus(HistoryEntryStatus.RECLAIMED));
            } else {
                entries.add(entry);
            }
        }
        if (!reclaimed.isEmpty()) {
            snapshot = new Snapshot(entries, before.cursor());
        }
        return reclaimed;
    }

    /**
     * Keys of every object a live entry still points at.
     */
    public Set<String> referencedKeys() {
        Set<String> keys = new HashSet<>();
        for (HistoryEntry entry : snapshot.entries()) {
            if (entry.isRestorable()) {
                keys.add(entry.revision().key());
                keys.add(entry.thumbnail().key());
            }
        }
        return keys;
    }

    private static Set<Long> lineageOf(List<HistoryEntry> entries, long sequence) {
        Set<Long> lineage = new HashSet<>();
        long current = sequence;
        while (current != HistoryEntry.NO_PARENT) {
            lineage.add(current);
            current = entries.get((int) current).parentSequence();
        }
        return lineage;
    }
}
