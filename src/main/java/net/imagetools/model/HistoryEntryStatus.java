package net.imagetools.model;

public enum HistoryEntryStatus {
    /** On the current lineage or still reachable through restore. */
    ACTIVE,
    /** Branched away from by a later append; restorable until garbage collection. */
    ABANDONED,
    /** Stored objects deleted by garbage collection; kept only to preserve sequence numbering. */
    RECLAIMED
}
