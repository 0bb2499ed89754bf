package net.imagetools.service.storage;

/**
 * Outcome of one garbage collection pass.
 *
 * @param reclaimedEntries abandoned history entries marked reclaimed
 * @param deletedObjects stored objects removed
 * @param retainedObjects unreferenced objects kept because they are inside the grace period
 * @param skippedImages images busy with a mutation, left for the next pass
 */
public record GcReport(int reclaimedEntries, int deletedObjects, int retainedObjects, int skippedImages) {
}
