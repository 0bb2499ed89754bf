package net.imagetools.service.storage;

import java.time.Instant;

/**
 * Listing entry used by garbage collection.
 */
public record StoredObject(String key, Instant lastModified, long sizeBytes) {
}
