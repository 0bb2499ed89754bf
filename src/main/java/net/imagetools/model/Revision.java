package net.imagetools.model;

import java.time.Instant;

/**
 * Immutable stored artifact. {@code key} is unique per write, and {@code versionToken}
 * (embedded in the key) changes whenever content changes, so clients can use it
 * for cache busting.
 *
 * @param key opaque storage reference
 * @param versionToken random per-write identifier
 * @param sizeBytes stored payload size
 * @param width width in pixels
 * @param height height in pixels
 * @param format stored container format
 * @param contentHash SHA-256 of the payload, hex encoded
 * @param createdAt write time
 */
public record Revision(String key,
                       String versionToken,
                       long sizeBytes,
                       int width,
                       int height,
                       ImageFormat format,
                       String contentHash,
                       Instant createdAt) {
}
