package net.imagetools.model;

/**
 * Named compression parameter bundle.
 *
 * @param id stable identifier referenced by compress operations
 * @param name display name
 * @param maxWidth images wider than this are scaled down
 * @param maxHeight images taller than this are scaled down
 * @param quality initial encoder quality, 1-100
 * @param targetSizeKb quality is lowered step by step until the output fits, 0 disables
 * @param format output format
 * @param retainAspectRatio scale uniformly when fitting into the bounds
 */
public record CompressionProfile(String id,
                                 String name,
                                 int maxWidth,
                                 int maxHeight,
                                 int quality,
                                 int targetSizeKb,
                                 ImageFormat format,
                                 boolean retainAspectRatio) {
}
