package net.imagetools.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Image container formats accepted at upload, with the ImageIO names used to read and write them.
 */
public enum ImageFormat {
    JPEG("jpg", "image/jpeg", "jpeg", Set.of("jpg", "jpeg")),
    PNG("png", "image/png", "png", Set.of("png")),
    GIF("gif", "image/gif", "gif", Set.of("gif")),
    BMP("bmp", "image/bmp", "bmp", Set.of("bmp")),
    WEBP("webp", "image/webp", "webp", Set.of("webp")),
    TIFF("tiff", "image/tiff", "tiff", Set.of("tif", "tiff"));

    private final String extension;
    private final String mimeType;
    private final String imageIoName;
    private final Set<String> aliases;

    ImageFormat(String extension, String mimeType, String imageIoName, Set<String> aliases) {
        this.extension = extension;
        this.mimeType = mimeType;
        this.imageIoName = imageIoName;
        this.aliases = aliases;
    }

    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    public String imageIoName() {
        return imageIoName;
    }

    /** Whether the format can carry an alpha channel. */
    public boolean supportsTransparency() {
        return this != JPEG && this != BMP;
    }

    /**
     * Resolves a format from an extension, enum name or ImageIO format name
     * ({@code "jpg"}, {@code "JPEG"}, {@code ".png"}).
     */
    public static Optional<ImageFormat> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        String candidate = normalized;
        return Arrays.stream(values())
            .filter(format -> format.aliases.contains(candidate) || format.name().equalsIgnoreCase(candidate))
            .findFirst();
    }
}
