package net.imagetools.model;

import java.util.Arrays;

/**
 * Encoded image bytes plus the metadata the engine needs without decoding them again.
 *
 * @param bytes encoded image payload
 * @param format container format of {@code bytes}
 * @param width width in pixels
 * @param height height in pixels
 */
public record PixelData(byte[] bytes, ImageFormat format, int width, int height) {

    public PixelData {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Pixel data must not be empty");
        }
        if (format == null) {
            throw new IllegalArgumentException("Pixel data format is required");
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PixelData that)) {
            return false;
        }
        return width == that.width && height == that.height
            && format == that.format && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + format.hashCode();
    }

    @Override
    public String toString() {
        return "PixelData[" + format + " " + width + "x" + height + ", " + bytes.length + " bytes]";
    }
}
