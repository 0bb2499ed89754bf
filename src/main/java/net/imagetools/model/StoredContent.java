package net.imagetools.model;

import java.util.Arrays;

/**
 * Bytes of a revision handed to readers, with the token to use for cache validation.
 */
public record StoredContent(byte[] bytes, ImageFormat format, String versionToken) {

    public StoredContent {
        bytes = bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public String mimeType() {
        return format.mimeType();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof StoredContent that
            && format == that.format
            && versionToken.equals(that.versionToken)
            && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + versionToken.hashCode();
    }

    @Override
    public String toString() {
        return "StoredContent[" + format + ", " + bytes.length + " bytes, token=" + versionToken + "]";
    }
}
