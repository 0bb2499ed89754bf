package net.imagetools.util;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Identifier helpers
 * - UUID v7 (time-ordered) for images and sessions
 * - URL-safe NanoId for revision version tokens
 */
public final class IdGenerator {
    private static final char[] URL_SAFE_ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ_-".toCharArray();
    private static final int VERSION_TOKEN_SIZE = 16;

    // Single SecureRandom instance; thread-safe for concurrent use
    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {}

    /** Version token embedded in revision keys; 96 bits of entropy. */
    public static String versionToken() {
        return nanoId(VERSION_TOKEN_SIZE);
    }

    public static String nanoId(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        char[] id = new char[size];
        for (int i = 0; i < size; i++) {
            id[i] = URL_SAFE_ALPHABET[RANDOM.nextInt(URL_SAFE_ALPHABET.length)];
        }
        return new String(id);
    }

    /** Time-ordered epoch UUID v7 string */
    public static String uuidV7() {
        long ts = System.currentTimeMillis() & 0xFFFFFFFFFFFFL; // 48-bit millis
        int randA = RANDOM.nextInt(1 << 12) & 0x0FFF;            // 12-bit random

        long msb = (ts << 16) | (0x7L << 12) | randA;           // 48 ts | ver=7 | randA

        long randB = RANDOM.nextLong();
        long lsb = (randB & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L; // variant 10 + 62-bit rand

        return new UUID(msb, lsb).toString();
    }

    /**
     * Whether {@code value} is safe to embed in a storage key or file name.
     */
    public static boolean isKeySafe(String value) {
        if (value == null || value.isEmpty() || value.length() > 128) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '-' || c == '_';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }
}
