package net.imagetools.model;

import java.time.Instant;

/**
 * Time-boxed ownership scope for a set of images.
 */
public record Session(String id,
                      Instant createdAt,
                      Instant expiresAt,
                      Instant lastActivityAt,
                      int imageLimit) {

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public Session withExpiry(Instant newExpiresAt, Instant activityAt) {
        return new Session(id, createdAt, newExpiresAt, activityAt, imageLimit);
    }

    public Session touchedAt(Instant activityAt) {
        return new Session(id, createdAt, expiresAt, activityAt, imageLimit);
    }
}
