package net.imagetools.service.session;

/**
 * Outcome of one expiry sweep.
 *
 * @param sessionsExpired sessions removed
 * @param imagesDeleted images removed with them
 * @param imageFailures images whose deletion failed and will be retried by the next sweep
 */
public record SweepReport(int sessionsExpired, int imagesDeleted, int imageFailures) {

    public static SweepReport empty() {
        return new SweepReport(0, 0, 0);
    }
}
