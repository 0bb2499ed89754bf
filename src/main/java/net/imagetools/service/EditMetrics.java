package net.imagetools.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.imagetools.domain.operation.OperationKind;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for edits, history navigation and housekeeping.
 */
@Component
public class EditMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter undoCount;
    private final Counter restoreCount;
    private final Counter uploadCount;
    private final Counter busyRejections;

    public EditMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.undoCount = meterRegistry.counter("imagetools.history.undo");
        this.restoreCount = meterRegistry.counter("imagetools.history.restore");
        this.uploadCount = meterRegistry.counter("imagetools.image.upload");
        this.busyRejections = meterRegistry.counter("imagetools.edit.busy");
    }

    public Timer.Sample startTransform() {
        return Timer.start(meterRegistry);
    }

    public void transformFinished(Timer.Sample sample, OperationKind kind, boolean success) {
        sample.stop(meterRegistry.timer("imagetools.transform.duration",
            "kind", kind.wireName(), "outcome", success ? "success" : "failure"));
    }

    public void operationApplied(OperationKind kind) {
        meterRegistry.counter("imagetools.edit.applied", "kind", kind.wireName()).increment();
    }

    public void operationFailed(OperationKind kind, Throwable failure) {
        meterRegistry.counter("imagetools.edit.failed",
            "kind", kind.wireName(), "error", failure.getClass().getSimpleName()).increment();
    }

    public void undone() {
        undoCount.increment();
    }

    public void restored() {
        restoreCount.increment();
    }

    public void uploaded() {
        uploadCount.increment();
    }

    public void busyRejected() {
        busyRejections.increment();
    }

    public void sessionsExpired(int sessions, int images) {
        meterRegistry.counter("imagetools.session.expired").increment(sessions);
        meterRegistry.counter("imagetools.session.expired.images").increment(images);
    }

    public void objectsCollected(int objects) {
        meterRegistry.counter("imagetools.storage.gc.deleted").increment(objects);
    }
}
