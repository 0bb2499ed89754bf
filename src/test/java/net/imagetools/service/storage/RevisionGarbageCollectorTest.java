package net.imagetools.service.storage;

import java.awt.Color;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.imagetools.domain.operation.FlipAxis;
import net.imagetools.domain.operation.FlipOperation;
import net.imagetools.domain.operation.RotateOperation;
import net.imagetools.model.HistoryEntry;
import net.imagetools.model.HistoryEntryStatus;
import net.imagetools.model.Image;
import net.imagetools.model.Revision;
import net.imagetools.testutil.TestEngine;
import net.imagetools.testutil.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class RevisionGarbageCollectorTest {

    @TempDir
    Path storageRoot;

    private TestEngine engine;
    private Image image;

    @BeforeEach
    void setUp() {
        engine = TestEngine.onDisk(storageRoot);
        String sessionId = engine.sessionLifecycle.createSession().id();
        image = engine.editingService.upload(sessionId, "a.png", TestImages.png(12, 8, Color.CYAN));
    }

    @Test
    void should_ReclaimAbandonedEntriesAndDeleteTheirObjects_When_Collecting() {
        Image rotated = engine.editingService.applyOperation(image.id(), new RotateOperation(90));
        engine.editingService.restoreToSequence(image.id(), 0);
        engine.editingService.applyOperation(image.id(), new FlipOperation(FlipAxis.VERTICAL));

        GcReport report = engine.garbageCollector.collect();

        assertThat(report.reclaimedEntries()).isEqualTo(1);
        assertThat(report.deletedObjects()).isEqualTo(2);
        assertThat(engine.historyLog.entries(image.id()).get(1).status()).isEqualTo(HistoryEntryStatus.RECLAIMED);
        assertThat(engine.revisionStore.listObjects()).extracting(StoredObject::key)
            .doesNotContain(rotated.currentRevision().key(), rotated.currentThumbnail().key())
            .hasSize(4);
    }

    @Test
    void should_ReclaimDeadBranch_When_ItWasLeftBehindByRestoresAcrossBranches() {
        Image first = engine.editingService.applyOperation(image.id(), new RotateOperation(90));
        Image second = engine.editingService.applyOperation(image.id(), new RotateOperation(90));
        engine.editingService.restoreToSequence(image.id(), 0);
        engine.editingService.applyOperation(image.id(), new FlipOperation(FlipAxis.VERTICAL));
        engine.editingService.restoreToSequence(image.id(), 2);
        engine.editingService.restoreToSequence(image.id(), 3);
        engine.editingService.applyOperation(image.id(), new RotateOperation(180));
        engine.clock.advance(Duration.ofHours(1));

        GcReport report = engine.garbageCollector.collect();

        assertThat(report.reclaimedEntries()).isEqualTo(2);
        assertThat(report.deletedObjects()).isEqualTo(4);
        assertThat(engine.historyLog.entries(image.id())).extracting(HistoryEntry::status).containsExactly(
            HistoryEntryStatus.ACTIVE, HistoryEntryStatus.RECLAIMED, HistoryEntryStatus.RECLAIMED,
            HistoryEntryStatus.ACTIVE, HistoryEntryStatus.ACTIVE);
        assertThat(engine.revisionStore.listObjects()).extracting(StoredObject::key)
            .doesNotContain(first.currentRevision().key(), second.currentRevision().key())
            .hasSize(6);
    }

    @Test
    void should_KeepUndoneEntries_When_TheyAreStillOnTheLineage() {
        engine.editingService.applyOperation(image.id(), new RotateOperation(90));
        engine.editingService.undo(image.id());
        engine.clock.advance(Duration.ofHours(1));

        GcReport report = engine.garbageCollector.collect();

        assertThat(report.reclaimedEntries()).isZero();
        assertThat(report.deletedObjects()).isZero();
        assertThat(engine.revisionStore.listObjects()).hasSize(4);
    }

    @Test
    void should_RetainUnreferencedObject_When_WithinGracePeriod() {
        engine.revisionStore.put(image.id(), TestImages.pngData(4, 4, Color.RED));

        GcReport report = engine.garbageCollector.collect();

        assertThat(report.retainedObjects()).isEqualTo(1);
        assertThat(report.deletedObjects()).isZero();
        assertThat(engine.revisionStore.listObjects()).hasSize(3);
    }

    @Test
    void should_DeleteUnreferencedObject_When_GracePeriodHasPassed() {
        Revision orphan = engine.revisionStore.put(image.id(), TestImages.pngData(4, 4, Color.RED));
        engine.clock.advance(engine.storageProperties.getGcGracePeriod().plusMinutes(1));

        GcReport report = engine.garbageCollector.collect();

        assertThat(report.deletedObjects()).isEqualTo(1);
        assertThat(engine.revisionStore.listObjects()).extracting(StoredObject::key)
            .doesNotContain(orphan.key())
            .contains(image.currentRevision().key(), image.currentThumbnail().key());
        assertThat(engine.meterRegistry.counter("imagetools.storage.gc.deleted").count()).isEqualTo(1.0);
    }

    @Test
    void should_SkipImage_When_ItIsBeingMutated() throws Exception {
        engine.editingService.applyOperation(image.id(), new RotateOperation(90));
        engine.editingService.restoreToSequence(image.id(), 0);
        engine.editingService.applyOperation(image.id(), new RotateOperation(180));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> engine.coordinator.withImageLock(image.id(), () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            held.await(5, TimeUnit.SECONDS);

            GcReport report = engine.garbageCollector.collect();

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            assertThat(report.skippedImages()).isEqualTo(1);
            assertThat(report.reclaimedEntries()).isZero();
            assertThat(engine.historyLog.entries(image.id()).get(1).status()).isEqualTo(HistoryEntryStatus.ABANDONED);
        } finally {
            pool.shutdownNow();
        }
    }
}
