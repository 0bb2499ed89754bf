package net.imagetools.service.storage;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import net.imagetools.exception.StorageException;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;
import net.imagetools.model.Revision;
import net.imagetools.testutil.MutableClock;
import net.imagetools.testutil.TestImages;
import net.imagetools.util.HashUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalDiskRevisionStoreTest {

    @TempDir
    Path root;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private LocalDiskRevisionStore store;

    @BeforeEach
    void setUp() {
        store = new LocalDiskRevisionStore(root, new ThumbnailRenderer(16, 0.8f), clock);
    }

    @Test
    void should_WriteUnderFreshKey_When_SameBytesArePutTwice() {
        PixelData data = TestImages.pngData(8, 8, Color.GREEN);

        Revision first = store.put("img-1", data);
        Revision second = store.put("img-1", data);

        assertThat(first.key()).isNotEqualTo(second.key());
        assertThat(first.versionToken()).isNotEqualTo(second.versionToken());
        assertThat(first.key()).startsWith("images/img-1/").endsWith(".png");
        assertThat(first.contentHash()).isEqualTo(second.contentHash()).isEqualTo(HashUtils.sha256Hex(data.bytes()));
        assertThat(first.createdAt()).isEqualTo(clock.instant());
        assertThat(store.getBytes(first)).isEqualTo(data.bytes());
    }

    @Test
    void should_StoreScaledThumbnailBesideRevision_When_ThumbnailIsRendered() {
        Revision revision = store.put("img-1", TestImages.pngData(64, 32, Color.ORANGE));

        Revision thumbnail = store.thumbnail("img-1", revision);

        assertThat(thumbnail.key()).startsWith("images/img-1/thumbs/");
        assertThat(thumbnail.width()).isEqualTo(16);
        assertThat(thumbnail.height()).isEqualTo(8);
        assertThat(TestImages.decode(store.getBytes(thumbnail)).getWidth()).isEqualTo(16);
    }

    @Test
    void should_FailWithoutRetry_When_ObjectIsMissing() {
        Revision revision = store.put("img-1", TestImages.pngData(4, 4, Color.RED));
        store.delete(revision);

        assertThatThrownBy(() -> store.getBytes(revision))
            .isInstanceOf(StorageException.class)
            .satisfies(error -> assertThat(((StorageException) error).isRetryable()).isFalse());
    }

    @Test
    void should_Succeed_When_DeletingMissingObject() {
        Revision revision = store.put("img-1", TestImages.pngData(4, 4, Color.RED));

        store.delete(revision);
        store.delete(revision);
        store.deleteKey(revision.key());

        assertThat(store.listObjects()).isEmpty();
    }

    @Test
    void should_RemoveOnlyThatImage_When_DeletingImage() {
        Revision kept = store.put("img-2", TestImages.pngData(4, 4, Color.RED));
        Revision removed = store.put("img-1", TestImages.pngData(4, 4, Color.RED));
        store.thumbnail("img-1", removed);

        store.deleteImage("img-1");

        assertThat(store.listObjects()).extracting(StoredObject::key).containsExactly(kept.key());
        assertThat(Files.exists(root.resolve("images/img-1"))).isFalse();
    }

    @Test
    void should_ListRevisionsAndThumbnails_When_Listing() {
        Revision revision = store.put("img-1", TestImages.pngData(4, 4, Color.RED));
        Revision thumbnail = store.thumbnail("img-1", revision);

        List<StoredObject> objects = store.listObjects();

        assertThat(objects).extracting(StoredObject::key)
            .containsExactlyInAnyOrder(revision.key(), thumbnail.key());
        assertThat(objects).allSatisfy(object -> assertThat(object.sizeBytes()).isPositive());
    }

    @Test
    void should_RejectImageId_When_ItCouldEscapeTheKeyLayout() {
        PixelData data = TestImages.pngData(4, 4, Color.RED);

        assertThatThrownBy(() -> store.put("../other", data)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_RejectThumbnail_When_StoredBytesAreNotAnImage() {
        Revision junk = store.put("img-1", new PixelData(new byte[] {9, 9, 9}, ImageFormat.PNG, 1, 1));

        assertThatThrownBy(() -> store.thumbnail("img-1", junk)).isInstanceOf(StorageException.class);
    }

    @Test
    void should_ReportHealthy_When_RootIsWritable() {
        store.checkHealth();

        assertThat(store.backendName()).isEqualTo("local-disk");
    }
}
