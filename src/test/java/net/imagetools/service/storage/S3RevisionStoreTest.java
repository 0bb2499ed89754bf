package net.imagetools.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.awt.Color;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;
import net.imagetools.model.Revision;
import net.imagetools.support.s3.S3ObjectStorageGateway;
import net.imagetools.testutil.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.s3.model.S3Object;

@ExtendWith(MockitoExtension.class)
class S3RevisionStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private S3ObjectStorageGateway gateway;

    private S3RevisionStore store;

    @BeforeEach
    void setUp() {
        store = new S3RevisionStore(gateway, new ThumbnailRenderer(8, 0.8f), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void should_UploadWithMimeType_When_RevisionIsPut() {
        PixelData data = TestImages.pngData(4, 4, Color.RED);

        Revision revision = store.put("img-1", data);

        verify(gateway).putObject(eq(revision.key()), any(byte[].class), eq("image/png"));
        assertThat(revision.key()).startsWith("images/img-1/");
        assertThat(revision.createdAt()).isEqualTo(NOW);
    }

    @Test
    void should_RenderFromStoredBytes_When_ThumbnailIsRequested() {
        byte[] source = TestImages.png(32, 16, Color.BLUE);
        Revision revision = new Revision("images/img-1/a.png", "a", source.length, 32, 16,
            ImageFormat.PNG, "hash", NOW);
        when(gateway.getObject("images/img-1/a.png")).thenReturn(Optional.of(source));

        Revision thumbnail = store.thumbnail("img-1", revision);

        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(gateway).putObject(key.capture(), any(byte[].class), eq("image/png"));
        assertThat(key.getValue()).startsWith("images/img-1/thumbs/");
        assertThat(thumbnail.width()).isEqualTo(8);
        assertThat(thumbnail.height()).isEqualTo(4);
    }

    @Test
    void should_DeleteEveryListedObject_When_ImageIsDeleted() {
        when(gateway.listObjects("images/img-1/")).thenReturn(List.of(
            S3Object.builder().key("images/img-1/a.png").build(),
            S3Object.builder().key("images/img-1/thumbs/b.png").build()));

        store.deleteImage("img-1");

        verify(gateway).deleteObject("images/img-1/a.png");
        verify(gateway).deleteObject("images/img-1/thumbs/b.png");
    }

    @Test
    void should_MapListing_When_ObjectsAreListed() {
        when(gateway.listObjects("images/")).thenReturn(List.of(
            S3Object.builder().key("images/img-1/a.png").size(12L).lastModified(NOW).build(),
            S3Object.builder().key("images/img-1/b.png").lastModified(NOW).build()));

        assertThat(store.listObjects()).containsExactly(
            new StoredObject("images/img-1/a.png", NOW, 12L),
            new StoredObject("images/img-1/b.png", NOW, 0L));
    }

    @Test
    void should_NameBucket_When_DescribingBackend() {
        when(gateway.bucketName()).thenReturn("image-tools");

        assertThat(store.backendName()).isEqualTo("s3:image-tools");
    }
}
