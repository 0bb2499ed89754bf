package net.imagetools.service.storage;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.exception.StorageException;
import net.imagetools.model.ImageFormat;
import net.imagetools.model.PixelData;
import net.imagetools.model.Revision;
import net.imagetools.util.HashUtils;
import net.imagetools.util.IdGenerator;

/**
 * Key layout, hashing and thumbnail rendering shared by every backend. Subclasses only
 * move bytes.
 *
 * <p>Layout: {@code images/{imageId}/{token}.{ext}} for revisions and
 * {@code images/{imageId}/thumbs/{token}.{ext}} for thumbnails.</p>
 */
@Slf4j
public abstract class AbstractRevisionStore implements RevisionStore {

    static final String ROOT_PREFIX = "images/";
    static final String THUMBNAIL_DIRECTORY = "thumbs/";

    private final ThumbnailRenderer thumbnailRenderer;
    private final Clock clock;

    protected AbstractRevisionStore(ThumbnailRenderer thumbnailRenderer, Clock clock) {
        this.thumbnailRenderer = thumbnailRenderer;
        this.clock = clock;
    }

    @Override
    public Revision put(String imageId, PixelData data) {
        return write(imagePrefix(imageId), data);
    }

    @Override
    public byte[] getBytes(Revision revision) {
        return readObject(revision.key())
            .orElseThrow(() -> new StorageException(
                "Stored object " + revision.key() + " is missing", revision.key(), false, null));
    }

    @Override
    public Revision thumbnail(String imageId, Revision revision) {
        PixelData thumbnail;
        try {
            thumbnail = thumbnailRenderer.render(getBytes(revision), revision.format());
        } catch (IOException e) {
            throw new StorageException("Failed to render thumbnail for " + revision.key() + ": " + e.getMessage(),
                revision.key(), false, e);
        }
        if (thumbnail == null) {
            throw new StorageException("Stored object " + revision.key() + " is not a decodable image",
                revision.key(), false, null);
        }
        return write(imagePrefix(imageId) + THUMBNAIL_DIRECTORY, thumbnail);
    }

    @Override
    public void delete(Revision revision) {
        if (revision != null) {
            deleteObject(revision.key());
        }
    }

    @Override
    public void deleteKey(String key) {
        deleteObject(key);
    }

    @Override
    public void deleteImage(String imageId) {
        int deleted = deletePrefix(imagePrefix(imageId));
        log.debug("Deleted {} stored objects of image {} from {}", deleted, imageId, backendName());
    }

    @Override
    public List<StoredObject> listObjects() {
        return listObjects(ROOT_PREFIX);
    }

    protected abstract void writeObject(String key, byte[] bytes, String contentType);

    protected abstract Optional<byte[]> readObject(String key);

    protected abstract void deleteObject(String key);

    /**
     * @return number of objects removed
     */
    protected abstract int deletePrefix(String prefix);

    protected abstract List<StoredObject> listObjects(String prefix);

    private Revision write(String prefix, PixelData data) {
        ImageFormat format = data.format();
        String token = IdGenerator.versionToken();
        String key = prefix + token + "." + format.extension();
        byte[] bytes = data.bytes();
        writeObject(key, bytes, format.mimeType());
        return new Revision(key, token, bytes.length, data.width(), data.height(), format,
            HashUtils.sha256Hex(bytes), clock.instant());
    }

    private static String imagePrefix(String imageId) {
        if (!IdGenerator.isKeySafe(imageId)) {
            throw new IllegalArgumentException("Image id is not usable in a storage key: " + imageId);
        }
        return ROOT_PREFIX + imageId + "/";
    }
}
