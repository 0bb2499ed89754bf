package net.imagetools.service.storage;

import java.util.List;
import net.imagetools.model.PixelData;
import net.imagetools.model.Revision;

/**
 * Persists immutable revisions and their thumbnails.
 *
 * <p>Every {@link #put} writes under a fresh key, so a revision is never overwritten and
 * two images never share a key. Failures surface as
 * {@link net.imagetools.exception.StorageException}.</p>
 */
public interface RevisionStore {

    Revision put(String imageId, PixelData data);

    /**
     * @throws net.imagetools.exception.StorageException (not retryable) when the object is gone
     */
    byte[] getBytes(Revision revision);

    /**
     * Renders and stores the thumbnail of {@code revision}.
     */
    Revision thumbnail(String imageId, Revision revision);

    /**
     * Deletes one object. Deleting a missing object succeeds.
     */
    void delete(Revision revision);

    /**
     * Deletes one object by key, for objects found by {@link #listObjects()}.
     */
    void deleteKey(String key);

    /**
     * Deletes every revision and thumbnail stored for the image.
     */
    void deleteImage(String imageId);

    List<StoredObject> listObjects();

    /**
     * Short backend name for logs and health details.
     */
    String backendName();

    /**
     * Verifies the backend is reachable; throws when it is not.
     */
    void checkHealth();
}
