package net.imagetools.service.storage;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import net.imagetools.support.s3.S3ObjectStorageGateway;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Revision store backed by an S3 bucket through {@link S3ObjectStorageGateway}.
 */
public class S3RevisionStore extends AbstractRevisionStore {

    private final S3ObjectStorageGateway gateway;

    public S3RevisionStore(S3ObjectStorageGateway gateway, ThumbnailRenderer thumbnailRenderer, Clock clock) {
        super(thumbnailRenderer, clock);
        this.gateway = gateway;
    }

    @Override
    protected void writeObject(String key, byte[] bytes, String contentType) {
        gateway.putObject(key, bytes, contentType);
    }

    @Override
    protected Optional<byte[]> readObject(String key) {
        return gateway.getObject(key);
    }

    @Override
    protected void deleteObject(String key) {
        gateway.deleteObject(key);
    }

    @Override
    protected int deletePrefix(String prefix) {
        List<S3Object> objects = gateway.listObjects(prefix);
        for (S3Object object : objects) {
            gateway.deleteObject(object.key());
        }
        return objects.size();
    }

    @Override
    protected List<StoredObject> listObjects(String prefix) {
        return gateway.listObjects(prefix).stream()
            .map(object -> new StoredObject(object.key(), object.lastModified(),
                object.size() == null ? 0L : object.size()))
            .toList();
    }

    @Override
    public String backendName() {
        return "s3:" + gateway.bucketName();
    }

    @Override
    public void checkHealth() {
        gateway.checkBucket();
    }
}
