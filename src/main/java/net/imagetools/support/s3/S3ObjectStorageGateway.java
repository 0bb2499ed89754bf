package net.imagetools.support.s3;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.imagetools.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Infrastructure adapter for blocking S3 object operations.
 *
 * <p>All direct AWS SDK usage lives here so the revision store only deals in keys and bytes.
 * Keys passed in are logical; the configured prefix is applied on the way in and stripped
 * from listings on the way out.</p>
 */
public final class S3ObjectStorageGateway {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorageGateway.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String keyPrefix;

    public S3ObjectStorageGateway(S3Client s3Client, String bucketName, String keyPrefix) {
        if (s3Client == null) {
            throw new IllegalArgumentException("S3 client is required");
        }
        if (!hasText(bucketName)) {
            throw new IllegalStateException("S3 bucket name must be configured when S3 revision storage is active.");
        }
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.keyPrefix = normalizePrefix(keyPrefix);
    }

    public void putObject(String key, byte[] payload, String contentType) {
        String objectKey = objectKey(key);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .contentType(contentType)
                .contentLength((long) payload.length)
                .build();
            s3Client.putObject(request, RequestBody.fromBytes(payload));
            logger.debug("Uploaded {} ({} bytes) to bucket {}", objectKey, payload.length, bucketName);
        } catch (S3Exception exception) {
            throw new StorageException("S3 error uploading " + objectKey + ": " + resolveS3ErrorMessage(exception),
                key, isRetryable(exception), exception);
        } catch (SdkClientException exception) {
            throw new StorageException("S3 client error uploading " + objectKey + ": " + exception.getMessage(),
                key, exception);
        }
    }

    /**
     * Downloads an object, empty when the key does not exist.
     */
    public Optional<byte[]> getObject(String key) {
        String objectKey = objectKey(key);
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .build();
            ResponseBytes<GetObjectResponse> objectBytes = s3Client.getObjectAsBytes(request);
            return Optional.of(objectBytes.asByteArray());
        } catch (NoSuchKeyException exception) {
            logger.warn("S3 key not found: bucket={}, key={}", bucketName, objectKey);
            return Optional.empty();
        } catch (S3Exception exception) {
            throw new StorageException("S3 error downloading " + objectKey + ": " + resolveS3ErrorMessage(exception),
                key, isRetryable(exception), exception);
        } catch (SdkClientException exception) {
            throw new StorageException("S3 client error downloading " + objectKey + ": " + exception.getMessage(),
                key, exception);
        }
    }

    /**
     * Deletes an object. S3 treats deleting a missing key as success, which keeps this idempotent.
     */
    public void deleteObject(String key) {
        String objectKey = objectKey(key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .build());
            logger.debug("Deleted object {}", objectKey);
        } catch (S3Exception exception) {
            throw new StorageException("S3 error deleting " + objectKey + ": " + resolveS3ErrorMessage(exception),
                key, isRetryable(exception), exception);
        } catch (SdkClientException exception) {
            throw new StorageException("S3 client error deleting " + objectKey + ": " + exception.getMessage(),
                key, exception);
        }
    }

    /**
     * Lists every object under a logical prefix, following continuation tokens.
     * Returned keys are logical, with the configured prefix removed.
     */
    public List<S3Object> listObjects(String prefix) {
        String listPrefix = objectKey(prefix == null ? "" : prefix);
        List<S3Object> allObjects = new ArrayList<>();
        String continuationToken = null;
        try {
            do {
                ListObjectsV2Request.Builder requestBuilder = ListObjectsV2Request.builder()
                    .bucket(bucketName)
                    .continuationToken(continuationToken);
                if (hasText(listPrefix)) {
                    requestBuilder.prefix(listPrefix);
                }
                ListObjectsV2Response response = s3Client.listObjectsV2(requestBuilder.build());
                for (S3Object object : response.contents()) {
                    allObjects.add(object.toBuilder().key(logicalKey(object.key())).build());
                }
                continuationToken = response.nextContinuationToken();
            } while (continuationToken != null);
            logger.debug("Listed {} objects under '{}' in bucket {}", allObjects.size(), listPrefix, bucketName);
        } catch (S3Exception exception) {
            throw new StorageException("S3 error listing " + listPrefix + ": " + resolveS3ErrorMessage(exception),
                prefix, isRetryable(exception), exception);
        } catch (SdkClientException exception) {
            throw new StorageException("S3 client error listing " + listPrefix + ": " + exception.getMessage(),
                prefix, exception);
        }
        return allObjects;
    }

    /**
     * Cheap reachability probe used by the health indicator.
     */
    public void checkBucket() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
        } catch (S3Exception exception) {
            throw new StorageException("S3 bucket " + bucketName + " is not reachable: " + resolveS3ErrorMessage(exception),
                bucketName, isRetryable(exception), exception);
        } catch (SdkClientException exception) {
            throw new StorageException("S3 bucket " + bucketName + " is not reachable: " + exception.getMessage(),
                bucketName, exception);
        }
    }

    public String bucketName() {
        return bucketName;
    }

    private String objectKey(String key) {
        return keyPrefix + key;
    }

    private String logicalKey(String objectKey) {
        if (!keyPrefix.isEmpty() && objectKey.startsWith(keyPrefix)) {
            return objectKey.substring(keyPrefix.length());
        }
        return objectKey;
    }

    private static String normalizePrefix(String prefix) {
        if (!hasText(prefix)) {
            return "";
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static boolean isRetryable(S3Exception exception) {
        return exception.statusCode() >= 500 || exception.statusCode() == 429;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return exception.getMessage();
    }
}
