package net.imagetools.support.s3;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for S3-backed revision storage.
 */
@Component
@ConfigurationProperties(prefix = "s3")
public class S3StorageProperties {

    private String accessKeyId;
    private String secretAccessKey;
    private String serverUrl;
    private String region = "us-west-2";
    private String bucketName;
    private String keyPrefix = "";
    private Duration apiCallTimeout = Duration.ofSeconds(30);

    public String getAccessKeyId() {
        return accessKeyId;
    }

    public void setAccessKeyId(String accessKeyId) {
        this.accessKeyId = accessKeyId;
    }

    public String getSecretAccessKey() {
        return secretAccessKey;
    }

    public void setSecretAccessKey(String secretAccessKey) {
        this.secretAccessKey = secretAccessKey;
    }

    /**
     * Endpoint of an S3-compatible server such as MinIO; blank means AWS itself.
     */
    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    /**
     * Bucket holding revisions and thumbnails.
     */
    public String getBucketName() {
        return bucketName;
    }

    public void setBucketName(String bucketName) {
        this.bucketName = bucketName;
    }

    /**
     * Optional prefix prepended to every object key, for sharing a bucket between environments.
     */
    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    /**
     * Upper bound on one S3 call including the SDK's own retries.
     */
    public Duration getApiCallTimeout() {
        return apiCallTimeout;
    }

    public void setApiCallTimeout(Duration apiCallTimeout) {
        this.apiCallTimeout = apiCallTimeout;
    }
}
