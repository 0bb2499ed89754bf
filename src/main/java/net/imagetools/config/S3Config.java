package net.imagetools.config;

import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.support.s3.S3StorageProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * S3 client for the revision store, created only when {@link S3EnvironmentCondition} finds
 * credentials and a bucket. A configured {@code s3.server-url} targets MinIO or another
 * S3-compatible server with path-style addressing.
 */
@Slf4j
@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(S3StorageProperties properties) {
        return buildClient(properties);
    }

    static S3Client buildClient(S3StorageProperties properties) {
        if (!StringUtils.hasText(properties.getAccessKeyId()) || !StringUtils.hasText(properties.getSecretAccessKey())) {
            throw new IllegalStateException("S3 revision storage needs both s3.access-key-id and s3.secret-access-key");
        }
        if (!StringUtils.hasText(properties.getRegion())) {
            throw new IllegalStateException("S3 revision storage needs s3.region");
        }

        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(properties.getRegion()))
            .credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey())))
            .overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(properties.getApiCallTimeout())
                .build());

        String endpoint = properties.getServerUrl();
        if (StringUtils.hasText(endpoint)) {
            URI endpointUri;
            try {
                endpointUri = URI.create(endpoint.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("s3.server-url is not a valid URI: " + endpoint, e);
            }
            builder.endpointOverride(endpointUri).forcePathStyle(true);
            log.info("Revision store S3 client targets {} (region {}, path-style)", endpointUri, properties.getRegion());
        } else {
            log.info("Revision store S3 client targets AWS in region {}", properties.getRegion());
        }
        return builder.build();
    }
}
