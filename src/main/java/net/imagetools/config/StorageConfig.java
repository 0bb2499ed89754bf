package net.imagetools.config;

import java.nio.file.Path;
import java.time.Clock;
import net.imagetools.service.storage.LocalDiskRevisionStore;
import net.imagetools.service.storage.RevisionStore;
import net.imagetools.service.storage.S3RevisionStore;
import net.imagetools.service.storage.ThumbnailRenderer;
import net.imagetools.support.s3.S3ObjectStorageGateway;
import net.imagetools.support.s3.S3StorageProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Selects the revision store backend. S3 wins when {@link S3EnvironmentCondition} matches;
 * otherwise revisions live under {@code imagetools.storage.root}.
 */
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThumbnailRenderer thumbnailRenderer(StorageProperties storageProperties) {
        return new ThumbnailRenderer(storageProperties.getThumbnailSize(), storageProperties.getThumbnailQuality());
    }

    @Bean
    @Conditional(S3EnvironmentCondition.class)
    public S3ObjectStorageGateway s3ObjectStorageGateway(S3Client s3Client, S3StorageProperties s3Properties) {
        return new S3ObjectStorageGateway(s3Client, s3Properties.getBucketName(), s3Properties.getKeyPrefix());
    }

    @Bean
    @Conditional(S3EnvironmentCondition.class)
    public RevisionStore s3RevisionStore(S3ObjectStorageGateway gateway, ThumbnailRenderer thumbnailRenderer, Clock clock) {
        return new S3RevisionStore(gateway, thumbnailRenderer, clock);
    }

    @Bean
    @ConditionalOnMissingBean(RevisionStore.class)
    public RevisionStore localDiskRevisionStore(StorageProperties storageProperties,
                                                ThumbnailRenderer thumbnailRenderer,
                                                Clock clock) {
        return new LocalDiskRevisionStore(Path.of(storageProperties.getRoot()), thumbnailRenderer, clock);
    }
}
