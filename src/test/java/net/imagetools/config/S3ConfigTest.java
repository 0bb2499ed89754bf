package net.imagetools.config;

import net.imagetools.support.s3.S3StorageProperties;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3Client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class S3ConfigTest {

    @Test
    void should_FailFast_When_SecretIsMissing() {
        S3StorageProperties properties = properties();
        properties.setSecretAccessKey(" ");

        assertThatThrownBy(() -> S3Config.buildClient(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("s3.secret-access-key");
    }

    @Test
    void should_FailFast_When_EndpointIsNotAUri() {
        S3StorageProperties properties = properties();
        properties.setServerUrl("http://minio:9000/has space");

        assertThatThrownBy(() -> S3Config.buildClient(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("s3.server-url");
    }

    @Test
    void should_BuildClientForCustomEndpoint_When_ServerUrlIsSet() {
        S3StorageProperties properties = properties();
        properties.setServerUrl("http://localhost:9000");

        try (S3Client client = S3Config.buildClient(properties)) {
            assertThat(client.serviceClientConfiguration().region().id()).isEqualTo("eu-central-1");
            assertThat(client.serviceClientConfiguration().endpointOverride()).hasValueSatisfying(
                endpoint -> assertThat(endpoint.getPort()).isEqualTo(9000));
        }
    }

    private static S3StorageProperties properties() {
        S3StorageProperties properties = new S3StorageProperties();
        properties.setAccessKeyId("access");
        properties.setSecretAccessKey("secret");
        properties.setRegion("eu-central-1");
        properties.setBucketName("revisions");
        return properties;
    }
}
