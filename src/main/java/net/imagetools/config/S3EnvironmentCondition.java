/**
 * Spring {@link org.springframework.context.annotation.Condition} that enables the S3 revision
 * store only when credentials and a bucket are configured.
 */
package net.imagetools.config;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

public class S3EnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(S3EnvironmentCondition.class);
    private static final AtomicBoolean messageLogged = new AtomicBoolean(false);

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        String accessKeyId = firstNonBlank(context, "s3.access-key-id", "S3_ACCESS_KEY_ID");
        String secretAccessKey = firstNonBlank(context, "s3.secret-access-key", "S3_SECRET_ACCESS_KEY");
        String bucket = firstNonBlank(context, "s3.bucket-name", "S3_BUCKET");

        boolean configured = accessKeyId != null && secretAccessKey != null && bucket != null;

        // Evaluated once per conditional bean; log only the first time
        if (messageLogged.compareAndSet(false, true)) {
            if (configured) {
                logger.info("S3 configuration detected - revisions will be stored in bucket {}", bucket);
            } else {
                logger.info("S3 configuration incomplete - revisions will be stored on local disk");
            }
        }
        return configured;
    }

    private static String firstNonBlank(ConditionContext context, String... keys) {
        for (String key : keys) {
            String value = context.getEnvironment().getProperty(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
