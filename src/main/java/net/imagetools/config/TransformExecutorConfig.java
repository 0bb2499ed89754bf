package net.imagetools.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for pixel transforms plus the time limit applied to each call.
 * Transforms never run on request threads, so a timed-out call can be cancelled
 * without leaving the caller blocked.
 */
@Configuration
public class TransformExecutorConfig {

    private static final String TRANSFORM_THREAD_PREFIX = "Transform-";
    private static final int TRANSFORM_QUEUE_CAPACITY = 100;
    private static final int TRANSFORM_SHUTDOWN_TIMEOUT_SECONDS = 30;

    @Bean(name = "transformExecutor")
    public ThreadPoolTaskExecutor transformExecutor(EditProperties editProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(TRANSFORM_THREAD_PREFIX);
        executor.setCorePoolSize(editProperties.getTransformThreads());
        executor.setMaxPoolSize(editProperties.getTransformThreads());
        executor.setQueueCapacity(TRANSFORM_QUEUE_CAPACITY);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(TRANSFORM_SHUTDOWN_TIMEOUT_SECONDS);
        return executor;
    }

    @Bean
    public TimeLimiter transformTimeLimiter(EditProperties editProperties) {
        return TimeLimiter.of("transform", TimeLimiterConfig.custom()
            .timeoutDuration(editProperties.getTransformTimeout())
            .cancelRunningFuture(true)
            .build());
    }
}
