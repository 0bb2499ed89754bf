/**
 * Main application class for the image tools history engine
 *
 * Features:
 * - Enables scheduling for the session expiry sweep and revision garbage collection
 * - Provides a dedicated task scheduler so sweeps never share threads with edits
 */

package net.imagetools;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@SpringBootApplication
@EnableScheduling
public class ImageToolsApplication {

    private static final int APPLICATION_SCHEDULER_POOL_SIZE = 2;
    private static final int APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String APPLICATION_SCHEDULER_THREAD_PREFIX = "ImageToolsScheduler-";

    public static void main(String[] args) {
        SpringApplication.run(ImageToolsApplication.class, args);
    }

    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(APPLICATION_SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(APPLICATION_SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }
}
