package net.imagetools.scheduler;

import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.config.SessionProperties;
import net.imagetools.service.session.SessionLifecycleService;
import net.imagetools.service.session.SweepReport;
import net.imagetools.util.LoggingUtils;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the session expiry sweep nightly and once when the application becomes ready.
 */
@Component
@Slf4j
public class SessionExpiryScheduler {

    private final SessionProperties sessionProperties;
    private final SessionLifecycleService sessionLifecycleService;

    public SessionExpiryScheduler(SessionProperties sessionProperties,
                                  SessionLifecycleService sessionLifecycleService) {
        this.sessionProperties = sessionProperties;
        this.sessionLifecycleService = sessionLifecycleService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void sweepOnStartup() {
        if (!sessionProperties.isSweepOnStartup()) {
            log.debug("Startup expiry sweep skipped - disabled via configuration.");
            return;
        }
        sweepExpiredSessions();
    }

    @Scheduled(cron = "${imagetools.session.sweep-cron:0 0 2 * * *}")
    public void sweepExpiredSessions() {
        if (!sessionProperties.isSweepEnabled()) {
            log.debug("Session expiry sweep skipped - disabled via configuration.");
            return;
        }

        Instant start = Instant.now();
        log.info("Session expiry sweep started.");
        try {
            SweepReport report = sessionLifecycleService.expirySweep();
            Duration elapsed = Duration.between(start, Instant.now());
            log.info("Session expiry sweep finished in {}ms (sessions={}, images={}, imageFailures={}).",
                elapsed.toMillis(), report.sessionsExpired(), report.imagesDeleted(), report.imageFailures());
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Session expiry sweep failed");
        }
    }
}
