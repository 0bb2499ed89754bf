package net.imagetools.scheduler;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import net.imagetools.config.SessionProperties;
import net.imagetools.service.session.SessionLifecycleService;
import net.imagetools.service.session.SweepReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionExpirySchedulerTest {

    @Mock
    private SessionLifecycleService sessionLifecycleService;

    private SessionProperties sessionProperties;
    private SessionExpiryScheduler scheduler;

    @BeforeEach
    void setUp() {
        sessionProperties = new SessionProperties();
        scheduler = new SessionExpiryScheduler(sessionProperties, sessionLifecycleService);
    }

    @Test
    void should_RunSweep_When_Enabled() {
        when(sessionLifecycleService.expirySweep()).thenReturn(new SweepReport(2, 3, 0));

        scheduler.sweepExpiredSessions();

        verify(sessionLifecycleService).expirySweep();
    }

    @Test
    void should_SkipSweep_When_DisabledViaConfiguration() {
        sessionProperties.setSweepEnabled(false);

        scheduler.sweepExpiredSessions();

        verify(sessionLifecycleService, never()).expirySweep();
    }

    @Test
    void should_SkipStartupSweep_When_DisabledViaConfiguration() {
        sessionProperties.setSweepOnStartup(false);

        scheduler.sweepOnStartup();

        verify(sessionLifecycleService, never()).expirySweep();
    }

    @Test
    void should_SwallowFailure_When_SweepThrows() {
        when(sessionLifecycleService.expirySweep()).thenThrow(new IllegalStateException("repository unavailable"));

        scheduler.sweepOnStartup();

        verify(sessionLifecycleService).expirySweep();
    }
}
