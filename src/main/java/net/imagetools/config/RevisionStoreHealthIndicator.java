package net.imagetools.config;

import net.imagetools.service.storage.RevisionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("revisionStoreHealthIndicator")
public class RevisionStoreHealthIndicator implements HealthIndicator {

    private final RevisionStore revisionStore;

    public RevisionStoreHealthIndicator(RevisionStore revisionStore) {
        this.revisionStore = revisionStore;
    }

    @Override
    public Health health() {
        try {
            revisionStore.checkHealth();
            return Health.up()
                .withDetail("backend", revisionStore.backendName())
                .build();
        } catch (RuntimeException ex) {
            return Health.down()
                .withDetail("backend", revisionStore.backendName())
                .withDetail("error", ex.getMessage())
                .build();
        }
    }
}
