package tollgate.adapter.in.health;

import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import tollgate.core.model.common.StorageHealth;
import tollgate.core.port.out.StorageHealthIndicator;

/**
 * Readiness of the usage storage backends.
 */
@Readiness
@ApplicationScoped
public class UsageStorageHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(UsageStorageHealthCheck.class);
    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(3);

    private final List<StorageHealthIndicator> indicators;

    @Inject
    public UsageStorageHealthCheck(List<StorageHealthIndicator> indicators) {
        this.indicators = indicators;
    }

    @Override
    public HealthCheckResponse call() {
        final var builder = HealthCheckResponse.named("usage-storage");
        var up = true;
        for (var indicator : indicators) {
            final var health = check(indicator);
            builder.withData(health.name() + ".status", health.healthy() ? "UP" : "DOWN");
            builder.withData(health.name() + ".message", health.message());
            if (health.latencyMs() >= 0) {
                builder.withData(health.name() + ".latencyMs", health.latencyMs());
            }
            up &= health.healthy();
        }
        return builder.status(up).build();
    }

    private StorageHealth check(StorageHealthIndicator indicator) {
        try {
            return indicator.check().await().atMost(CHECK_TIMEOUT);
        } catch (RuntimeException e) {
            LOG.warnv("Storage health check failed: {0}", e.getMessage());
            return StorageHealth.unhealthy(indicator.getClass().getSimpleName(), e.getMessage());
        }
    }
}
