package tollgate.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import tollgate.core.config.RateLimitingConfig;
import tollgate.core.model.ratelimit.FailurePolicy;
import tollgate.core.port.in.AdmissionControl;

/**
 * Readiness of the shared counter store, as last seen by the rate limiter.
 *
 * <p>Under fail-open a degraded store keeps the instance ready, since requests
 * are still admitted. Under fail-closed a degraded store rejects every metered
 * request, so the instance reports DOWN until the store answers again.
 */
@Readiness
@ApplicationScoped
public class CounterStoreHealthCheck implements HealthCheck {

    private final AdmissionControl admissionControl;
    private final RateLimitingConfig config;

    @Inject
    public CounterStoreHealthCheck(AdmissionControl admissionControl, RateLimitingConfig config) {
        this.admissionControl = admissionControl;
        this.config = config;
    }

    @Override
    public HealthCheckResponse call() {
        final var state = admissionControl.counterStoreState();
        final var builder = HealthCheckResponse.named("counter-store")
                .withData("store", state.store())
                .withData("degraded", state.degraded())
                .withData("failurePolicy", config.failurePolicy().name());
        state.lastFailureAt().ifPresent(at -> builder.withData("lastFailureAt", at.toString()));
        state.lastError().ifPresent(error -> builder.withData("lastError", error));

        final var down = state.degraded() && config.failurePolicy() == FailurePolicy.FAIL_CLOSED;
        return builder.status(!down).build();
    }
}
