package tollgate.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import tollgate.core.config.UsageConfig;
import tollgate.core.port.in.UsageRecording;

/**
 * Readiness of the asynchronous usage pipeline.
 *
 * <p>Reports queue depth and dead-letter counts. DOWN only once the recorder
 * has stopped accepting records; a filling queue or pending dead letters are
 * signals for alerts on the {@code tollgate.usage.*} metrics, not for routing.
 */
@Readiness
@ApplicationScoped
public class UsagePipelineHealthCheck implements HealthCheck {

    private final UsageRecording recording;
    private final UsageConfig config;

    @Inject
    public UsagePipelineHealthCheck(UsageRecording recording, UsageConfig config) {
        this.recording = recording;
        this.config = config;
    }

    @Override
    public HealthCheckResponse call() {
        final var status = recording.status();
        final var builder = HealthCheckResponse.named("usage-pipeline")
                .withData("enabled", config.enabled())
                .withData("accepting", status.accepting())
                .withData("queueDepth", status.queueDepth())
                .withData("queueCapacity", status.queueCapacity())
                .withData("inFlight", status.inFlight())
                .withData("persisted", status.persisted())
                .withData("deadLettered", status.deadLettered())
                .withData("pendingDeadLetters", status.pendingDeadLetters());

        final var up = !config.enabled() || status.accepting();
        return builder.status(up).build();
    }
}
