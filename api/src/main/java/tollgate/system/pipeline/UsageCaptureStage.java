package tollgate.system.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.trace.Span;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.adapter.out.telemetry.SpanAttributes;
import tollgate.core.config.TelemetryConfig;
import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.usage.RequestMetrics;
import tollgate.core.port.in.UsageRecording;

/**
 * Hands a usage record to the recorder once an admitted request has completed.
 *
 * <p>Rejected requests are not recorded. Recording never blocks the response
 * and its failures never reach the caller.
 */
@ApplicationScoped
public class UsageCaptureStage implements MeteringStage {

    public static final int ORDER = 200;

    private static final Logger LOG = Logger.getLogger(UsageCaptureStage.class);

    private final UsageRecording recording;
    private final TelemetryConfig telemetry;

    @Inject
    public UsageCaptureStage(UsageRecording recording, TelemetryConfig telemetry) {
        this.recording = recording;
        this.telemetry = telemetry;
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public Uni<StageResult> onRequest(MeteringContext context) {
        return Uni.createFrom().item(StageResult.proceed());
    }

    @Override
    public void onResponse(MeteringContext context) {
        final var decision = context.decision().filter(AdmissionDecision::allowed);
        if (decision.isEmpty()) {
            return;
        }

        try {
            final var record = recording.record(
                    context.identity(), decision.get().tier(), context.category(), metricsOf(context, decision.get()));
            context.usageRecord(record);
            if (telemetry.enabled()) {
                Span.current().setAttribute(SpanAttributes.USAGE_COMPUTE_UNITS, record.computeUnits());
            }
        } catch (RuntimeException e) {
            LOG.errorv(e, "Could not capture usage {0} for {1}", decision.get().usageId(), context.identity());
        }
    }

    private static RequestMetrics metricsOf(MeteringContext context, AdmissionDecision decision) {
        final var builder = RequestMetrics.builder(decision.usageId(), context.startedAt())
                .duration(context.duration())
                .requestBytes(context.requestBytes())
                .responseBytes(context.responseBytes())
                .statusCode(context.statusCode());
        context.reportedTokensIn().ifPresent(builder::tokensIn);
        context.reportedTokensOut().ifPresent(builder::tokensOut);
        context.reportedModel().ifPresent(builder::model);
        context.reportedStorageBytes().ifPresent(builder::storageBytes);
        return builder.build();
    }
}
