package tollgate.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tollgate.core.config.TelemetryConfig;
import tollgate.core.model.ratelimit.AdmissionOutcome;
import tollgate.core.model.usage.DeadLetterReason;
import tollgate.core.model.window.WindowKind;
import tollgate.core.port.out.Metrics;

/**
 * Micrometer implementation of the metering metrics port.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tollgate.admission.decisions} - Admission checks by tier, outcome, degraded</li>
 *   <li>{@code tollgate.admission.latency} - Time spent deciding admission</li>
 *   <li>{@code tollgate.rate_limit.exceeded} - Rejections by tier and binding window</li>
 *   <li>{@code tollgate.counter_store.failures} - Counter store failures by store and reason</li>
 *   <li>{@code tollgate.tier.fallbacks} - Requests evaluated under the most restrictive tier</li>
 *   <li>{@code tollgate.usage.enqueued} - Usage records queued for persistence</li>
 *   <li>{@code tollgate.usage.persisted} - Usage records written, by duplicate flag</li>
 *   <li>{@code tollgate.usage.write_retries} - Usage write retries</li>
 *   <li>{@code tollgate.usage.dead_letter} - Usage records dead-lettered by reason</li>
 *   <li>{@code tollgate.usage.queue.depth} - Usage queue depth gauge</li>
 *   <li>{@code tollgate.rollup.*} - Rollup records, aggregates, late records, duration, conflicts</li>
 *   <li>{@code tollgate.retention.purged} - Rows removed by retention</li>
 * </ul>
 */
@ApplicationScoped
public class MeteringMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MeteringMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Admission Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordAdmission(String tier, AdmissionOutcome outcome, boolean degraded, long latencyNanos) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.admission.decisions")
                .description("Admission decisions")
                .tag("tier", nullSafe(tier))
                .tag("outcome", outcome.name().toLowerCase())
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();

        Timer.builder("tollgate.admission.latency")
                .description("Time spent deciding whether to admit a request")
                .tag("degraded", String.valueOf(degraded))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordRateLimitExceeded(String tier, WindowKind window) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.rate_limit.exceeded")
                .description("Requests rejected by a rate limit window")
                .tag("tier", nullSafe(tier))
                .tag("window", window.value())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCounterStoreFailure(String store, String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.counter_store.failures")
                .description("Counter store calls that failed or timed out")
                .tag("store", nullSafe(store))
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordPolicyFallback(String requestedTier) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.tier.fallbacks")
                .description("Requests with a missing or unknown tier")
                .tag("requested_tier", nullSafe(requestedTier))
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Usage Pipeline Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordUsageEnqueued(String category) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.usage.enqueued")
                .description("Usage records queued for persistence")
                .tag("category", nullSafe(category))
                .register(registry)
                .increment();
    }

    @Override
    public void recordUsagePersisted(boolean duplicate) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.usage.persisted")
                .description("Usage records written to storage")
                .tag("duplicate", String.valueOf(duplicate))
                .register(registry)
                .increment();
    }

    @Override
    public void recordUsageWriteRetry() {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.usage.write_retries")
                .description("Usage write attempts that failed and were retried")
                .register(registry)
                .increment();
    }

    @Override
    public void recordUsageDeadLettered(DeadLetterReason reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.usage.dead_letter")
                .description("Usage records moved to the dead-letter sink")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void registerUsageQueueGauge(Supplier<Number> depth) {
        if (!enabled) {
            return;
        }

        Gauge.builder("tollgate.usage.queue.depth", depth)
                .description("Usage records waiting to be written")
                .register(registry);
    }

    // -------------------------------------------------------------------------
    // Aggregation Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRollup(int recordsProcessed, int updatedAggregates, int lateRecords, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.rollup.records")
                .description("Usage records folded into aggregates")
                .register(registry)
                .increment(recordsProcessed);

        DistributionSummary.builder("tollgate.rollup.aggregates")
                .description("Aggregate rows written per rollup")
                .register(registry)
                .record(updatedAggregates);

        Counter.builder("tollgate.rollup.late_records")
                .description("Usage records that arrived for finalized days")
                .register(registry)
                .increment(lateRecords);

        Timer.builder("tollgate.rollup.duration")
                .description("Rollup run duration")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRollupConflict() {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.rollup.conflicts")
                .description("Rollup commits rejected because the checkpoint moved")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRetentionPurge(String target, long removed) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.retention.purged")
                .description("Rows removed by the retention job")
                .tag("target", nullSafe(target))
                .register(registry)
                .increment(removed);
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
