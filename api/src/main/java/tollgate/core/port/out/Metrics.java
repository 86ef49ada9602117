package tollgate.core.port.out;

import java.util.function.Supplier;

import tollgate.core.model.ratelimit.AdmissionOutcome;
import tollgate.core.model.usage.DeadLetterReason;
import tollgate.core.model.window.WindowKind;

/**
 * Port interface for recording metering metrics.
 *
 * <p>Implementations must be cheap no-ops when metrics are disabled.
 */
public interface Metrics {

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    boolean isEnabled();

    // ========== Admission ==========

    /**
     * Record the result of an admission check.
     *
     * @param tier      tier the request was evaluated under
     * @param outcome   the outcome
     * @param degraded  true when the counter store was unavailable
     * @param latencyNanos time spent deciding
     */
    void recordAdmission(String tier, AdmissionOutcome outcome, boolean degraded, long latencyNanos);

    /**
     * Record a rejection and the window that caused it.
     */
    void recordRateLimitExceeded(String tier, WindowKind window);

    /**
     * Record a counter store failure.
     *
     * @param store  store name
     * @param reason {@code timeout} or {@code error}
     */
    void recordCounterStoreFailure(String store, String reason);

    /**
     * Record that an unknown tier was replaced by the most restrictive one.
     */
    void recordPolicyFallback(String requestedTier);

    // ========== Usage pipeline ==========

    void recordUsageEnqueued(String category);

    void recordUsagePersisted(boolean duplicate);

    void recordUsageWriteRetry();

    void recordUsageDeadLettered(DeadLetterReason reason);

    /**
     * Register a gauge tracking the usage queue depth.
     */
    void registerUsageQueueGauge(Supplier<Number> depth);

    // ========== Aggregation ==========

    void recordRollup(int recordsProcessed, int updatedAggregates, int lateRecords, long durationMs);

    void recordRollupConflict();

    void recordRetentionPurge(String target, long removed);
}
