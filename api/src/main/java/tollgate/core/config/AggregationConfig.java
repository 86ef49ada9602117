package tollgate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for usage rollup.
 *
 * <p>Configuration prefix: {@code tollgate.aggregation}
 */
@ConfigMapping(prefix = "tollgate.aggregation")
public interface AggregationConfig {

    /**
     * Run the scheduled rollup. On-demand rollups work regardless.
     *
     * @return true to schedule rollups (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Scheduler interval between rollups.
     *
     * @return interval expression (default: 5m)
     */
    @WithDefault("5m")
    String interval();

    /**
     * Records recorded within this distance of now are left for the next run,
     * so writes that are still retrying are not skipped by the watermark.
     *
     * @return settle delay (default: 2 minutes)
     */
    @WithDefault("PT2M")
    Duration settleDelay();

    /**
     * Records read and committed per batch.
     *
     * @return batch size (default: 1000)
     */
    @WithDefault("1000")
    int batchSize();

    /**
     * Days are finalized once this much time has passed since they ended.
     *
     * @return finalization lag (default: 2 days)
     */
    @WithDefault("P2D")
    Duration finalizationLag();

    /**
     * Lease duration guarding against overlapping rollups.
     *
     * @return lease TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration leaseTtl();

    /**
     * Retries after a checkpoint conflict before the run fails.
     *
     * @return max conflict retries (default: 3)
     */
    @WithDefault("3")
    int maxConflictRetries();
}
