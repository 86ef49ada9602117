package tollgate.core.port.in;

import java.time.Duration;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.usage.RequestMetrics;
import tollgate.core.model.usage.UsagePipelineStatus;
import tollgate.core.model.usage.UsageRecord;

/**
 * Port for capturing usage of admitted requests.
 */
public interface UsageRecording {

    /**
     * Build a usage record and hand it to asynchronous persistence.
     *
     * <p>Never blocks and never throws on persistence problems; records that
     * cannot be queued go to the dead-letter sink.
     *
     * @param identity the identity
     * @param tier     tier the request was admitted under
     * @param category request category
     * @param metrics  what the request path observed
     * @return the record that was queued
     */
    UsageRecord record(String identity, Tier tier, String category, RequestMetrics metrics);

    /**
     * Move all dead-lettered records back into the queue.
     *
     * @return the number of records re-queued
     */
    int replayDeadLetters();

    /**
     * Wait until the queue is empty and no write is in flight.
     *
     * @param timeout max time to wait
     * @return true if drained within the timeout
     */
    boolean flush(Duration timeout);

    UsagePipelineStatus status();
}
