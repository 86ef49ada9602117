package tollgate.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for usage capture and persistence.
 *
 * <p>Configuration prefix: {@code tollgate.usage}
 */
@ConfigMapping(prefix = "tollgate.usage")
public interface UsageConfig {

    /**
     * Record usage for admitted requests.
     *
     * @return true to record usage (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Bound on records waiting to be written. Overflow goes to the dead-letter sink.
     *
     * @return queue capacity (default: 10000)
     */
    @WithDefault("10000")
    int queueCapacity();

    /**
     * Writer threads draining the queue.
     *
     * @return worker count (default: 2)
     */
    @WithDefault("2")
    int workers();

    /**
     * Write attempts per record before it is dead-lettered.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxAttempts();

    /**
     * Initial backoff between attempts, doubled after each failure.
     *
     * @return initial backoff (default: 200ms)
     */
    @WithDefault("PT0.2S")
    Duration retryBackoff();

    /**
     * Upper bound on one write attempt.
     *
     * @return write timeout (default: 2s)
     */
    @WithDefault("PT2S")
    Duration writeTimeout();

    /**
     * How long shutdown waits for the queue to drain.
     *
     * @return drain deadline (default: 10s)
     */
    @WithDefault("PT10S")
    Duration shutdownDeadline();

    DeadLetterConfig deadLetter();

    RetentionConfig retention();

    CostConfig cost();

    interface DeadLetterConfig {

        /**
         * File receiving dead-lettered records as JSON lines. When absent
         * entries are held in memory.
         */
        Optional<String> path();
    }

    interface RetentionConfig {

        /**
         * How long raw usage records are kept.
         *
         * @return record retention (default: 90 days)
         */
        @WithDefault("P90D")
        Duration records();

        /**
         * How long daily aggregates are kept.
         *
         * @return aggregate retention (default: 365 days)
         */
        @WithDefault("P365D")
        Duration aggregates();

        /**
         * How often the purge job runs, as a scheduler interval.
         *
         * @return purge interval (default: 24h)
         */
        @WithDefault("24h")
        String interval();
    }

    interface CostConfig {

        /**
         * Payload characters per estimated token when no token count is reported.
         *
         * @return chars per token (default: 4)
         */
        @WithDefault("4")
        int charsPerToken();

        /**
         * Compute weight for categories without an explicit weight.
         *
         * @return default weight (default: 1.0)
         */
        @WithDefault("1.0")
        double defaultWeight();

        /**
         * Compute weight per request category.
         */
        Map<String, Double> categoryWeights();

        /**
         * Compute weight multiplier per reported model.
         */
        Map<String, Double> modelWeights();
    }
}
