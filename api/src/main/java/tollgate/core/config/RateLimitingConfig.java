package tollgate.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import tollgate.core.model.ratelimit.FailurePolicy;

/**
 * Configuration mapping for tiered rate limiting.
 *
 * <p>Configuration prefix: {@code tollgate.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TOLLGATE_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code TOLLGATE_RATE_LIMITING_FAILURE_POLICY} - FAIL_OPEN or FAIL_CLOSED</li>
 *   <li>{@code TOLLGATE_RATE_LIMITING_STORE_TIMEOUT} - Max time to wait for the counter store</li>
 *   <li>{@code TOLLGATE_RATE_LIMITING_REDIS_ENABLED} - Use Redis for shared counters</li>
 * </ul>
 */
@ConfigMapping(prefix = "tollgate.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * <p>When disabled every request is admitted and not counted. Usage is
     * still recorded.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * What to do when the counter store is unreachable.
     *
     * @return the failure policy (default: FAIL_OPEN)
     */
    @WithDefault("FAIL_OPEN")
    FailurePolicy failurePolicy();

    /**
     * Upper bound on one admission check against the counter store.
     *
     * @return store timeout (default: 50ms)
     */
    @WithDefault("PT0.05S")
    Duration storeTimeout();

    /**
     * Added to the window size when a counter is created, so a counter
     * outlives its window by a little under clock skew.
     *
     * @return grace period (default: 10s)
     */
    @WithDefault("PT10S")
    Duration windowGrace();

    /**
     * Retry-After returned with fail-closed rejections.
     *
     * @return retry hint (default: 1s)
     */
    @WithDefault("PT1S")
    Duration unavailableRetryAfter();

    /**
     * Include X-RateLimit-* and X-Quota-* headers in responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Window sizes.
     */
    WindowsConfig windows();

    /**
     * Local limiter used while the counter store is unavailable.
     */
    FallbackConfig fallback();

    /**
     * Counter store selection.
     */
    CounterStoreConfig counterStore();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    interface WindowsConfig {

        @WithDefault("PT1M")
        Duration minute();

        @WithDefault("PT1H")
        Duration hour();

        @WithDefault("PT24H")
        Duration day();
    }

    interface FallbackConfig {

        /**
         * Enforce per-instance limits while degraded instead of admitting everything.
         *
         * @return true to enable (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Expected number of instances. Each instance enforces
         * {@code ceil(limit / instanceCount)} while degraded.
         *
         * @return instance count (default: 1)
         */
        @WithDefault("1")
        int instanceCount();
    }

    interface CounterStoreConfig {

        /**
         * Explicit provider name ({@code redis} or {@code memory}). When absent
         * the highest priority available provider is used.
         */
        Optional<String> provider();

        /**
         * Prefix for all counter keys, allowing several deployments to share a store.
         *
         * @return key prefix (default: "tollgate:rl:")
         */
        @WithDefault("tollgate:rl:")
        String keyPrefix();
    }

    interface RedisConfig {

        /**
         * Enable Redis as the counter store.
         *
         * <p>When enabled and a Redis data source is available, Redis holds all
         * counters. Otherwise counters live in memory and are not shared.
         *
         * @return true to use Redis (default: false)
         */
        @WithDefault("false")
        boolean enabled();
    }
}
