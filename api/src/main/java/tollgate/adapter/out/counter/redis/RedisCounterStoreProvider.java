package tollgate.adapter.out.counter.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import tollgate.core.port.out.CounterStore;
import tollgate.spi.CounterStoreProvider;

/**
 * Redis counter store provider for multi-instance deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected automatically when Redis is enabled and a data source is available.
 */
public final class RedisCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final boolean redisConfigured;

    public RedisCounterStoreProvider(ReactiveRedisDataSource redisDataSource, boolean redisConfigured) {
        this.redisDataSource = redisDataSource;
        this.redisConfigured = redisConfigured;
    }

    /**
     * Default constructor for ServiceLoader.
     *
     * <p>When loaded via ServiceLoader, the data source must be supplied
     * separately via the loader.
     */
    public RedisCounterStoreProvider() {
        this(null, false);
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisConfigured && redisDataSource != null;
    }

    @Override
    public CounterStore createCounterStore() {
        if (redisDataSource == null) {
            throw new IllegalStateException(
                    "Provider not configured. Use CounterStoreProviderLoader for proper initialization.");
        }
        return new RedisCounterStore(redisDataSource);
    }

    public static RedisCounterStoreProvider configured(ReactiveRedisDataSource redisDataSource) {
        return new RedisCounterStoreProvider(redisDataSource, true);
    }
}
