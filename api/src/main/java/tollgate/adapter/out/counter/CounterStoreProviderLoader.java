package tollgate.adapter.out.counter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import tollgate.adapter.out.counter.memory.InMemoryCounterStore;
import tollgate.adapter.out.counter.memory.InMemoryCounterStoreProvider;
import tollgate.adapter.out.counter.redis.RedisCounterStoreProvider;
import tollgate.core.config.RateLimitingConfig;
import tollgate.core.port.out.CounterStore;
import tollgate.spi.CounterStoreProvider;

/**
 * CDI producer for the rate limit counter store.
 *
 * <p>Selection order:
 * <ol>
 *   <li>The provider named by {@code tollgate.rate-limiting.counter-store.provider}, if set</li>
 *   <li>Redis (priority 10) when Redis is enabled and a data source is available</li>
 *   <li>Custom providers registered via ServiceLoader, by priority</li>
 *   <li>In-memory (priority 0), always available</li>
 * </ol>
 */
@ApplicationScoped
public class CounterStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(CounterStoreProviderLoader.class);

    private final RateLimitingConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Clock clock;

    @Inject
    public CounterStoreProviderLoader(
            RateLimitingConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.clock = clock;
    }

    /**
     * Produces the counter store instance for CDI injection.
     *
     * @return the selected counter store
     */
    @Produces
    @ApplicationScoped
    public CounterStore produceCounterStore() {
        final var providers = availableProviders();
        final var configured = config.counterStore().provider();

        final CounterStoreProvider selected;
        if (configured.isPresent()) {
            selected = providers.stream()
                    .filter(p -> p.name().equalsIgnoreCase(configured.get()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "Configured counter store provider not available: " + configured.get()));
        } else {
            selected = providers.get(0);
        }

        LOG.infov(
                "Using counter store provider: {0} (rate limiting {1}, failure policy {2})",
                selected.name(), config.enabled() ? "enabled" : "disabled", config.failurePolicy());
        return selected.createCounterStore();
    }

    /**
     * Disposes the counter store, shutting down any cleanup executors.
     */
    void disposeCounterStore(@Disposes CounterStore counterStore) {
        if (counterStore instanceof InMemoryCounterStore inMemory) {
            inMemory.shutdown();
        }
    }

    private List<CounterStoreProvider> availableProviders() {
        final var providers = new ArrayList<CounterStoreProvider>();
        createRedisProvider().ifPresent(providers::add);
        providers.add(InMemoryCounterStoreProvider.configured(clock));

        for (var provider : ServiceLoader.load(CounterStoreProvider.class)) {
            // Built-ins were added above, configured
            if (provider instanceof RedisCounterStoreProvider || provider instanceof InMemoryCounterStoreProvider) {
                continue;
            }
            if (provider.isAvailable()) {
                LOG.debugv("Found custom counter store provider: {0} (priority {1})", provider.name(),
                        provider.priority());
                providers.add(provider);
            }
        }

        providers.removeIf(p -> !p.isAvailable());
        providers.sort(Comparator.comparingInt(CounterStoreProvider::priority).reversed());
        return providers;
    }

    private Optional<CounterStoreProvider> createRedisProvider() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis counter store not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis counter store enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            return Optional.of(RedisCounterStoreProvider.configured(redisDataSource.get()));
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to initialize Redis counter store, falling back to in-memory");
            return Optional.empty();
        }
    }
}
