package tollgate.adapter.out.counter.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.port.out.CounterStore;

/**
 * In-memory counter store.
 *
 * <p>Each increment runs inside {@link ConcurrentMap#compute}, so it is atomic
 * per key and a new counter is created together with its expiry.
 *
 * <p>Limitations:
 * <ul>
 *   <li>Counters are not shared across instances</li>
 *   <li>Counters are lost on restart</li>
 * </ul>
 *
 * <p>For production multi-instance deployments, use the Redis counter store.
 */
public final class InMemoryCounterStore implements CounterStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCounterStore.class);
    private static final String NAME = "memory";

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryCounterStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "counter-store-cleanup");
            t.setDaemon(true);
            return t;
        });

        final var intervalMs = Math.max(1, cleanupInterval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Initialized in-memory counter store");
    }

    public InMemoryCounterStore(Clock clock) {
        this(clock, Duration.ofMinutes(1));
    }

    @Override
    public Uni<Long> incrementAndGet(String key, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var counter = counters.compute(key, (k, existing) -> {
                if (existing == null || existing.isExpired(now)) {
                    return new Counter(1, now.plus(ttl));
                }
                return new Counter(existing.value() + 1, existing.expiresAt());
            });
            return counter.value();
        });
    }

    @Override
    public Uni<Long> get(String key) {
        return Uni.createFrom().item(() -> {
            final var counter = counters.get(key);
            if (counter == null || counter.isExpired(clock.instant())) {
                return 0L;
            }
            return counter.value();
        });
    }

    @Override
    public Uni<Void> delete(List<String> keys) {
        return Uni.createFrom().item(() -> {
            keys.forEach(counters::remove);
            return null;
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Number of counters currently held, including expired ones not yet cleaned up.
     */
    public int size() {
        return counters.size();
    }

    /**
     * Stop the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdownNow();
    }

    void cleanupExpired() {
        final var now = clock.instant();
        final var before = counters.size();
        counters.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        final var removed = before - counters.size();
        if (removed > 0) {
            LOG.debugf("Removed %d expired counter(s)", removed);
        }
    }

    private record Counter(long value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
