package tollgate.core.service.ratelimit;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import tollgate.core.config.RateLimitingConfig;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.window.RateWindow;

/**
 * In-process counters used only while the shared counter store is unavailable.
 *
 * <p>Each instance enforces its share of a limit, {@code ceil(limit / instanceCount)},
 * so a fleet in degraded mode stays near the configured limits instead of
 * admitting everything. Counters are keyed per identity and window kind and
 * reset when a new window starts, which keeps the map bounded by the number
 * of active identities.
 */
@ApplicationScoped
public class LocalFallbackLimiter {

    private final ConcurrentMap<String, WindowCount> counts = new ConcurrentHashMap<>();
    private final int instanceCount;

    @Inject
    public LocalFallbackLimiter(RateLimitingConfig config) {
        this(config.fallback().instanceCount());
    }

    public LocalFallbackLimiter(int instanceCount) {
        if (instanceCount < 1) {
            throw new IllegalArgumentException("Instance count must be at least 1, got " + instanceCount);
        }
        this.instanceCount = instanceCount;
    }

    /**
     * Count a request in the given window and return the new local count.
     */
    public long incrementAndGet(String identity, RateWindow window) {
        final var key = identity + ":" + window.kind().value();
        final var start = window.startEpochSecond();
        return counts.compute(key, (k, current) -> {
                    if (current == null || current.windowStart() != start) {
                        return new WindowCount(start, 1);
                    }
                    return new WindowCount(start, current.count() + 1);
                })
                .count();
    }

    /**
     * This instance's share of a limit.
     */
    public long localLimit(long limit) {
        if (limit == TierPolicy.UNLIMITED) {
            return limit;
        }
        return (limit + instanceCount - 1) / instanceCount;
    }

    /**
     * Drop all local counters, typically once the shared store is back.
     */
    public void clear() {
        counts.clear();
    }

    public int size() {
        return counts.size();
    }

    private record WindowCount(long windowStart, long count) {}
}
