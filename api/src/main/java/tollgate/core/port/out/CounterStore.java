package tollgate.core.port.out;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;

/**
 * Shared, expiring counters used by the rate limiter.
 *
 * <p>Implementations must make {@link #incrementAndGet} a single atomic unit:
 * concurrent calls for the same key are linearized, and a key never exists
 * without an expiry.
 *
 * <p>Failures should surface as
 * {@link tollgate.core.model.ratelimit.CounterStoreUnavailableException}.
 */
public interface CounterStore {

    /**
     * Increment a counter and return its new value.
     *
     * <p>When the key does not exist (or has expired) it is created with value 1
     * and the given time to live. The expiry is set once and never extended.
     *
     * @param key the counter key
     * @param ttl time to live for a newly created counter
     * @return Uni with the value after incrementing
     */
    Uni<Long> incrementAndGet(String key, Duration ttl);

    /**
     * Read a counter without changing it.
     *
     * @param key the counter key
     * @return Uni with the current value, 0 when absent or expired
     */
    Uni<Long> get(String key);

    /**
     * Delete counters.
     *
     * @param keys keys to delete, missing keys are ignored
     * @return Uni completing when deleted
     */
    Uni<Void> delete(List<String> keys);

    /**
     * Name of the backing store for logs and health output.
     */
    String name();
}
