package tollgate.core.model.ratelimit;

import java.time.Instant;
import java.util.Optional;

/**
 * Last known availability of the shared counter store, as seen by the limiter.
 *
 * @param store         store name
 * @param degraded      true when the most recent check could not use the store
 * @param lastFailureAt time of the most recent failure, if any
 * @param lastError     message of the most recent failure, if any
 */
public record CounterStoreState(
        String store, boolean degraded, Optional<Instant> lastFailureAt, Optional<String> lastError) {

    public static CounterStoreState healthy(String store) {
        return new CounterStoreState(store, false, Optional.empty(), Optional.empty());
    }

    public CounterStoreState recovered() {
        return new CounterStoreState(store, false, lastFailureAt, lastError);
    }

    public CounterStoreState failed(Instant at, String error) {
        return new CounterStoreState(store, true, Optional.of(at), Optional.ofNullable(error));
    }
}
