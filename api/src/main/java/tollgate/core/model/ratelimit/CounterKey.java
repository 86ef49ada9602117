package tollgate.core.model.ratelimit;

import tollgate.core.model.window.RateWindow;
import tollgate.core.model.window.WindowKind;

/**
 * Identifies one shared counter: requests by an identity within one window instance.
 *
 * @param identity    the caller identity
 * @param kind        the window kind
 * @param windowStart window start in epoch seconds
 */
public record CounterKey(String identity, WindowKind kind, long windowStart) {

    public CounterKey {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Window kind cannot be null");
        }
    }

    public static CounterKey of(String identity, RateWindow window) {
        return new CounterKey(identity, window.kind(), window.startEpochSecond());
    }

    /**
     * Render the storage key.
     *
     * <p>Format: {@code {prefix}{identity}:{kind}:{windowStart}}
     *
     * @param prefix key prefix, e.g. {@code tollgate:rl:}
     * @return the key string
     */
    public String render(String prefix) {
        return prefix + identity + ":" + kind.value() + ":" + windowStart;
    }
}
