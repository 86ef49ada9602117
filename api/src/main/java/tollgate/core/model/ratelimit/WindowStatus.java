package tollgate.core.model.ratelimit;

import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.window.WindowKind;

/**
 * State of one window after (or without) counting a request.
 *
 * @param kind         the window kind
 * @param limit        the limit, {@link TierPolicy#UNLIMITED} when unlimited
 * @param count        requests counted in the current window
 * @param remaining    requests left, {@link TierPolicy#UNLIMITED} when unlimited
 * @param resetSeconds seconds until the window closes
 * @param exceeded     true when the count is above the limit
 * @param unlimited    true when the window is counted but never enforced
 */
public record WindowStatus(
        WindowKind kind, long limit, long count, long remaining, long resetSeconds, boolean exceeded, boolean unlimited) {

    /**
     * Evaluate a count against a limit.
     *
     * @param kind         the window kind
     * @param limit        the limit or {@link TierPolicy#UNLIMITED}
     * @param count        the current count
     * @param resetSeconds seconds until reset
     * @return the window status
     */
    public static WindowStatus evaluate(WindowKind kind, long limit, long count, long resetSeconds) {
        if (limit == TierPolicy.UNLIMITED) {
            return new WindowStatus(kind, limit, count, TierPolicy.UNLIMITED, resetSeconds, false, true);
        }
        final var remaining = Math.max(0, limit - count);
        return new WindowStatus(kind, limit, count, remaining, resetSeconds, count > limit, false);
    }
}
