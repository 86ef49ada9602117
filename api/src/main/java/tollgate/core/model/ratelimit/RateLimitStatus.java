package tollgate.core.model.ratelimit;

import java.util.List;
import java.util.Optional;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.window.WindowKind;

/**
 * Read-only view of an identity's current windows. Produced without counting a request.
 *
 * @param identity the identity
 * @param tier     the tier the windows were evaluated under
 * @param windows  one status per window kind
 * @param degraded true when the counter store could not be read
 */
public record RateLimitStatus(String identity, Tier tier, List<WindowStatus> windows, boolean degraded) {

    public RateLimitStatus {
        windows = windows != null ? List.copyOf(windows) : List.of();
    }

    public Optional<WindowStatus> window(WindowKind kind) {
        return windows.stream().filter(w -> w.kind() == kind).findFirst();
    }
}
