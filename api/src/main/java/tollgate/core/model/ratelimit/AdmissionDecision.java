package tollgate.core.model.ratelimit;

import java.util.List;
import java.util.Optional;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.window.WindowKind;

/**
 * Result of an admission check across all windows.
 *
 * <p>The binding window is the one the caller should pace against: the minute
 * window when the request is allowed, otherwise the exceeded window with the
 * longest time to reset.
 *
 * @param outcome           allowed, rate limited, or limiter unavailable
 * @param identity          the identity that was checked
 * @param tier              the tier the request was evaluated under
 * @param windows           status of every window, empty when no counts are known
 * @param bindingWindow     the window that determines limit, remaining, and reset
 * @param limit             limit of the binding window
 * @param remaining         requests left in the binding window
 * @param resetSeconds      seconds until the binding window resets
 * @param retryAfterSeconds seconds to wait before retrying, zero when allowed
 * @param degraded          true when the shared counter store was unavailable
 * @param policyFallback    true when the requested tier was unknown
 * @param usageId           correlates this decision with the usage record written later
 */
public record AdmissionDecision(
        AdmissionOutcome outcome,
        String identity,
        Tier tier,
        List<WindowStatus> windows,
        WindowKind bindingWindow,
        long limit,
        long remaining,
        long resetSeconds,
        long retryAfterSeconds,
        boolean degraded,
        boolean policyFallback,
        String usageId) {

    public AdmissionDecision {
        windows = windows != null ? List.copyOf(windows) : List.of();
    }

    /**
     * Build a decision from evaluated windows.
     *
     * <p>Any exceeded window rejects. Among exceeded windows the one with the
     * longest reset binds, so a retry after {@code retryAfterSeconds} can only
     * fail again if new requests are counted meanwhile.
     */
    public static AdmissionDecision fromWindows(
            String identity,
            Tier tier,
            List<WindowStatus> windows,
            boolean degraded,
            boolean policyFallback,
            String usageId) {
        final var binding = windows.stream()
                .filter(WindowStatus::exceeded)
                .max((a, b) -> Long.compare(a.resetSeconds(), b.resetSeconds()));

        if (binding.isPresent()) {
            final var window = binding.get();
            return new AdmissionDecision(
                    AdmissionOutcome.RATE_LIMITED,
                    identity,
                    tier,
                    windows,
                    window.kind(),
                    window.limit(),
                    0,
                    window.resetSeconds(),
                    window.resetSeconds(),
                    degraded,
                    policyFallback,
                    usageId);
        }

        final var minute = windows.stream()
                .filter(w -> w.kind() == WindowKind.MINUTE)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Minute window status is required"));
        return new AdmissionDecision(
                AdmissionOutcome.ALLOWED,
                identity,
                tier,
                windows,
                WindowKind.MINUTE,
                minute.limit(),
                minute.remaining(),
                minute.resetSeconds(),
                0,
                degraded,
                policyFallback,
                usageId);
    }

    /**
     * Allowed without counting, used when rate limiting is switched off.
     */
    public static AdmissionDecision unmetered(String identity, Tier tier, boolean policyFallback, String usageId) {
        return new AdmissionDecision(
                AdmissionOutcome.ALLOWED,
                identity,
                tier,
                List.of(),
                WindowKind.MINUTE,
                TierPolicy.UNLIMITED,
                TierPolicy.UNLIMITED,
                0,
                0,
                false,
                policyFallback,
                usageId);
    }

    /**
     * Allowed without counts because the counter store is unavailable, the
     * policy is fail-open, and no local fallback limiter is configured.
     */
    public static AdmissionDecision degradedAllow(String identity, Tier tier, boolean policyFallback, String usageId) {
        return new AdmissionDecision(
                AdmissionOutcome.ALLOWED,
                identity,
                tier,
                List.of(),
                WindowKind.MINUTE,
                TierPolicy.UNLIMITED,
                TierPolicy.UNLIMITED,
                0,
                0,
                true,
                policyFallback,
                usageId);
    }

    /**
     * Refused because the counter store is unavailable and the policy is fail-closed.
     *
     * @param retryAfterSeconds suggested wait before retrying
     */
    public static AdmissionDecision unavailable(
            String identity, Tier tier, long retryAfterSeconds, boolean policyFallback, String usageId) {
        return new AdmissionDecision(
                AdmissionOutcome.UNAVAILABLE,
                identity,
                tier,
                List.of(),
                WindowKind.MINUTE,
                0,
                0,
                retryAfterSeconds,
                retryAfterSeconds,
                true,
                policyFallback,
                usageId);
    }

    public boolean allowed() {
        return outcome == AdmissionOutcome.ALLOWED;
    }

    public Optional<WindowStatus> window(WindowKind kind) {
        return windows.stream().filter(w -> w.kind() == kind).findFirst();
    }
}
