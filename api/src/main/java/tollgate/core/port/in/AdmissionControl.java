package tollgate.core.port.in;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.ratelimit.CounterStoreState;
import tollgate.core.model.ratelimit.RateLimitStatus;

/**
 * Port for per-request admission against tier limits.
 */
public interface AdmissionControl {

    /**
     * Count one request against every window and decide whether it may proceed.
     *
     * <p>Never fails: counter store problems are folded into the decision
     * according to the configured failure policy.
     *
     * @param identity  the caller identity
     * @param tierValue the caller's tier value, may be null or unknown
     * @return Uni with the decision
     */
    Uni<AdmissionDecision> check(String identity, String tierValue);

    /**
     * Current window state for an identity without counting a request.
     *
     * @param identity  the identity
     * @param tierValue the tier to evaluate under, may be null
     * @return Uni with the status
     */
    Uni<RateLimitStatus> status(String identity, String tierValue);

    /**
     * Clear the identity's counters for the current windows.
     *
     * @param identity the identity
     * @return Uni completing when cleared
     */
    Uni<Void> reset(String identity);

    /**
     * Last known availability of the shared counter store.
     */
    CounterStoreState counterStoreState();
}
