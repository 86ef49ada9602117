package tollgate.core.model.tier;

/**
 * The policy a request is evaluated under.
 *
 * @param policy        the policy to apply
 * @param requestedTier the raw tier value the caller presented, may be null
 * @param fallback      true when the requested tier had no policy and the most
 *                      restrictive one was substituted
 */
public record ResolvedPolicy(TierPolicy policy, String requestedTier, boolean fallback) {

    public static ResolvedPolicy exact(TierPolicy policy, String requestedTier) {
        return new ResolvedPolicy(policy, requestedTier, false);
    }

    public static ResolvedPolicy fallback(TierPolicy policy, String requestedTier) {
        return new ResolvedPolicy(policy, requestedTier, true);
    }

    public Tier tier() {
        return policy.tier();
    }
}
