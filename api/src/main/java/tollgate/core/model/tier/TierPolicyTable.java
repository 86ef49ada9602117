package tollgate.core.model.tier;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import tollgate.core.model.window.WindowKind;

/**
 * Immutable, validated snapshot of all tier policies.
 *
 * <p>Tables are built once and swapped as a whole, so a reader either sees the
 * previous table or the new one, never a mix.
 */
public final class TierPolicyTable {

    /**
     * Orders policies from most to least restrictive: tighter minute limit first,
     * then hour, then day, then the lower tier.
     */
    private static final Comparator<TierPolicy> RESTRICTIVENESS = Comparator.comparingLong(
                    (TierPolicy p) -> p.limitFor(WindowKind.MINUTE))
            .thenComparingLong(p -> p.limitFor(WindowKind.HOUR))
            .thenComparingLong(p -> p.limitFor(WindowKind.DAY))
            .thenComparing(TierPolicy::tier);

    private final long version;
    private final Instant loadedAt;
    private final Map<Tier, TierPolicy> policies;
    private final TierPolicy mostRestrictive;

    private TierPolicyTable(long version, Instant loadedAt, Map<Tier, TierPolicy> policies) {
        this.version = version;
        this.loadedAt = loadedAt;
        this.policies = Collections.unmodifiableMap(policies);
        this.mostRestrictive =
                policies.values().stream().min(RESTRICTIVENESS).orElseThrow();
    }

    /**
     * Build a table, rejecting empty input and duplicate tiers.
     *
     * @param version  monotonically increasing table version
     * @param loadedAt when the table was loaded
     * @param policies the policies, one per tier
     * @return the validated table
     * @throws IllegalArgumentException if the input is invalid
     */
    public static TierPolicyTable of(long version, Instant loadedAt, Collection<TierPolicy> policies) {
        if (policies == null || policies.isEmpty()) {
            throw new IllegalArgumentException("Tier policy table must contain at least one tier");
        }
        final var byTier = new EnumMap<Tier, TierPolicy>(Tier.class);
        for (var policy : policies) {
            if (policy == null) {
                throw new IllegalArgumentException("Tier policy table cannot contain null entries");
            }
            if (byTier.putIfAbsent(policy.tier(), policy) != null) {
                throw new IllegalArgumentException("Duplicate policy for tier: " + policy.tier().value());
            }
        }
        return new TierPolicyTable(version, loadedAt, byTier);
    }

    public long version() {
        return version;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public Optional<TierPolicy> find(Tier tier) {
        return Optional.ofNullable(policies.get(tier));
    }

    /**
     * Look up a policy by its wire value.
     *
     * @param tierValue the tier value from the request
     * @return the policy
     * @throws PolicyNotFoundException if the value is missing, unknown, or not in this table
     */
    public TierPolicy require(String tierValue) {
        return Tier.fromValue(tierValue)
                .flatMap(this::find)
                .orElseThrow(() -> new PolicyNotFoundException(tierValue));
    }

    public TierPolicy mostRestrictive() {
        return mostRestrictive;
    }

    /**
     * Policies in tier order.
     */
    public List<TierPolicy> policies() {
        return List.copyOf(policies.values());
    }

    public int size() {
        return policies.size();
    }
}
