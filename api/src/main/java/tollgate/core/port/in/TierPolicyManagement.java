package tollgate.core.port.in;

import java.util.List;

import tollgate.core.model.tier.ResolvedPolicy;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.tier.TierPolicyTable;

/**
 * Port for reading and hot-swapping tier policies.
 */
public interface TierPolicyManagement {

    /**
     * The active table.
     */
    TierPolicyTable current();

    /**
     * Resolve the policy for a tier value, substituting the most restrictive
     * policy when the value is missing or unknown.
     *
     * @param tierValue raw tier value, may be null
     * @return the resolved policy, flagged when a fallback was used
     */
    ResolvedPolicy resolve(String tierValue);

    /**
     * Validate and atomically install a new table.
     *
     * @param policies the complete new set of policies
     * @return the installed table
     * @throws IllegalArgumentException if the policies are invalid; the active table is unchanged
     */
    TierPolicyTable replace(List<TierPolicy> policies);

    /**
     * Reload from the configured source and install atomically.
     *
     * @return the installed table
     * @throws IllegalArgumentException if the loaded policies are invalid; the active table is unchanged
     */
    TierPolicyTable reload();
}
