package tollgate.core.port.out;

import java.util.List;

import tollgate.core.model.tier.TierPolicy;

/**
 * Where tier policies are loaded from at startup and on reload.
 */
public interface TierPolicySource {

    /**
     * Load all policies. Validation happens when the table is built.
     *
     * @return the policies
     * @throws IllegalStateException if the source cannot be read
     */
    List<TierPolicy> load();

    /**
     * Human-readable description of the source, e.g. a file path.
     */
    String describe();
}
