package tollgate.core.model.tier;

/**
 * Thrown when a tier value has no policy in the active table.
 *
 * <p>Callers on the request path never let this escape. They evaluate the
 * request under the most restrictive known tier instead.
 */
public class PolicyNotFoundException extends RuntimeException {

    private final String tierValue;

    public PolicyNotFoundException(String tierValue) {
        super("No tier policy for tier: " + tierValue);
        this.tierValue = tierValue;
    }

    public String tierValue() {
        return tierValue;
    }
}
