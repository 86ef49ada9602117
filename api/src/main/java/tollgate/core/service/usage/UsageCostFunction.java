package tollgate.core.service.usage;

import tollgate.core.model.usage.RequestMetrics;
import tollgate.core.model.usage.UsageQuantities;

/**
 * Turns what a request did into billable quantities.
 *
 * <p>The default implementation is {@link ConfiguredUsageCostFunction}.
 * Provide another CDI bean of this type to replace it.
 */
public interface UsageCostFunction {

    /**
     * Compute quantities for one request.
     *
     * @param category the request category
     * @param metrics  what the request path observed
     * @return the quantities
     */
    UsageQuantities quantify(String category, RequestMetrics metrics);
}
