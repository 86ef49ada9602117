package tollgate.core.model.billing;

import java.math.BigDecimal;
import java.util.Collection;

import tollgate.core.model.aggregate.DailyAggregate;

/**
 * Billable quantities summed over a period.
 */
public record UsageTotals(long requests, BigDecimal computeUnits, long tokens, long storageBytes) {

    public static UsageTotals of(Collection<DailyAggregate> aggregates) {
        long requests = 0;
        var computeUnits = BigDecimal.ZERO;
        long tokens = 0;
        long storageBytes = 0;
        for (var aggregate : aggregates) {
            requests += aggregate.requestCount();
            computeUnits = computeUnits.add(BigDecimal.valueOf(aggregate.computeUnits()));
            tokens += aggregate.totalTokens();
            storageBytes += aggregate.storageBytes();
        }
        return new UsageTotals(requests, computeUnits, tokens, storageBytes);
    }
}
