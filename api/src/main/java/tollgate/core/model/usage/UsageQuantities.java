package tollgate.core.model.usage;

/**
 * Billable quantities derived from one request.
 */
public record UsageQuantities(long tokensIn, long tokensOut, double computeUnits, long storageBytes) {

    public UsageQuantities {
        if (tokensIn < 0 || tokensOut < 0 || storageBytes < 0) {
            throw new IllegalArgumentException("Usage quantities cannot be negative");
        }
        if (computeUnits < 0 || Double.isNaN(computeUnits) || Double.isInfinite(computeUnits)) {
            throw new IllegalArgumentException("Compute units must be a finite non-negative number");
        }
    }
}
