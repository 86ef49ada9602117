package tollgate.core.model.aggregate;

import java.time.Instant;
import java.time.LocalDate;

import tollgate.core.model.usage.UsageRecord;

/**
 * Per-identity, per-day, per-category usage totals. The basis for billing.
 *
 * @param identity            the identity
 * @param date                UTC day
 * @param category            request category
 * @param requestCount        admitted requests
 * @param successCount        requests that completed below status 400
 * @param errorCount          requests that completed with status 400 or above
 * @param durationTotalMillis summed request durations
 * @param tokensIn            summed input tokens
 * @param tokensOut           summed output tokens
 * @param computeUnits        summed compute units
 * @param storageBytes        summed stored bytes
 * @param updatedAt           last time the row changed
 */
public record DailyAggregate(
        String identity,
        LocalDate date,
        String category,
        long requestCount,
        long successCount,
        long errorCount,
        long durationTotalMillis,
        long tokensIn,
        long tokensOut,
        double computeUnits,
        long storageBytes,
        Instant updatedAt) {

    public static DailyAggregate empty(AggregateKey key) {
        return new DailyAggregate(key.identity(), key.date(), key.category(), 0, 0, 0, 0, 0, 0, 0.0, 0, null);
    }

    public AggregateKey key() {
        return new AggregateKey(identity, date, category);
    }

    /**
     * Add one record to these totals.
     */
    public DailyAggregate plus(UsageRecord record, Instant now) {
        return new DailyAggregate(
                identity,
                date,
                category,
                requestCount + 1,
                successCount + (record.success() ? 1 : 0),
                errorCount + (record.success() ? 0 : 1),
                durationTotalMillis + record.durationMillis(),
                tokensIn + record.tokensIn(),
                tokensOut + record.tokensOut(),
                computeUnits + record.computeUnits(),
                storageBytes + record.storageBytes(),
                now);
    }

    /**
     * Add another aggregate's totals (same key) to these.
     */
    public DailyAggregate plus(DailyAggregate delta, Instant now) {
        if (!key().equals(delta.key())) {
            throw new IllegalArgumentException("Cannot merge aggregates for different keys: " + key() + " and "
                    + delta.key());
        }
        return new DailyAggregate(
                identity,
                date,
                category,
                requestCount + delta.requestCount,
                successCount + delta.successCount,
                errorCount + delta.errorCount,
                durationTotalMillis + delta.durationTotalMillis,
                tokensIn + delta.tokensIn,
                tokensOut + delta.tokensOut,
                computeUnits + delta.computeUnits,
                storageBytes + delta.storageBytes,
                now);
    }

    public long totalTokens() {
        return tokensIn + tokensOut;
    }
}
