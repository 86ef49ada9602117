package tollgate.core.model.usage;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import tollgate.core.model.aggregate.UsageWatermark;
import tollgate.core.model.tier.Tier;

/**
 * Immutable fact: one admitted request and what it consumed.
 *
 * <p>{@code recordId} equals the usage id handed out with the admission
 * decision, which makes writes idempotent. {@code recordedAt} is stamped
 * when the record is first handed to persistence and orders records for
 * rollup. It is null until then.
 *
 * @param recordId       unique id, equal to the request's usage id
 * @param identity       the caller identity
 * @param tier           tier the request was admitted under
 * @param category       request category, e.g. {@code chat}
 * @param timestamp      when the request started
 * @param durationMillis request duration
 * @param tokensIn       input tokens
 * @param tokensOut      output tokens
 * @param computeUnits   weighted compute units
 * @param storageBytes   stored bytes
 * @param success        true when the response status was below 400
 * @param recordedAt     persistence timestamp, null until stamped
 */
public record UsageRecord(
        String recordId,
        String identity,
        Tier tier,
        String category,
        Instant timestamp,
        long durationMillis,
        long tokensIn,
        long tokensOut,
        double computeUnits,
        long storageBytes,
        boolean success,
        Instant recordedAt) {

    public UsageRecord {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("Record id cannot be null or blank");
        }
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        if (tier == null) {
            throw new IllegalArgumentException("Tier cannot be null");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
    }

    /**
     * Return a copy stamped with the given persistence time.
     */
    public UsageRecord withRecordedAt(Instant recordedAt) {
        return new UsageRecord(
                recordId,
                identity,
                tier,
                category,
                timestamp,
                durationMillis,
                tokensIn,
                tokensOut,
                computeUnits,
                storageBytes,
                success,
                recordedAt);
    }

    public boolean isStamped() {
        return recordedAt != null;
    }

    /**
     * UTC calendar day the request belongs to.
     */
    public LocalDate usageDate() {
        return LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
    }

    /**
     * Rollup position of this record.
     *
     * @throws IllegalStateException if the record has not been stamped
     */
    public UsageWatermark watermark() {
        if (recordedAt == null) {
            throw new IllegalStateException("Record " + recordId + " has not been stamped");
        }
        return new UsageWatermark(recordedAt, recordId);
    }
}
