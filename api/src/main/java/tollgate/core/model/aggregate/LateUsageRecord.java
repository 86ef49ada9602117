package tollgate.core.model.aggregate;

import java.time.Instant;
import java.time.LocalDate;

import tollgate.core.model.usage.UsageRecord;

/**
 * A record that arrived after its day was finalized. Held for manual reconciliation.
 *
 * @param record           the late record
 * @param finalizedThrough the finalization boundary at detection time
 * @param detectedAt       when rollup found it
 */
public record LateUsageRecord(UsageRecord record, LocalDate finalizedThrough, Instant detectedAt) {}
