package tollgate.core.model.usage;

import java.time.Instant;

/**
 * A usage record that could not be persisted, kept for replay.
 *
 * @param record   the record, as it was when it failed
 * @param reason   why it was dead-lettered
 * @param error    last error message, may be null
 * @param failedAt when it was dead-lettered
 */
public record DeadLetterEntry(UsageRecord record, DeadLetterReason reason, String error, Instant failedAt) {

    public DeadLetterEntry {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("Reason cannot be null");
        }
    }
}
