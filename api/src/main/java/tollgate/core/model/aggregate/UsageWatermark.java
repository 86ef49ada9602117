package tollgate.core.model.aggregate;

import java.time.Instant;
import java.util.Comparator;

/**
 * Rollup position. Records are totally ordered by {@code (recordedAt, recordId)}.
 *
 * @param recordedAt persistence timestamp of the last folded record
 * @param recordId   id of the last folded record, breaks timestamp ties
 */
public record UsageWatermark(Instant recordedAt, String recordId) implements Comparable<UsageWatermark> {

    private static final Comparator<UsageWatermark> ORDER =
            Comparator.comparing(UsageWatermark::recordedAt).thenComparing(UsageWatermark::recordId);

    public UsageWatermark {
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
    }

    @Override
    public int compareTo(UsageWatermark other) {
        return ORDER.compare(this, other);
    }

    public boolean isBefore(UsageWatermark other) {
        return compareTo(other) < 0;
    }
}
