package tollgate.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.aggregate.UsageWatermark;
import tollgate.core.model.usage.UsageRecord;

/**
 * Append-only store of raw usage records.
 */
public interface UsageRecordRepository {

    /**
     * Append a stamped record. Appending an id that already exists is a no-op.
     *
     * @param record the record, with {@code recordedAt} set
     * @return Uni with true if the record was new, false if it was a duplicate
     */
    Uni<Boolean> append(UsageRecord record);

    /**
     * Read records strictly after {@code after} and recorded before {@code upTo},
     * in watermark order.
     *
     * @param after lower bound (exclusive), empty to start from the beginning
     * @param upTo  upper bound on {@code recordedAt} (exclusive)
     * @param limit max records to return
     * @return Uni with the records in ascending watermark order
     */
    Uni<List<UsageRecord>> findAfter(Optional<UsageWatermark> after, Instant upTo, int limit);

    /**
     * Delete records recorded before the cutoff.
     *
     * @param cutoff exclusive upper bound on {@code recordedAt}
     * @return Uni with the number of records removed, -1 when the store expires records itself
     */
    Uni<Long> purgeRecordedBefore(Instant cutoff);
}
