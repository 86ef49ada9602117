package tollgate.core.port.in;

import java.time.LocalDate;
import java.util.List;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.aggregate.LateUsageRecord;
import tollgate.core.model.aggregate.RollupCheckpoint;
import tollgate.core.model.aggregate.RollupResult;

/**
 * Port for rolling raw usage into daily aggregates.
 */
public interface UsageAggregation {

    /**
     * Fold records past the checkpoint into daily aggregates. Safe to repeat.
     *
     * @return Uni with the run result; {@code skipped} when another run holds the lease
     */
    Uni<RollupResult> rollup();

    /**
     * Close days up to and including {@code date}. Later records for those days
     * are held as late records instead of being folded.
     *
     * @param date last day to finalize
     * @return Uni with the new checkpoint
     */
    Uni<RollupCheckpoint> finalizeThrough(LocalDate date);

    /**
     * Late records whose usage day is within the inclusive range.
     */
    Uni<List<LateUsageRecord>> lateRecords(LocalDate from, LocalDate to);

    /**
     * Current rollup checkpoint.
     */
    Uni<RollupCheckpoint> checkpoint();
}
