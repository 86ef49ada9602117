package tollgate.core.model.aggregate;

import java.util.List;

/**
 * One atomic unit of rollup progress.
 *
 * <p>Stores commit the new absolute aggregate totals, the late records, and the
 * next checkpoint together, and only if the stored checkpoint still has the
 * expected version.
 *
 * @param expected    checkpoint the rollup started from
 * @param next        checkpoint to store
 * @param aggregates  new absolute totals for every touched key
 * @param lateRecords records held back because their day is finalized
 */
public record RollupCommit(
        RollupCheckpoint expected, RollupCheckpoint next, List<DailyAggregate> aggregates, List<LateUsageRecord> lateRecords) {

    public RollupCommit {
        if (expected == null || next == null) {
            throw new IllegalArgumentException("Checkpoints cannot be null");
        }
        aggregates = aggregates != null ? List.copyOf(aggregates) : List.of();
        lateRecords = lateRecords != null ? List.copyOf(lateRecords) : List.of();
    }
}
