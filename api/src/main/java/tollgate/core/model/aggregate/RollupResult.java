package tollgate.core.model.aggregate;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Outcome of one rollup run.
 *
 * @param recordsProcessed  records read past the previous watermark
 * @param updatedAggregates aggregate rows written
 * @param lateRecords       records held back as late
 * @param watermark         watermark after the run
 * @param finalizedThrough  finalization boundary after the run
 * @param skipped           true when another instance held the rollup lease
 */
public record RollupResult(
        int recordsProcessed,
        int updatedAggregates,
        int lateRecords,
        Optional<UsageWatermark> watermark,
        Optional<LocalDate> finalizedThrough,
        boolean skipped) {

    public static RollupResult skippedRun() {
        return new RollupResult(0, 0, 0, Optional.empty(), Optional.empty(), true);
    }

    public static RollupResult nothingFrom(RollupCheckpoint checkpoint) {
        return new RollupResult(0, 0, 0, checkpoint.watermark(), checkpoint.finalizedThrough(), false);
    }

    /**
     * Accumulate a following batch into this result.
     */
    public RollupResult plus(RollupResult batch) {
        return new RollupResult(
                recordsProcessed + batch.recordsProcessed,
                updatedAggregates + batch.updatedAggregates,
                lateRecords + batch.lateRecords,
                batch.watermark.isPresent() ? batch.watermark : watermark,
                batch.finalizedThrough.isPresent() ? batch.finalizedThrough : finalizedThrough,
                skipped && batch.skipped);
    }
}
