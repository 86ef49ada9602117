package tollgate.adapter.in.dto;

import java.time.Instant;
import java.time.LocalDate;

import tollgate.core.model.aggregate.RollupCheckpoint;
import tollgate.core.model.aggregate.RollupResult;
import tollgate.core.model.aggregate.UsageWatermark;

/**
 * DTO for a rollup run or a checkpoint. Counts are zero when describing a bare checkpoint.
 */
public record RollupResultDto(
        boolean skipped,
        int recordsProcessed,
        int updatedAggregates,
        int lateRecords,
        Instant watermark,
        String watermarkRecordId,
        LocalDate finalizedThrough) {

    public static RollupResultDto fromModel(RollupResult result) {
        return new RollupResultDto(
                result.skipped(),
                result.recordsProcessed(),
                result.updatedAggregates(),
                result.lateRecords(),
                result.watermark().map(UsageWatermark::recordedAt).orElse(null),
                result.watermark().map(UsageWatermark::recordId).orElse(null),
                result.finalizedThrough().orElse(null));
    }

    public static RollupResultDto fromCheckpoint(RollupCheckpoint checkpoint) {
        return new RollupResultDto(
                false,
                0,
                0,
                0,
                checkpoint.watermark().map(UsageWatermark::recordedAt).orElse(null),
                checkpoint.watermark().map(UsageWatermark::recordId).orElse(null),
                checkpoint.finalizedThrough().orElse(null));
    }
}
