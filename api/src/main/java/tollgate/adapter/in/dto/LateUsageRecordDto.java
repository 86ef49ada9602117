package tollgate.adapter.in.dto;

import java.time.Instant;
import java.time.LocalDate;

import tollgate.core.model.aggregate.LateUsageRecord;

/**
 * DTO for a usage record held back because its day was already finalized.
 */
public record LateUsageRecordDto(
        String recordId,
        String identity,
        String tier,
        String category,
        LocalDate usageDate,
        Instant timestamp,
        Instant recordedAt,
        long tokensIn,
        long tokensOut,
        double computeUnits,
        long storageBytes,
        LocalDate finalizedThrough,
        Instant detectedAt) {

    public static LateUsageRecordDto fromModel(LateUsageRecord late) {
        final var record = late.record();
        return new LateUsageRecordDto(
                record.recordId(),
                record.identity(),
                record.tier().value(),
                record.category(),
                record.usageDate(),
                record.timestamp(),
                record.recordedAt(),
                record.tokensIn(),
                record.tokensOut(),
                record.computeUnits(),
                record.storageBytes(),
                late.finalizedThrough(),
                late.detectedAt());
    }
}
