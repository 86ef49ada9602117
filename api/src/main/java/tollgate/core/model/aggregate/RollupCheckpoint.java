package tollgate.core.model.aggregate;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Durable rollup progress, committed together with the aggregates it covers.
 *
 * @param watermark        last folded record, empty before the first rollup
 * @param finalizedThrough last UTC day whose aggregates are closed, empty when none
 * @param version          incremented on every commit, used for compare-and-set
 */
public record RollupCheckpoint(
        Optional<UsageWatermark> watermark, Optional<LocalDate> finalizedThrough, long version) {

    public RollupCheckpoint {
        watermark = watermark != null ? watermark : Optional.empty();
        finalizedThrough = finalizedThrough != null ? finalizedThrough : Optional.empty();
    }

    public static RollupCheckpoint initial() {
        return new RollupCheckpoint(Optional.empty(), Optional.empty(), 0);
    }

    /**
     * Next checkpoint after folding records up to {@code watermark}.
     */
    public RollupCheckpoint advance(UsageWatermark watermark) {
        final var next = this.watermark.filter(current -> !current.isBefore(watermark)).orElse(watermark);
        return new RollupCheckpoint(Optional.of(next), finalizedThrough, version + 1);
    }

    /**
     * Next checkpoint with {@code date} finalized. Finalization never moves backwards.
     */
    public RollupCheckpoint finalizeThrough(LocalDate date) {
        final var next =
                finalizedThrough.filter(current -> !current.isBefore(date)).orElse(date);
        return new RollupCheckpoint(watermark, Optional.of(next), version + 1);
    }

    public boolean isFinalized(LocalDate date) {
        return finalizedThrough.map(through -> !date.isAfter(through)).orElse(false);
    }
}
