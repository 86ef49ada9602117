package tollgate.adapter.in.dto;

import java.time.LocalDate;
import java.util.List;

import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.billing.UsageTotals;

/**
 * DTO for an identity's daily usage over a date range.
 */
public record UsageSummaryDto(
        String identity, LocalDate from, LocalDate to, List<DailyAggregate> days, UsageTotals totals) {

    public static UsageSummaryDto of(String identity, LocalDate from, LocalDate to, List<DailyAggregate> days) {
        return new UsageSummaryDto(identity, from, to, days, UsageTotals.of(days));
    }
}
