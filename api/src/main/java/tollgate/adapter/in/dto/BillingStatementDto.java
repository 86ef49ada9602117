package tollgate.adapter.in.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import tollgate.core.model.billing.BillingLineItem;
import tollgate.core.model.billing.BillingStatement;
import tollgate.core.model.billing.UsageTotals;

/**
 * DTO for a priced usage statement.
 */
public record BillingStatementDto(
        String identity,
        String tier,
        LocalDate from,
        LocalDate to,
        UsageTotals totals,
        List<BillingLineItem> lineItems,
        BigDecimal usageCost,
        BigDecimal baseFee,
        BigDecimal total,
        String currency) {

    public static BillingStatementDto fromModel(BillingStatement statement) {
        return new BillingStatementDto(
                statement.identity(),
                statement.tier().value(),
                statement.from(),
                statement.to(),
                statement.totals(),
                statement.lineItems(),
                statement.usageCost(),
                statement.baseFee(),
                statement.total(),
                statement.currency());
    }
}
