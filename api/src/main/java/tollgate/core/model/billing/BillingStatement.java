package tollgate.core.model.billing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import tollgate.core.model.tier.Tier;

/**
 * Priced usage for an identity over an inclusive date range.
 *
 * @param identity  the identity
 * @param tier      tier whose prices were applied
 * @param from      first day, inclusive
 * @param to        last day, inclusive
 * @param totals    billed quantities
 * @param lineItems one entry per priced quantity
 * @param usageCost sum of line item amounts
 * @param baseFee   flat fee, charged once per statement
 * @param total     base fee plus usage cost
 * @param currency  ISO currency code
 */
public record BillingStatement(
        String identity,
        Tier tier,
        LocalDate from,
        LocalDate to,
        UsageTotals totals,
        List<BillingLineItem> lineItems,
        BigDecimal usageCost,
        BigDecimal baseFee,
        BigDecimal total,
        String currency) {

    public BillingStatement {
        lineItems = lineItems != null ? List.copyOf(lineItems) : List.of();
    }
}
