package tollgate.core.service.billing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.billing.BillingLineItem;
import tollgate.core.model.billing.BillingStatement;
import tollgate.core.model.billing.UsageTotals;
import tollgate.core.model.tier.TierPolicy;

/**
 * Prices aggregated usage against a tier policy.
 *
 * <p>Each line item is rounded half-up to cents on its own, the usage cost is
 * the sum of the rounded items, and the base fee is added once per statement.
 */
public final class BillingCalculator {

    private static final int CENTS = 2;

    private final String currency;

    public BillingCalculator(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        this.currency = currency;
    }

    public BillingStatement price(
            String identity, LocalDate from, LocalDate to, TierPolicy policy, Collection<DailyAggregate> aggregates) {
        final var totals = UsageTotals.of(aggregates);
        final var lineItems = List.of(
                item("requests", BigDecimal.valueOf(totals.requests()), policy.ratePerRequest()),
                item("compute_units", totals.computeUnits(), policy.ratePerComputeUnit()),
                item("tokens", BigDecimal.valueOf(totals.tokens()), policy.ratePerToken()),
                item("storage_bytes", BigDecimal.valueOf(totals.storageBytes()), policy.ratePerByte()));

        final var usageCost = lineItems.stream()
                .map(BillingLineItem::amount)
                .reduce(BigDecimal.ZERO.setScale(CENTS), BigDecimal::add);
        final var baseFee = policy.baseFee().setScale(CENTS, RoundingMode.HALF_UP);

        return new BillingStatement(
                identity,
                policy.tier(),
                from,
                to,
                totals,
                lineItems,
                usageCost,
                baseFee,
                baseFee.add(usageCost),
                currency);
    }

    private static BillingLineItem item(String name, BigDecimal quantity, BigDecimal rate) {
        final var amount = quantity.multiply(rate).setScale(CENTS, RoundingMode.HALF_UP);
        return new BillingLineItem(name, quantity, rate, amount);
    }
}
