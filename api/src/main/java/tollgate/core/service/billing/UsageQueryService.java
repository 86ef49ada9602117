package tollgate.core.service.billing;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import tollgate.core.config.TierConfig;
import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.billing.BillingStatement;
import tollgate.core.port.in.TierPolicyManagement;
import tollgate.core.port.in.UsageQuery;
import tollgate.core.port.out.DailyAggregateRepository;

/**
 * Read side of usage: summaries and billing amounts from daily aggregates.
 */
@ApplicationScoped
public class UsageQueryService implements UsageQuery {

    static final long MAX_RANGE_DAYS = 366;

    private static final Comparator<DailyAggregate> BY_DATE_AND_CATEGORY =
            Comparator.comparing(DailyAggregate::date).thenComparing(DailyAggregate::category);

    private final DailyAggregateRepository aggregates;
    private final TierPolicyManagement policies;
    private final BillingCalculator calculator;

    @Inject
    public UsageQueryService(
            DailyAggregateRepository aggregates, TierPolicyManagement policies, TierConfig tierConfig) {
        this(aggregates, policies, new BillingCalculator(tierConfig.currency()));
    }

    public UsageQueryService(
            DailyAggregateRepository aggregates, TierPolicyManagement policies, BillingCalculator calculator) {
        this.aggregates = aggregates;
        this.policies = policies;
        this.calculator = calculator;
    }

    @Override
    public Uni<List<DailyAggregate>> summary(String identity, LocalDate from, LocalDate to) {
        validate(identity, from, to);
        return aggregates.findByIdentity(identity, from, to).map(rows -> rows.stream()
                .sorted(BY_DATE_AND_CATEGORY)
                .toList());
    }

    @Override
    public Uni<BillingStatement> billingAmount(String identity, LocalDate from, LocalDate to, String tierValue) {
        validate(identity, from, to);
        if (tierValue == null || tierValue.isBlank()) {
            throw new IllegalArgumentException("Tier is required for billing");
        }
        final var policy = policies.current().require(tierValue);
        return aggregates
                .findByIdentity(identity, from, to)
                .map(rows -> calculator.price(identity, from, to, policy, rows));
    }

    private static void validate(String identity, LocalDate from, LocalDate to) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity is required");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both from and to are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from (%s) must not be after to (%s)".formatted(from, to));
        }
        if (ChronoUnit.DAYS.between(from, to) + 1 > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("Date range cannot exceed " + MAX_RANGE_DAYS + " days");
        }
    }
}
