package tollgate.core.port.in;

import java.time.LocalDate;
import java.util.List;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.billing.BillingStatement;

/**
 * Port for usage summaries and billing amounts.
 */
public interface UsageQuery {

    /**
     * Daily aggregates for an identity, ordered by date then category.
     *
     * @param identity the identity
     * @param from     first day, inclusive
     * @param to       last day, inclusive
     * @return Uni with the aggregates
     * @throws IllegalArgumentException if the range is empty or too long
     */
    Uni<List<DailyAggregate>> summary(String identity, LocalDate from, LocalDate to);

    /**
     * Price an identity's usage over a range.
     *
     * @param identity  the identity
     * @param from      first day, inclusive
     * @param to        last day, inclusive
     * @param tierValue tier whose prices apply
     * @return Uni with the statement
     * @throws IllegalArgumentException if the range is invalid
     * @throws tollgate.core.model.tier.PolicyNotFoundException if the tier has no policy
     */
    Uni<BillingStatement> billingAmount(String identity, LocalDate from, LocalDate to, String tierValue);
}
