package tollgate.adapter.in.rest;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import tollgate.adapter.in.dto.BillingStatementDto;
import tollgate.adapter.in.dto.UsageSummaryDto;
import tollgate.core.port.in.UsageQuery;

/**
 * REST resource for usage summaries and billing amounts.
 *
 * <p>Dates are UTC calendar days, inclusive on both ends. When omitted, the
 * range runs from the first day of the current month through today. Ranges
 * longer than 366 days are rejected.
 *
 * <p>Consumed by the external billing component, which turns statements into invoices.
 */
@Path("/usage")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class UsageResource {

    private final UsageQuery usageQuery;
    private final Clock clock;

    public UsageResource(UsageQuery usageQuery, Clock clock) {
        this.usageQuery = usageQuery;
        this.clock = clock;
    }

    @GET
    @Path("/{identity}/summary")
    public Uni<UsageSummaryDto> summary(
            @PathParam("identity") String identity, @QueryParam("from") String from, @QueryParam("to") String to) {
        final var today = today();
        final var start = QueryDates.parse(from, "from", today.withDayOfMonth(1));
        final var end = QueryDates.parse(to, "to", today);
        return usageQuery
                .summary(identity, start, end)
                .map(days -> UsageSummaryDto.of(identity, start, end, days));
    }

    @GET
    @Path("/{identity}/billing")
    public Uni<BillingStatementDto> billing(
            @PathParam("identity") String identity,
            @QueryParam("from") String from,
            @QueryParam("to") String to,
            @QueryParam("tier") String tier) {
        final var today = today();
        final var start = QueryDates.parse(from, "from", today.withDayOfMonth(1));
        final var end = QueryDates.parse(to, "to", today);
        return usageQuery.billingAmount(identity, start, end, tier).map(BillingStatementDto::fromModel);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
