package tollgate.adapter.in.rest;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.adapter.in.dto.LateUsageRecordDto;
import tollgate.adapter.in.dto.RollupResultDto;
import tollgate.core.port.in.UsageAggregation;
import tollgate.core.port.in.UsageRecording;

/**
 * REST resource for operating the usage pipeline.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Running a rollup on demand</li>
 *   <li>Finalizing days for billing</li>
 *   <li>Listing late records held for reconciliation</li>
 *   <li>Replaying dead-lettered usage records</li>
 * </ul>
 */
@Path("/admin/usage")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AdminUsageResource {

    private static final Logger LOG = Logger.getLogger(AdminUsageResource.class);

    private final UsageAggregation aggregation;
    private final UsageRecording recording;
    private final Clock clock;

    public AdminUsageResource(UsageAggregation aggregation, UsageRecording recording, Clock clock) {
        this.aggregation = aggregation;
        this.recording = recording;
        this.clock = clock;
    }

    @POST
    @Path("/rollup")
    public Uni<RollupResultDto> rollup() {
        return aggregation.rollup().map(RollupResultDto::fromModel);
    }

    @GET
    @Path("/checkpoint")
    public Uni<RollupResultDto> checkpoint() {
        return aggregation.checkpoint().map(RollupResultDto::fromCheckpoint);
    }

    /**
     * Finalize all days up to and including {@code through}. Finalizing today or a later day is rejected.
     */
    @POST
    @Path("/finalize")
    public Uni<RollupResultDto> finalizeThrough(@QueryParam("through") String through) {
        final var date = QueryDates.require(through, "through");
        if (!date.isBefore(today())) {
            throw new IllegalArgumentException("Only past days can be finalized, got " + date);
        }
        LOG.infov("Finalizing usage through {0} on request", date);
        return aggregation.finalizeThrough(date).map(RollupResultDto::fromCheckpoint);
    }

    @GET
    @Path("/late-records")
    public Uni<List<LateUsageRecordDto>> lateRecords(@QueryParam("from") String from, @QueryParam("to") String to) {
        final var today = today();
        final var start = QueryDates.parse(from, "from", today.withDayOfMonth(1));
        final var end = QueryDates.parse(to, "to", today);
        return aggregation
                .lateRecords(start, end)
                .map(records -> records.stream().map(LateUsageRecordDto::fromModel).toList());
    }

    /**
     * Move dead-lettered records back into the usage queue.
     */
    @POST
    @Path("/dead-letters/replay")
    public Map<String, Object> replayDeadLetters() {
        final var requeued = recording.replayDeadLetters();
        return Map.of("requeued", requeued, "pipeline", recording.status());
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
