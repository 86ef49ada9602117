package tollgate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tollgate.core.model.aggregate.AggregationConflictException;
import tollgate.core.model.tier.PolicyNotFoundException;
import tollgate.core.model.usage.UsagePersistenceException;
import tollgate.spi.StorageProviderException;

/**
 * Maps metering failures on the usage, billing, and admin endpoints to
 * RFC 7807 problem bodies: bad ranges and tier input to 400, unknown tiers to
 * 404, exhausted rollup retries to 409, and storage failures to 503.
 *
 * <p>Admission denials never reach here; the metering filter answers those.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(MeteringProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapPolicyNotFoundException(PolicyNotFoundException e) {
        LOG.debugv("Unknown tier requested: {0}", e.tierValue());
        return toResponse(MeteringProblem.tierNotFound(e.tierValue()));
    }

    @ServerExceptionMapper
    public Response mapAggregationConflictException(AggregationConflictException e) {
        LOG.warnv("Rollup gave up after repeated checkpoint conflicts: {0}", e.getMessage());
        return toResponse(MeteringProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUsagePersistenceException(UsagePersistenceException e) {
        LOG.errorv(e, "Usage storage failed");
        return toResponse(MeteringProblem.storageUnavailable("Usage storage is unavailable"));
    }

    @ServerExceptionMapper
    public Response mapStorageProviderException(StorageProviderException e) {
        LOG.errorv(e, "Usage storage provider {0} failed", e.provider());
        return toResponse(MeteringProblem.storageUnavailable("Usage storage provider is unavailable"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
