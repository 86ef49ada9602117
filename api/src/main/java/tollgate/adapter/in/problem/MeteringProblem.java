package tollgate.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.ratelimit.AdmissionOutcome;

/**
 * RFC 7807 Problem Details factory for metering errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses across the
 * metered API and the admin endpoints.
 */
public final class MeteringProblem {

    private MeteringProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Admission Errors ==========

    /**
     * Create a 429 Too Many Requests problem for a rejected admission.
     *
     * @param decision the rejecting decision
     * @return the problem
     */
    public static HttpProblem rateLimited(AdmissionDecision decision) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail("Rate limit exceeded for the %s window of tier %s"
                        .formatted(decision.bindingWindow().value(), decision.tier().value()))
                .with("code", AdmissionOutcome.RATE_LIMITED.errorCode())
                .with("window", decision.bindingWindow().value())
                .with("limit", decision.limit())
                .with("retryAfter", decision.retryAfterSeconds())
                .with("usageId", decision.usageId())
                .build();
    }

    /**
     * Create a 503 Service Unavailable problem for a fail-closed admission.
     *
     * @param decision the refusing decision
     * @return the problem
     */
    public static HttpProblem limiterUnavailable(AdmissionDecision decision) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail("Rate limiter is temporarily unavailable")
                .with("code", AdmissionOutcome.UNAVAILABLE.errorCode())
                .with("retryAfter", decision.retryAfterSeconds())
                .with("usageId", decision.usageId())
                .build();
    }

    // ========== Not Found Errors ==========

    public static HttpProblem tierNotFound(String tierValue) {
        return HttpProblem.builder()
                .withTitle("Tier Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No tier policy for tier '%s'".formatted(tierValue))
                .build();
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Conflict Errors ==========

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem storageUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Storage Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }
}
