package tollgate.system.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.opentelemetry.api.trace.Span;
import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;

import tollgate.adapter.in.problem.MeteringProblem;
import tollgate.adapter.out.telemetry.SpanAttributes;
import tollgate.core.config.RateLimitingConfig;
import tollgate.core.config.TelemetryConfig;
import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.ratelimit.AdmissionOutcome;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.window.WindowKind;
import tollgate.core.port.in.AdmissionControl;

/**
 * Runs the tiered rate limiter and rejects requests over their limits.
 *
 * <p>Rejections are answered with 429 (limit exceeded) or 503 (limiter
 * unavailable under fail-closed), both as problem details with
 * {@code Retry-After}. Every metered response, admitted or not, carries the
 * limit headers and the usage id of its decision.
 */
@ApplicationScoped
public class AdmissionStage implements MeteringStage {

    public static final int ORDER = 100;

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";
    static final String HEADER_QUOTA_LIMIT = "X-Quota-Limit";
    static final String HEADER_QUOTA_REMAINING = "X-Quota-Remaining";
    static final String HEADER_QUOTA_RESET = "X-Quota-Reset";
    static final String HEADER_USAGE_ID = "X-Usage-Id";
    static final String HEADER_DEGRADED = "X-RateLimit-Degraded";
    static final String UNLIMITED = "unlimited";

    private static final String PROBLEM_JSON = "application/problem+json";

    private final AdmissionControl admission;
    private final RateLimitingConfig config;
    private final TelemetryConfig telemetry;

    @Inject
    public AdmissionStage(AdmissionControl admission, RateLimitingConfig config, TelemetryConfig telemetry) {
        this.admission = admission;
        this.config = config;
        this.telemetry = telemetry;
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public Uni<StageResult> onRequest(MeteringContext context) {
        return admission.check(context.identity(), context.tierValue()).map(decision -> {
            context.decision(decision);
            setSpanAttributes(context, decision);

            return switch (decision.outcome()) {
                case ALLOWED -> StageResult.proceed();
                case RATE_LIMITED -> StageResult.halt(reject(MeteringProblem.rateLimited(decision), decision));
                case UNAVAILABLE -> StageResult.halt(reject(MeteringProblem.limiterUnavailable(decision), decision));
            };
        });
    }

    @Override
    public void onResponse(MeteringContext context) {
        context.decision().ifPresent(decision -> {
            final var headers = context.responseHeaders();
            headersFor(decision).forEach(headers::putSingle);
        });
    }

    /**
     * Headers describing a decision, in a stable order.
     */
    Map<String, String> headersFor(AdmissionDecision decision) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put(HEADER_USAGE_ID, decision.usageId());
        if (decision.degraded()) {
            headers.put(HEADER_DEGRADED, "true");
        }
        if (!config.includeHeaders() || decision.windows().isEmpty()) {
            return headers;
        }

        headers.put(HEADER_LIMIT, render(decision.limit()));
        headers.put(HEADER_REMAINING, render(decision.remaining()));
        headers.put(HEADER_RESET, String.valueOf(decision.resetSeconds()));

        decision.window(WindowKind.DAY).ifPresent(day -> {
            headers.put(HEADER_QUOTA_LIMIT, render(day.limit()));
            headers.put(HEADER_QUOTA_REMAINING, render(day.remaining()));
            headers.put(HEADER_QUOTA_RESET, String.valueOf(day.resetSeconds()));
        });
        return headers;
    }

    private Response reject(HttpProblem problem, AdmissionDecision decision) {
        final var builder = Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        headersFor(decision).forEach(builder::header);
        return builder.build();
    }

    private void setSpanAttributes(MeteringContext context, AdmissionDecision decision) {
        if (!telemetry.enabled()) {
            return;
        }
        final var span = Span.current();
        span.setAttribute(SpanAttributes.IDENTITY, decision.identity());
        span.setAttribute(SpanAttributes.TIER, decision.tier().value());
        span.setAttribute(SpanAttributes.TIER_FALLBACK, decision.policyFallback());
        span.setAttribute(SpanAttributes.CATEGORY, context.category());
        span.setAttribute(SpanAttributes.ADMISSION_OUTCOME, outcomeName(decision.outcome()));
        span.setAttribute(SpanAttributes.ADMISSION_DEGRADED, decision.degraded());
        span.setAttribute(SpanAttributes.USAGE_ID, decision.usageId());
        if (!decision.windows().isEmpty()) {
            span.setAttribute(SpanAttributes.RATE_LIMIT_WINDOW, decision.bindingWindow().value());
            span.setAttribute(SpanAttributes.RATE_LIMIT_LIMIT, decision.limit());
            span.setAttribute(SpanAttributes.RATE_LIMIT_REMAINING, decision.remaining());
        }
        if (!decision.allowed()) {
            span.setAttribute(SpanAttributes.RATE_LIMIT_RETRY_AFTER, decision.retryAfterSeconds());
        }
    }

    private static String outcomeName(AdmissionOutcome outcome) {
        return switch (outcome) {
            case ALLOWED -> "allowed";
            case RATE_LIMITED -> "rate_limited";
            case UNAVAILABLE -> "unavailable";
        };
    }

    private static String render(long value) {
        return value == TierPolicy.UNLIMITED ? UNLIMITED : String.valueOf(value);
    }
}
