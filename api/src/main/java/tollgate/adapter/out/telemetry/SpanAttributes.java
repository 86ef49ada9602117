package tollgate.adapter.out.telemetry;

/**
 * Constants for span attributes set on metered requests.
 *
 * <p>Attributes are added to the current server span, so they show up next to
 * the standard HTTP attributes of the request.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/">OpenTelemetry Semantic Conventions</a>
 */
public final class SpanAttributes {

    private SpanAttributes() {}

    // -------------------------------------------------------------------------
    // Caller
    // -------------------------------------------------------------------------

    /** Identity the request was metered under. */
    public static final String IDENTITY = "tollgate.identity";

    /** Tier the request was evaluated under. */
    public static final String TIER = "tollgate.tier";

    /** True when an unknown tier was replaced by the most restrictive one. */
    public static final String TIER_FALLBACK = "tollgate.tier.fallback";

    /** Request category used for cost weights and aggregates. */
    public static final String CATEGORY = "tollgate.category";

    // -------------------------------------------------------------------------
    // Admission
    // -------------------------------------------------------------------------

    /** Admission outcome: allowed, rate_limited or unavailable. */
    public static final String ADMISSION_OUTCOME = "tollgate.admission.outcome";

    /** True when the counter store was unavailable for the decision. */
    public static final String ADMISSION_DEGRADED = "tollgate.admission.degraded";

    /** Window that determined the limit headers. */
    public static final String RATE_LIMIT_WINDOW = "tollgate.rate_limit.window";

    /** Limit of the binding window. */
    public static final String RATE_LIMIT_LIMIT = "tollgate.rate_limit.limit";

    /** Requests left in the binding window. */
    public static final String RATE_LIMIT_REMAINING = "tollgate.rate_limit.remaining";

    /** Seconds the caller was told to wait. */
    public static final String RATE_LIMIT_RETRY_AFTER = "tollgate.rate_limit.retry_after";

    // -------------------------------------------------------------------------
    // Usage
    // -------------------------------------------------------------------------

    /** Usage id correlating the decision with the usage record. */
    public static final String USAGE_ID = "tollgate.usage.id";

    /** Compute units charged for the request. */
    public static final String USAGE_COMPUTE_UNITS = "tollgate.usage.compute_units";
}
