package tollgate.core.model.ratelimit;

/**
 * Result category of an admission check.
 */
public enum AdmissionOutcome {
    ALLOWED(null),
    RATE_LIMITED("rate_limit_exceeded"),
    UNAVAILABLE("rate_limiter_unavailable");

    private final String errorCode;

    AdmissionOutcome(String errorCode) {
        this.errorCode = errorCode;
    }

    /**
     * Machine-readable code returned to callers, null for {@link #ALLOWED}.
     */
    public String errorCode() {
        return errorCode;
    }
}
