package tollgate.core.model.ratelimit;

/**
 * What the limiter does when the shared counter store cannot answer in time.
 */
public enum FailurePolicy {
    /** Admit the request and mark the decision degraded. */
    FAIL_OPEN,
    /** Refuse the request with a dedicated "limiter unavailable" outcome. */
    FAIL_CLOSED
}
