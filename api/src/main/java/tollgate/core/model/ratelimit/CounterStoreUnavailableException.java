package tollgate.core.model.ratelimit;

/**
 * The shared counter store failed or did not answer within the configured timeout.
 */
public class CounterStoreUnavailableException extends RuntimeException {

    public CounterStoreUnavailableException(String message) {
        super(message);
    }

    public CounterStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
