package tollgate.core.model.usage;

/**
 * A usage record or dead-letter entry could not be written.
 */
public class UsagePersistenceException extends RuntimeException {

    public UsagePersistenceException(String message) {
        super(message);
    }

    public UsagePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
