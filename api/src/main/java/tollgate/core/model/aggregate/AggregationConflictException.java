package tollgate.core.model.aggregate;

/**
 * The rollup checkpoint changed between read and commit.
 */
public class AggregationConflictException extends RuntimeException {

    private final long expectedVersion;

    public AggregationConflictException(long expectedVersion, long actualVersion) {
        super("Rollup checkpoint moved: expected version %d, found %d".formatted(expectedVersion, actualVersion));
        this.expectedVersion = expectedVersion;
    }

    public long expectedVersion() {
        return expectedVersion;
    }
}
