package tollgate.core.model.usage;

/**
 * Point-in-time view of the asynchronous usage pipeline.
 *
 * @param accepting     false once shutdown has started
 * @param queueDepth    records waiting to be written
 * @param queueCapacity configured queue bound
 * @param inFlight      records currently being written
 * @param persisted     records written since startup
 * @param deadLettered  records dead-lettered since startup
 * @param pendingDeadLetters entries currently held by the dead-letter sink
 */
public record UsagePipelineStatus(
        boolean accepting,
        int queueDepth,
        int queueCapacity,
        int inFlight,
        long persisted,
        long deadLettered,
        long pendingDeadLetters) {}
