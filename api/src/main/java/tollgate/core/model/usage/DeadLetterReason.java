package tollgate.core.model.usage;

/**
 * Why a usage record ended up in the dead-letter sink.
 */
public enum DeadLetterReason {
    PERSISTENCE_FAILED,
    QUEUE_FULL,
    SHUTDOWN_DEADLINE,
    RECORDER_STOPPED
}
