package tollgate.core.port.out;

import java.util.List;

import tollgate.core.model.usage.DeadLetterEntry;

/**
 * Durable holding area for usage records that could not be persisted.
 *
 * <p>Calls are blocking and happen on recorder worker threads, never on the
 * request path.
 */
public interface DeadLetterSink {

    /**
     * Store an entry.
     *
     * @throws tollgate.core.model.usage.UsagePersistenceException if the entry cannot be stored
     */
    void write(DeadLetterEntry entry);

    /**
     * Remove and return all entries.
     */
    List<DeadLetterEntry> drain();

    /**
     * Number of entries currently held.
     */
    long count();
}
