package tollgate.adapter.out.deadletter;

import java.util.ArrayList;
import java.util.List;

import tollgate.core.model.usage.DeadLetterEntry;
import tollgate.core.port.out.DeadLetterSink;

/**
 * Dead-letter sink held in memory. Entries are lost on restart.
 */
public class InMemoryDeadLetterSink implements DeadLetterSink {

    private final List<DeadLetterEntry> entries = new ArrayList<>();

    @Override
    public synchronized void write(DeadLetterEntry entry) {
        entries.add(entry);
    }

    @Override
    public synchronized List<DeadLetterEntry> drain() {
        final var drained = List.copyOf(entries);
        entries.clear();
        return drained;
    }

    @Override
    public synchronized long count() {
        return entries.size();
    }
}
