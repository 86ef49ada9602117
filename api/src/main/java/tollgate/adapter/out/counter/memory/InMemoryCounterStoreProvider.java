package tollgate.adapter.out.counter.memory;

import java.time.Clock;

import tollgate.core.port.out.CounterStore;
import tollgate.spi.CounterStoreProvider;

/**
 * In-memory counter store provider.
 *
 * <p>Always available with the lowest priority, so it is selected when no
 * shared store is configured.
 */
public final class InMemoryCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final Clock clock;

    /**
     * Default constructor for ServiceLoader.
     */
    public InMemoryCounterStoreProvider() {
        this(Clock.systemUTC());
    }

    public InMemoryCounterStoreProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CounterStore createCounterStore() {
        return new InMemoryCounterStore(clock);
    }

    public static InMemoryCounterStoreProvider configured(Clock clock) {
        return new InMemoryCounterStoreProvider(clock);
    }
}
