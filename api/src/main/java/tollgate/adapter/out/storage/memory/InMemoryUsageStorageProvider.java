package tollgate.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.common.StorageHealth;
import tollgate.core.port.out.DailyAggregateRepository;
import tollgate.core.port.out.StorageHealthIndicator;
import tollgate.core.port.out.UsageRecordRepository;
import tollgate.spi.StorageAdapterConfig;
import tollgate.spi.UsageStorageProvider;

/**
 * Default in-memory usage storage provider.
 *
 * <p>Data is NOT persisted across restarts. This provider exists as a
 * fallback for development/testing or single-instance deployments.
 */
public class InMemoryUsageStorageProvider implements UsageStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory usage storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority - only used if nothing else available
    }

    @Override
    public UsageRecordRepository createRecordRepository(StorageAdapterConfig config) {
        return new InMemoryUsageRecordRepository();
    }

    @Override
    public DailyAggregateRepository createAggregateRepository(StorageAdapterConfig config) {
        return new InMemoryDailyAggregateRepository(Clock.systemUTC());
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> Uni.createFrom().item(StorageHealth.healthy("memory", 0)));
    }
}
