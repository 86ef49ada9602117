package tollgate.spi;

import java.util.Optional;

import tollgate.core.port.out.DailyAggregateRepository;
import tollgate.core.port.out.StorageHealthIndicator;
import tollgate.core.port.out.UsageRecordRepository;

/**
 * Service Provider Interface for usage storage backends.
 *
 * <p>One provider supplies both the raw record store and the aggregate store,
 * so a rollup commit and the records it reads live in the same backend.
 * Implementations are discovered via java.util.ServiceLoader at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/tollgate.spi.UsageStorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: tollgate.storage.provider=your-provider-name</li>
 * </ol>
 */
public interface UsageStorageProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: tollgate.storage.provider={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " usage storage provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Built-in providers use:
     * <ul>
     *   <li>memory: 0 (fallback default)</li>
     *   <li>cassandra: 10</li>
     * </ul>
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available (dependencies present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the raw usage record store. Called once at startup.
     *
     * @param config Access to configuration properties
     * @return Repository implementation
     * @throws StorageProviderException if initialization fails
     */
    UsageRecordRepository createRecordRepository(StorageAdapterConfig config);

    /**
     * Create the daily aggregate store. Called once at startup.
     *
     * @param config Access to configuration properties
     * @return Repository implementation
     * @throws StorageProviderException if initialization fails
     */
    DailyAggregateRepository createAggregateRepository(StorageAdapterConfig config);

    /**
     * Optionally provide a health indicator for this storage backend.
     *
     * @param config Access to configuration properties
     * @return Health indicator, or empty if not supported
     */
    default Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.empty();
    }
}
