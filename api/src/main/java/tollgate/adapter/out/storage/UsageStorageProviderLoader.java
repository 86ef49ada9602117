package tollgate.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import tollgate.core.port.out.DailyAggregateRepository;
import tollgate.core.port.out.StorageHealthIndicator;
import tollgate.core.port.out.UsageRecordRepository;
import tollgate.spi.StorageAdapterConfig;
import tollgate.spi.StorageProviderException;
import tollgate.spi.UsageStorageProvider;

/**
 * Discovers and loads usage storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If tollgate.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class UsageStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(UsageStorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    private UsageStorageProvider provider;

    @Inject
    public UsageStorageProviderLoader(
            @ConfigProperty(name = "tollgate.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public UsageRecordRepository recordRepository() {
        final var selected = getProvider();
        LOG.infof("Creating usage record repository from provider: %s (%s)", selected.name(),
                selected.description());
        return selected.createRecordRepository(config);
    }

    @Produces
    @ApplicationScoped
    public DailyAggregateRepository aggregateRepository() {
        final var selected = getProvider();
        LOG.infof("Creating daily aggregate repository from provider: %s (%s)", selected.name(),
                selected.description());
        return selected.createAggregateRepository(config);
    }

    @Produces
    @Singleton
    public List<StorageHealthIndicator> healthIndicators() {
        final var indicators = new ArrayList<StorageHealthIndicator>();
        getProvider().createHealthIndicator(config).ifPresent(indicators::add);
        return indicators;
    }

    private synchronized UsageStorageProvider getProvider() {
        if (provider != null) {
            return provider;
        }

        final var providers = new ArrayList<UsageStorageProvider>();
        ServiceLoader.load(UsageStorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "loader",
                    "No usage storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d usage storage provider(s): %s",
                providers.size(),
                providers.stream().map(UsageStorageProvider::name).toList());

        provider = selectProvider(providers, configuredProvider.orElse(null));
        return provider;
    }

    static UsageStorageProvider selectProvider(List<UsageStorageProvider> providers, String configured) {
        // Explicit configuration takes precedence
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException(
                            configured,
                            "Configured usage storage provider not found. Available: "
                                    + providers.stream().map(UsageStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(UsageStorageProvider::isAvailable)
                .max(Comparator.comparingInt(UsageStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("loader", "No available usage storage providers"));
    }
}
