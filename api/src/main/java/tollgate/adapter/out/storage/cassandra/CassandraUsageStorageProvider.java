package tollgate.adapter.out.storage.cassandra;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.common.StorageHealth;
import tollgate.core.port.out.DailyAggregateRepository;
import tollgate.core.port.out.StorageHealthIndicator;
import tollgate.core.port.out.UsageRecordRepository;
import tollgate.spi.StorageAdapterConfig;
import tollgate.spi.StorageProviderException;
import tollgate.spi.UsageStorageProvider;

/**
 * Cassandra usage storage provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>tollgate.storage.cassandra.contact-points - Comma-separated host:port pairs (default: localhost:9042)</li>
 *   <li>tollgate.storage.cassandra.datacenter - Local datacenter name (default: datacenter1)</li>
 *   <li>tollgate.storage.cassandra.keyspace - Keyspace name (default: tollgate)</li>
 *   <li>tollgate.storage.cassandra.username - Username for authentication (optional)</li>
 *   <li>tollgate.storage.cassandra.password - Password for authentication (optional)</li>
 *   <li>tollgate.storage.cassandra.run-migrations - Apply CQL migrations on startup (default: false)</li>
 * </ul>
 *
 * <p>Row TTLs follow {@code tollgate.usage.retention.records} and
 * {@code tollgate.usage.retention.aggregates}.
 */
public class CassandraUsageStorageProvider implements UsageStorageProvider {

    private static final Logger LOG = Logger.getLogger(CassandraUsageStorageProvider.class);
    private static final String NAME = "cassandra";
    private static final Duration DEFAULT_RECORD_RETENTION = Duration.ofDays(90);
    private static final Duration DEFAULT_AGGREGATE_RETENTION = Duration.ofDays(365);

    private CassandraSupport cassandra;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Apache Cassandra persistent usage storage";
    }

    @Override
    public int priority() {
        return 10; // Higher than memory
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("com.datastax.oss.driver.api.core.CqlSession");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public UsageRecordRepository createRecordRepository(StorageAdapterConfig config) {
        final var retention =
                config.getDuration("tollgate.usage.retention.records").orElse(DEFAULT_RECORD_RETENTION);
        return new CassandraUsageRecordRepository(support(config), retention);
    }

    @Override
    public DailyAggregateRepository createAggregateRepository(StorageAdapterConfig config) {
        final var retention =
                config.getDuration("tollgate.usage.retention.aggregates").orElse(DEFAULT_AGGREGATE_RETENTION);
        return new CassandraDailyAggregateRepository(support(config), retention);
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> {
            final var current = cassandra;
            if (current == null || current.session().isClosed()) {
                return Uni.createFrom().item(StorageHealth.unhealthy(NAME, "Session not initialized or closed"));
            }

            final var start = System.currentTimeMillis();
            return current.execute(SimpleStatement.newInstance(
                            "SELECT release_version FROM system.local"))
                    .map(rs -> StorageHealth.healthy(NAME, System.currentTimeMillis() - start))
                    .onFailure()
                    .recoverWithItem(e -> StorageHealth.unhealthy(NAME, e.getMessage()));
        });
    }

    /**
     * Both repositories share one session, created on first use.
     */
    private synchronized CassandraSupport support(StorageAdapterConfig config) {
        if (cassandra != null) {
            return cassandra;
        }

        final var keyspace = config.getOrDefault("tollgate.storage.cassandra.keyspace", "tollgate");
        final var runMigrations = config.getBoolean("tollgate.storage.cassandra.run-migrations").orElse(false);
        if (runMigrations) {
            runMigrations(config, keyspace);
        }

        cassandra = new CassandraSupport(buildSession(config, keyspace));
        LOG.infov("Connected to Cassandra keyspace {0}", keyspace);
        return cassandra;
    }

    private void runMigrations(StorageAdapterConfig config, String keyspace) {
        LOG.info("Running Cassandra migrations...");

        // Keyspace creation needs a session that is not bound to the keyspace
        try (CqlSession noKeyspaceSession = buildSession(config, null)) {
            new CassandraMigrationRunner(noKeyspaceSession, keyspace).runKeyspaceMigration();
        }

        try (CqlSession keyspaceSession = buildSession(config, keyspace)) {
            new CassandraMigrationRunner(keyspaceSession, keyspace).runMigrations();
        }

        LOG.info("Cassandra migrations completed");
    }

    private CqlSession buildSession(StorageAdapterConfig config, String keyspace) {
        var contactPoints = config.getList("tollgate.storage.cassandra.contact-points");
        if (contactPoints.isEmpty()) {
            contactPoints = List.of("localhost:9042");
        }
        final var datacenter = config.getOrDefault("tollgate.storage.cassandra.datacenter", "datacenter1");

        CqlSessionBuilder builder = CqlSession.builder().withLocalDatacenter(datacenter);

        if (keyspace != null) {
            builder.withKeyspace(keyspace);
        }

        for (var contactPoint : contactPoints) {
            final var parts = contactPoint.split(":");
            final var host = parts[0];
            final var port = parts.length > 1 ? Integer.parseInt(parts[1]) : 9042;
            builder.addContactPoint(new InetSocketAddress(host, port));
        }

        config.get("tollgate.storage.cassandra.username").ifPresent(username -> {
            final var password = config.get("tollgate.storage.cassandra.password")
                    .orElseThrow(() ->
                            new StorageProviderException(NAME, "Password required when username is specified"));
            builder.withAuthCredentials(username, password);
        });

        try {
            return builder.build();
        } catch (RuntimeException e) {
            throw new StorageProviderException(NAME, "Failed to connect", e);
        }
    }
}
