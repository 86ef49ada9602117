package tollgate.adapter.out.storage.cassandra;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.CRC32;

import com.datastax.oss.driver.api.core.CqlSession;
import org.jboss.logging.Logger;

import tollgate.spi.StorageProviderException;

/**
 * Runs CQL migrations when the Cassandra provider starts.
 *
 * <p>Migration files are read from the classpath at db/cassandra/ and must follow
 * the naming convention: V{version}__{description}.cql (e.g., V1__create_keyspace.cql).
 * {@code ${keyspace}} in a migration is replaced with the configured keyspace.
 *
 * <p>Each applied migration is recorded in {@code schema_migrations} with a
 * checksum of its statements.
 */
public class CassandraMigrationRunner {

    private static final Logger LOG = Logger.getLogger(CassandraMigrationRunner.class);
    private static final String MIGRATIONS_PATH = "db/cassandra/";
    private static final String KEYSPACE_MIGRATION = "V1__create_keyspace.cql";

    // Classpath resources cannot be listed portably
    private static final List<String> MIGRATIONS = List.of(KEYSPACE_MIGRATION, "V2__create_usage_tables.cql");

    private final CqlSession session;
    private final String keyspace;

    public CassandraMigrationRunner(CqlSession session, String keyspace) {
        this.session = session;
        this.keyspace = keyspace;
    }

    /**
     * Creates the keyspace. Runs on a session not bound to any keyspace.
     */
    public void runKeyspaceMigration() {
        LOG.infov("Ensuring keyspace {0} exists...", keyspace);
        for (var statement : statements(readMigrationFile(KEYSPACE_MIGRATION))) {
            session.execute(statement);
        }
    }

    /**
     * Applies pending usage-table migrations through a session bound to the
     * keyspace. A migration whose file changed after it was applied is logged
     * and left alone.
     *
     * @return the number of migrations applied
     */
    public int runMigrations() {
        ensureMigrationTableExists();
        final var applied = appliedChecksums();

        var count = 0;
        for (var filename : MIGRATIONS) {
            final var version = versionOf(filename);
            if (version == 1) {
                continue;
            }
            final var content = readMigrationFile(filename);
            final var checksum = checksum(content);
            if (applied.containsKey(version)) {
                final var recorded = applied.get(version);
                if (recorded != null && recorded != checksum) {
                    LOG.warnv("Migration {0} changed after it was applied to {1}; not re-running", filename, keyspace);
                }
                continue;
            }
            applyMigration(version, filename, content, checksum);
            count++;
        }

        if (count > 0) {
            LOG.infov("Applied {0} usage storage migration(s) to {1}", count, keyspace);
        } else {
            LOG.debugv("Usage storage schema in {0} is current", keyspace);
        }
        return count;
    }

    /**
     * Executable statements of a migration: comment lines and {@code USE}
     * dropped, {@code ${keyspace}} substituted.
     */
    List<String> statements(String content) {
        final var withoutComments = content.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"))
                .replace("${keyspace}", keyspace);

        final var statements = new ArrayList<String>();
        for (var statement : withoutComments.split(";")) {
            final var trimmed = statement.trim();
            if (!trimmed.isEmpty() && !trimmed.toUpperCase(Locale.ROOT).startsWith("USE ")) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    /**
     * CRC32 over the statements, so whitespace and comment edits do not count
     * as a change.
     */
    static long checksum(String content) {
        final var crc = new CRC32();
        content.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("--"))
                .forEach(line -> crc.update(line.getBytes(StandardCharsets.UTF_8)));
        return crc.getValue();
    }

    private void ensureMigrationTableExists() {
        session.execute(
                """
                CREATE TABLE IF NOT EXISTS %s.schema_migrations (
                    version int PRIMARY KEY,
                    script_name text,
                    checksum bigint,
                    applied_at timestamp
                )
                """
                        .formatted(keyspace));
    }

    private Map<Integer, Long> appliedChecksums() {
        final var applied = new HashMap<Integer, Long>();
        for (var row : session.execute("SELECT version, checksum FROM %s.schema_migrations".formatted(keyspace))) {
            applied.put(row.getInt("version"), row.isNull("checksum") ? null : row.getLong("checksum"));
        }
        return applied;
    }

    private void applyMigration(int version, String filename, String content, long checksum) {
        LOG.infov("Applying usage storage migration V{0}: {1}", version, filename);

        for (var statement : statements(content)) {
            try {
                session.execute(statement);
            } catch (RuntimeException e) {
                LOG.errorv("Statement in {0} failed: {1}", filename, e.getMessage());
                throw new StorageProviderException("cassandra", "Migration failed: " + filename, e);
            }
        }

        session.execute(
                """
                INSERT INTO %s.schema_migrations (version, script_name, checksum, applied_at)
                VALUES (?, ?, ?, ?)
                """
                        .formatted(keyspace),
                version,
                filename,
                checksum,
                Instant.now());
    }

    private String readMigrationFile(String filename) {
        final var path = MIGRATIONS_PATH + filename;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new StorageProviderException("cassandra", "Migration file not found: " + path);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageProviderException("cassandra", "Could not read migration " + path, e);
        }
    }

    private static int versionOf(String filename) {
        return Integer.parseInt(filename.substring(1, filename.indexOf("__")));
    }
}
