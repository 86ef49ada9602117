package tollgate.adapter.out.storage.cassandra;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CassandraMigrationRunner")
class CassandraMigrationRunnerTest {

    private CqlSession session;
    private CassandraMigrationRunner runner;

    @BeforeEach
    void setUp() {
        session = mock(CqlSession.class);
        runner = new CassandraMigrationRunner(session, "metering");
    }

    @Test
    @DisplayName("splits statements and substitutes the keyspace")
    void splitsStatements() {
        var statements = runner.statements(
                """
                -- usage tables
                CREATE TABLE ${keyspace}.a (id text PRIMARY KEY);

                CREATE TABLE ${keyspace}.b (id text PRIMARY KEY);
                """);

        assertEquals(2, statements.size());
        assertEquals("CREATE TABLE metering.a (id text PRIMARY KEY)", statements.get(0));
        assertTrue(statements.get(1).startsWith("CREATE TABLE metering.b"));
    }

    @Test
    @DisplayName("skips USE statements and comments")
    void skipsUseStatements() {
        var statements = runner.statements(
                """
                USE ${keyspace};
                -- nothing else here;
                """);

        assertTrue(statements.isEmpty());
    }

    @Test
    @DisplayName("creates the configured keyspace")
    void keyspaceMigration() {
        runner.runKeyspaceMigration();

        verify(session)
                .execute(argThat(
                        (String cql) -> cql.startsWith("CREATE KEYSPACE IF NOT EXISTS metering")));
    }

    @Test
    @DisplayName("checksum ignores comments and indentation")
    void checksumIgnoresFormatting() {
        var original = "CREATE TABLE a (id text PRIMARY KEY);";
        var reformatted = "-- usage\n    CREATE TABLE a (id text PRIMARY KEY);\n\n";

        assertEquals(CassandraMigrationRunner.checksum(original), CassandraMigrationRunner.checksum(reformatted));
        assertNotEquals(
                CassandraMigrationRunner.checksum(original),
                CassandraMigrationRunner.checksum("CREATE TABLE b (id text PRIMARY KEY);"));
    }

    @Test
    @DisplayName("applies the usage tables when nothing has been applied")
    void appliesPendingMigrations() {
        appliedRows(List.of());

        assertEquals(1, runner.runMigrations());

        verify(session)
                .execute(argThat((String cql) -> cql.startsWith("CREATE TABLE IF NOT EXISTS daily_aggregates")));
        verify(session)
                .execute(
                        argThat((String cql) -> cql.contains("INSERT INTO metering.schema_migrations")),
                        any(),
                        any(),
                        any(),
                        any());
    }

    @Test
    @DisplayName("skips a migration already applied")
    void skipsAppliedMigrations() throws IOException {
        var row = mock(Row.class);
        when(row.getInt("version")).thenReturn(2);
        when(row.getLong("checksum")).thenReturn(CassandraMigrationRunner.checksum(resource()));
        appliedRows(List.of(row));

        assertEquals(0, runner.runMigrations());

        verify(session, never())
                .execute(argThat((String cql) -> cql.startsWith("CREATE TABLE IF NOT EXISTS daily_aggregates")));
    }

    private void appliedRows(List<Row> rows) {
        var rs = mock(ResultSet.class);
        when(rs.iterator()).thenAnswer(invocation -> rows.iterator());
        when(session.execute(argThat((String cql) -> cql.startsWith("SELECT version, checksum"))))
                .thenReturn(rs);
    }

    private String resource() throws IOException {
        try (InputStream is =
                getClass().getClassLoader().getResourceAsStream("db/cassandra/V2__create_usage_tables.cql")) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
