package tollgate.adapter.out.storage.cassandra;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.usage.UsageRecord;

@DisplayName("CassandraUsageRecordRepository")
class CassandraUsageRecordRepositoryTest {

    private static final Instant STAMP = Instant.parse("2026-03-14T12:00:30.751734435Z");
    private static final Instant STORED_STAMP = Instant.parse("2026-03-14T12:00:30.751Z");

    private CqlSession session;
    private final Map<String, BoundStatement> bound = new HashMap<>();
    private final Map<BoundStatement, AsyncResultSet> results = new HashMap<>();
    private CassandraUsageRecordRepository repository;

    @BeforeEach
    void setUp() {
        session = mock(CqlSession.class);
        when(session.prepare(anyString())).thenAnswer(invocation -> prepared(invocation.getArgument(0)));
        when(session.executeAsync(any(Statement.class)))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(
                        results.computeIfAbsent(invocation.getArgument(0), ignored -> mock(AsyncResultSet.class))));
        repository = new CassandraUsageRecordRepository(new CassandraSupport(session), Duration.ofDays(90));
    }

    private PreparedStatement prepared(String cql) {
        final var statement = mock(BoundStatement.class);
        bound.put(cql.trim().split("\\s+")[0] + ":" + table(cql), statement);
        return mock(
                PreparedStatement.class,
                withSettings().defaultAnswer(invocation ->
                        "bind".equals(invocation.getMethod().getName()) ? statement : null));
    }

    private static String table(String cql) {
        for (var table : new String[] {"usage_records_by_id", "usage_records_by_hour", "usage_record_hours"}) {
            if (cql.contains(table + " ")) {
                return table;
            }
        }
        return "";
    }

    private void claimResult(boolean applied, Instant existingStamp) {
        var rs = mock(AsyncResultSet.class);
        when(rs.wasApplied()).thenReturn(applied);
        if (existingStamp != null) {
            var row = mock(Row.class);
            when(row.getInstant("recorded_at")).thenReturn(existingStamp);
            when(rs.one()).thenReturn(row);
        }
        results.put(bound.get("INSERT:usage_records_by_id"), rs);
    }

    private static UsageRecord record(String id) {
        return new UsageRecord(
                id,
                "alice",
                Tier.BASIC,
                "chat",
                Instant.parse("2026-03-14T12:00:29Z"),
                250,
                100,
                200,
                0.25,
                0,
                true,
                STAMP);
    }

    @Test
    @DisplayName("stores a new record")
    void storesNewRecord() {
        claimResult(true, null);

        assertTrue(repository.append(record("u-1")).await().indefinitely());

        verify(session).executeAsync(bound.get("INSERT:usage_records_by_hour"));
        verify(session, never()).executeAsync(bound.get("DELETE:usage_records_by_hour"));
    }

    @Test
    @DisplayName("a retry of a stored record keeps the stored row")
    void retryKeepsStoredRow() {
        claimResult(false, STORED_STAMP);

        assertFalse(repository.append(record("u-1")).await().indefinitely());

        verify(session, never()).executeAsync(bound.get("DELETE:usage_records_by_hour"));
    }

    @Test
    @DisplayName("a duplicate with a different stamp removes the row it just wrote")
    void duplicateRemovesOwnRow() {
        claimResult(false, Instant.parse("2026-03-14T11:59:00.120Z"));

        assertFalse(repository.append(record("u-1")).await().indefinitely());

        verify(session).executeAsync(bound.get("DELETE:usage_records_by_hour"));
    }
}
