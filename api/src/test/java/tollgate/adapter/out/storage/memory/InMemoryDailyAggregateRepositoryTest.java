package tollgate.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.aggregate.AggregateKey;
import tollgate.core.model.aggregate.AggregationConflictException;
import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.aggregate.RollupCheckpoint;
import tollgate.core.model.aggregate.RollupCommit;
import tollgate.mock.MutableClock;

@DisplayName("InMemoryDailyAggregateRepository")
class InMemoryDailyAggregateRepositoryTest {

    private static final LocalDate DAY = LocalDate.parse("2026-03-14");

    private MutableClock clock;
    private InMemoryDailyAggregateRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-14T12:00:00Z");
        repository = new InMemoryDailyAggregateRepository(clock);
    }

    private static DailyAggregate aggregate(long requests) {
        return new DailyAggregate("alice", DAY, "chat", requests, requests, 0, 0, 0, 0, 0.0, 0, Instant.EPOCH);
    }

    @Test
    @DisplayName("starts from the initial checkpoint")
    void initialCheckpoint() {
        assertEquals(RollupCheckpoint.initial(), repository.checkpoint().await().indefinitely());
    }

    @Test
    @DisplayName("commits aggregates together with the next checkpoint")
    void commits() {
        var initial = RollupCheckpoint.initial();
        var next = initial.finalizeThrough(DAY.minusDays(3));

        repository.commit(new RollupCommit(initial, next, List.of(aggregate(5)), List.of())).await().indefinitely();

        assertEquals(next, repository.checkpoint().await().indefinitely());
        var found = repository
                .findByKeys(List.of(new AggregateKey("alice", DAY, "chat"), new AggregateKey("bob", DAY, "chat")))
                .await()
                .indefinitely();
        assertEquals(1, found.size());
        assertEquals(5, found.get(0).requestCount());
    }

    @Test
    @DisplayName("rejects a commit based on a stale checkpoint and keeps the stored totals")
    void rejectsStaleCommit() {
        var initial = RollupCheckpoint.initial();
        repository.commit(new RollupCommit(initial, initial.finalizeThrough(DAY), List.of(aggregate(5)), List.of()))
                .await()
                .indefinitely();

        var stale = new RollupCommit(initial, initial.finalizeThrough(DAY), List.of(aggregate(99)), List.of());

        assertThrows(AggregationConflictException.class, () -> repository.commit(stale).await().indefinitely());
        assertEquals(
                5,
                repository.findByIdentity("alice", DAY, DAY).await().indefinitely().get(0).requestCount());
    }

    @Test
    @DisplayName("the lease is exclusive until released or expired")
    void lease() {
        var ttl = Duration.ofMinutes(5);

        assertTrue(repository.tryAcquireLease("one", ttl).await().indefinitely());
        assertFalse(repository.tryAcquireLease("two", ttl).await().indefinitely());
        assertTrue(repository.tryAcquireLease("one", ttl).await().indefinitely());

        clock.advance(ttl);
        assertTrue(repository.tryAcquireLease("two", ttl).await().indefinitely());

        repository.releaseLease("one").await().indefinitely();
        assertFalse(repository.tryAcquireLease("one", ttl).await().indefinitely());

        repository.releaseLease("two").await().indefinitely();
        assertTrue(repository.tryAcquireLease("one", ttl).await().indefinitely());
    }
}
