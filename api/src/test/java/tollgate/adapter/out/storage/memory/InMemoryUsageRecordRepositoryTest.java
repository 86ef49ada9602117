package tollgate.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.aggregate.UsageWatermark;
import tollgate.mock.TestRecords;

@DisplayName("InMemoryUsageRecordRepository")
class InMemoryUsageRecordRepositoryTest {

    private static final Instant UP_TO = Instant.parse("2026-03-14T12:00:00Z");

    private InMemoryUsageRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUsageRecordRepository();
        repository.append(TestRecords.record("b", "alice", "chat", "2026-03-14T10:00:00Z", "2026-03-14T11:00:00Z"))
                .await()
                .indefinitely();
        repository.append(TestRecords.record("a", "alice", "chat", "2026-03-14T10:00:00Z", "2026-03-14T11:00:00Z"))
                .await()
                .indefinitely();
        repository.append(TestRecords.record("c", "bob", "chat", "2026-03-14T10:00:00Z", "2026-03-14T11:30:00Z"))
                .await()
                .indefinitely();
    }

    @Test
    @DisplayName("appending an existing id is a no-op")
    void duplicateAppend() {
        var inserted = repository
                .append(TestRecords.record("a", "alice", "chat", "2026-03-14T10:00:00Z", "2026-03-14T11:45:00Z"))
                .await()
                .indefinitely();

        assertFalse(inserted);
        assertEquals(3, repository.size());
    }

    @Test
    @DisplayName("reads in watermark order, ties broken by record id")
    void watermarkOrder() {
        var records = repository.findAfter(Optional.empty(), UP_TO, 10).await().indefinitely();

        assertEquals("a", records.get(0).recordId());
        assertEquals("b", records.get(1).recordId());
        assertEquals("c", records.get(2).recordId());
    }

    @Test
    @DisplayName("reads strictly after the watermark and before the upper bound")
    void bounds() {
        var after = new UsageWatermark(Instant.parse("2026-03-14T11:00:00Z"), "a");

        var records = repository
                .findAfter(Optional.of(after), Instant.parse("2026-03-14T11:30:00Z"), 10)
                .await()
                .indefinitely();

        assertEquals(1, records.size());
        assertEquals("b", records.get(0).recordId());
    }

    @Test
    @DisplayName("honours the batch limit")
    void limit() {
        assertEquals(2, repository.findAfter(Optional.empty(), UP_TO, 2).await().indefinitely().size());
    }

    @Test
    @DisplayName("purges records recorded before the cutoff")
    void purge() {
        var removed = repository
                .purgeRecordedBefore(Instant.parse("2026-03-14T11:15:00Z"))
                .await()
                .indefinitely();

        assertEquals(2, removed);
        assertEquals(1, repository.size());
    }
}
