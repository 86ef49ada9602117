package tollgate.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.aggregate.UsageWatermark;
import tollgate.core.model.usage.UsageRecord;
import tollgate.core.port.out.UsageRecordRepository;

/**
 * In-memory implementation of UsageRecordRepository.
 *
 * <p>Records are lost on restart and not shared across instances. Intended for
 * development, testing, and single-instance deployments.
 */
public class InMemoryUsageRecordRepository implements UsageRecordRepository {

    private final ConcurrentMap<String, UsageRecord> byId = new ConcurrentHashMap<>();
    private final ConcurrentNavigableMap<UsageWatermark, UsageRecord> byWatermark = new ConcurrentSkipListMap<>();

    @Override
    public Uni<Boolean> append(UsageRecord record) {
        return Uni.createFrom().item(() -> {
            final var watermark = record.watermark();
            if (byId.putIfAbsent(record.recordId(), record) != null) {
                return false;
            }
            byWatermark.put(watermark, record);
            return true;
        });
    }

    @Override
    public Uni<List<UsageRecord>> findAfter(Optional<UsageWatermark> after, Instant upTo, int limit) {
        return Uni.createFrom().item(() -> {
            final var candidates = after.map(w -> byWatermark.tailMap(w, false)).orElse(byWatermark);
            final var result = new ArrayList<UsageRecord>(Math.min(limit, 64));
            for (var record : candidates.values()) {
                if (result.size() >= limit || !record.recordedAt().isBefore(upTo)) {
                    break;
                }
                result.add(record);
            }
            return List.copyOf(result);
        });
    }

    @Override
    public Uni<Long> purgeRecordedBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            final var expired = byWatermark.headMap(new UsageWatermark(cutoff, ""), false);
            long removed = 0;
            for (var record : expired.values()) {
                byId.remove(record.recordId());
                removed++;
            }
            expired.clear();
            return removed;
        });
    }

    /**
     * Number of records held.
     */
    public int size() {
        return byId.size();
    }
}
