package tollgate.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.aggregate.AggregateKey;
import tollgate.core.model.aggregate.AggregationConflictException;
import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.aggregate.LateUsageRecord;
import tollgate.core.model.aggregate.RollupCheckpoint;
import tollgate.core.model.aggregate.RollupCommit;
import tollgate.core.port.out.DailyAggregateRepository;

/**
 * In-memory implementation of DailyAggregateRepository.
 *
 * <p>All state sits behind one monitor, so a commit replaces aggregates, late
 * records, and the checkpoint as a unit.
 */
public class InMemoryDailyAggregateRepository implements DailyAggregateRepository {

    private final Clock clock;
    private final Map<AggregateKey, DailyAggregate> aggregates = new HashMap<>();
    private final Map<String, LateUsageRecord> lateRecords = new HashMap<>();
    private RollupCheckpoint checkpoint = RollupCheckpoint.initial();
    private String leaseOwner;
    private Instant leaseExpiresAt = Instant.EPOCH;

    public InMemoryDailyAggregateRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<RollupCheckpoint> checkpoint() {
        return Uni.createFrom().item(this::currentCheckpoint);
    }

    @Override
    public Uni<List<DailyAggregate>> findByKeys(Collection<AggregateKey> keys) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var found = new ArrayList<DailyAggregate>();
                for (var key : keys) {
                    final var aggregate = aggregates.get(key);
                    if (aggregate != null) {
                        found.add(aggregate);
                    }
                }
                return List.copyOf(found);
            }
        });
    }

    @Override
    public Uni<List<DailyAggregate>> findByIdentity(String identity, LocalDate from, LocalDate to) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return aggregates.values().stream()
                        .filter(a -> a.identity().equals(identity))
                        .filter(a -> !a.date().isBefore(from) && !a.date().isAfter(to))
                        .toList();
            }
        });
    }

    @Override
    public Uni<Void> commit(RollupCommit commit) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                if (checkpoint.version() != commit.expected().version()) {
                    throw new AggregationConflictException(commit.expected().version(), checkpoint.version());
                }
                for (var aggregate : commit.aggregates()) {
                    aggregates.put(aggregate.key(), aggregate);
                }
                for (var late : commit.lateRecords()) {
                    lateRecords.putIfAbsent(late.record().recordId(), late);
                }
                checkpoint = commit.next();
                return null;
            }
        });
    }

    @Override
    public Uni<List<LateUsageRecord>> findLateRecords(LocalDate from, LocalDate to) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return lateRecords.values().stream()
                        .filter(late -> {
                            final var date = late.record().usageDate();
                            return !date.isBefore(from) && !date.isAfter(to);
                        })
                        .toList();
            }
        });
    }

    @Override
    public Uni<Boolean> tryAcquireLease(String owner, Duration ttl) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var now = clock.instant();
                if (leaseOwner == null || leaseOwner.equals(owner) || !now.isBefore(leaseExpiresAt)) {
                    leaseOwner = owner;
                    leaseExpiresAt = now.plus(ttl);
                    return true;
                }
                return false;
            }
        });
    }

    @Override
    public Uni<Void> releaseLease(String owner) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                if (owner.equals(leaseOwner)) {
                    leaseOwner = null;
                    leaseExpiresAt = Instant.EPOCH;
                }
                return null;
            }
        });
    }

    @Override
    public Uni<Long> purgeBefore(LocalDate cutoff) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var before = aggregates.size();
                aggregates.keySet().removeIf(key -> key.date().isBefore(cutoff));
                lateRecords.values().removeIf(late -> late.record().usageDate().isBefore(cutoff));
                return (long) (before - aggregates.size());
            }
        });
    }

    private synchronized RollupCheckpoint currentCheckpoint() {
        return checkpoint;
    }
}
