package tollgate.core.port.out;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.aggregate.AggregateKey;
import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.aggregate.LateUsageRecord;
import tollgate.core.model.aggregate.RollupCheckpoint;
import tollgate.core.model.aggregate.RollupCommit;

/**
 * Store for daily aggregates, the rollup checkpoint, and the rollup lease.
 */
public interface DailyAggregateRepository {

    /**
     * Current checkpoint, {@link RollupCheckpoint#initial()} before the first commit.
     */
    Uni<RollupCheckpoint> checkpoint();

    /**
     * Fetch existing aggregates for the given keys. Missing keys are omitted.
     */
    Uni<List<DailyAggregate>> findByKeys(Collection<AggregateKey> keys);

    /**
     * Aggregates for an identity within an inclusive date range.
     */
    Uni<List<DailyAggregate>> findByIdentity(String identity, LocalDate from, LocalDate to);

    /**
     * Write aggregates, late records, and the next checkpoint as one unit.
     *
     * @param commit the rollup commit
     * @return Uni completing when committed; fails with
     *     {@link tollgate.core.model.aggregate.AggregationConflictException} if the
     *     stored checkpoint version differs from {@code commit.expected()}
     */
    Uni<Void> commit(RollupCommit commit);

    /**
     * Late records whose usage day falls within the inclusive range.
     */
    Uni<List<LateUsageRecord>> findLateRecords(LocalDate from, LocalDate to);

    /**
     * Try to take the rollup lease.
     *
     * @param owner unique id of the caller
     * @param ttl   lease duration; an expired lease may be taken by anyone
     * @return Uni with true if the caller now holds the lease
     */
    Uni<Boolean> tryAcquireLease(String owner, Duration ttl);

    /**
     * Release the lease if {@code owner} holds it.
     */
    Uni<Void> releaseLease(String owner);

    /**
     * Delete aggregates for days before the cutoff.
     *
     * @param cutoff exclusive upper bound on the aggregate date
     * @return Uni with the number of rows removed, -1 when the store expires rows itself
     */
    Uni<Long> purgeBefore(LocalDate cutoff);
}
