package tollgate.adapter.out.storage.cassandra;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.DefaultBatchType;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import io.smallrye.mutiny.Uni;

import tollgate.core.model.aggregate.AggregateKey;
import tollgate.core.model.aggregate.AggregationConflictException;
import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.aggregate.LateUsageRecord;
import tollgate.core.model.aggregate.RollupCheckpoint;
import tollgate.core.model.aggregate.RollupCommit;
import tollgate.core.model.aggregate.UsageWatermark;
import tollgate.core.model.tier.Tier;
import tollgate.core.model.usage.UsageRecord;
import tollgate.core.port.out.DailyAggregateRepository;

/**
 * Cassandra implementation of DailyAggregateRepository.
 *
 * <p>A commit checks the checkpoint version and then writes aggregates, late
 * records, and the new checkpoint in one logged batch. The version check is
 * only a compare-and-set among lease holders: callers must hold the rollup
 * lease, which is a lightweight transaction with a TTL.
 *
 * <p>Aggregates hold absolute totals, so replaying a batch after a partial
 * failure rewrites the same values.
 */
public class CassandraDailyAggregateRepository implements DailyAggregateRepository {

    private static final String CHECKPOINT_ID = "usage";
    private static final String LEASE_ID = "usage-rollup";

    private final CassandraSupport cassandra;
    private final int ttlSeconds;
    private final PreparedStatement selectCheckpointStmt;
    private final PreparedStatement upsertCheckpointStmt;
    private final PreparedStatement selectAggregateStmt;
    private final PreparedStatement selectRangeStmt;
    private final PreparedStatement upsertAggregateStmt;
    private final PreparedStatement insertLateStmt;
    private final PreparedStatement selectLateStmt;
    private final PreparedStatement acquireLeaseStmt;
    private final PreparedStatement renewLeaseStmt;
    private final PreparedStatement releaseLeaseStmt;

    CassandraDailyAggregateRepository(CassandraSupport cassandra, Duration retention) {
        this.cassandra = cassandra;
        this.ttlSeconds = (int) Math.min(Integer.MAX_VALUE, retention.toSeconds());
        final var session = cassandra.session();
        this.selectCheckpointStmt = session.prepare("SELECT * FROM rollup_checkpoint WHERE id = ?");
        this.upsertCheckpointStmt = session.prepare(
                """
                INSERT INTO rollup_checkpoint (id, version, watermark_recorded_at, watermark_record_id,
                    finalized_through)
                VALUES (?, ?, ?, ?, ?)
                """);
        this.selectAggregateStmt = session.prepare(
                "SELECT * FROM daily_aggregates WHERE identity = ? AND usage_date = ? AND category = ?");
        this.selectRangeStmt = session.prepare(
                "SELECT * FROM daily_aggregates WHERE identity = ? AND usage_date >= ? AND usage_date <= ?");
        this.upsertAggregateStmt = session.prepare(
                """
                INSERT INTO daily_aggregates (identity, usage_date, category, request_count, success_count,
                    error_count, duration_total_ms, tokens_in, tokens_out, compute_units, storage_bytes, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                USING TTL ?
                """);
        this.insertLateStmt = session.prepare(
                """
                INSERT INTO late_usage_records (usage_date, record_id, identity, tier, category, request_ts,
                    recorded_at, duration_ms, tokens_in, tokens_out, compute_units, storage_bytes, success,
                    finalized_through, detected_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                USING TTL ?
                """);
        this.selectLateStmt = session.prepare("SELECT * FROM late_usage_records WHERE usage_date = ?");
        this.acquireLeaseStmt =
                session.prepare("INSERT INTO rollup_lease (id, owner) VALUES (?, ?) IF NOT EXISTS USING TTL ?");
        this.renewLeaseStmt =
                session.prepare("UPDATE rollup_lease USING TTL ? SET owner = ? WHERE id = ? IF owner = ?");
        this.releaseLeaseStmt = session.prepare("DELETE FROM rollup_lease WHERE id = ? IF owner = ?");
    }

    @Override
    public Uni<RollupCheckpoint> checkpoint() {
        return cassandra.execute(selectCheckpointStmt.bind(CHECKPOINT_ID)).map(rs -> {
            final var row = rs.one();
            return row != null ? checkpointFromRow(row) : RollupCheckpoint.initial();
        });
    }

    @Override
    public Uni<List<DailyAggregate>> findByKeys(Collection<AggregateKey> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final var reads = keys.stream()
                .map(key -> cassandra
                        .execute(selectAggregateStmt.bind(key.identity(), key.date(), key.category()))
                        .map(rs -> Optional.ofNullable(rs.one()).map(CassandraDailyAggregateRepository::aggregateFromRow)))
                .toList();
        return Uni.combine().all().unis(reads).with(results -> {
            final var found = new ArrayList<DailyAggregate>();
            for (var result : results) {
                ((Optional<?>) result).ifPresent(aggregate -> found.add((DailyAggregate) aggregate));
            }
            return List.copyOf(found);
        });
    }

    @Override
    public Uni<List<DailyAggregate>> findByIdentity(String identity, LocalDate from, LocalDate to) {
        return cassandra
                .executeAll(selectRangeStmt.bind(identity, from, to))
                .map(rows -> rows.stream()
                        .map(CassandraDailyAggregateRepository::aggregateFromRow)
                        .toList());
    }

    @Override
    public Uni<Void> commit(RollupCommit commit) {
        return checkpoint().flatMap(current -> {
            if (current.version() != commit.expected().version()) {
                return Uni.createFrom()
                        .failure(new AggregationConflictException(commit.expected().version(), current.version()));
            }

            final var batch = BatchStatement.builder(DefaultBatchType.LOGGED);
            for (var aggregate : commit.aggregates()) {
                batch.addStatement(upsertAggregateStmt.bind(
                        aggregate.identity(),
                        aggregate.date(),
                        aggregate.category(),
                        aggregate.requestCount(),
                        aggregate.successCount(),
                        aggregate.errorCount(),
                        aggregate.durationTotalMillis(),
                        aggregate.tokensIn(),
                        aggregate.tokensOut(),
                        aggregate.computeUnits(),
                        aggregate.storageBytes(),
                        aggregate.updatedAt(),
                        ttlSeconds));
            }
            for (var late : commit.lateRecords()) {
                final var record = late.record();
                batch.addStatement(insertLateStmt.bind(
                        record.usageDate(),
                        record.recordId(),
                        record.identity(),
                        record.tier().value(),
                        record.category(),
                        record.timestamp(),
                        record.recordedAt(),
                        record.durationMillis(),
                        record.tokensIn(),
                        record.tokensOut(),
                        record.computeUnits(),
                        record.storageBytes(),
                        record.success(),
                        late.finalizedThrough(),
                        late.detectedAt(),
                        ttlSeconds));
            }

            final var next = commit.next();
            batch.addStatement(upsertCheckpointStmt.bind(
                    CHECKPOINT_ID,
                    next.version(),
                    next.watermark().map(UsageWatermark::recordedAt).orElse(null),
                    next.watermark().map(UsageWatermark::recordId).orElse(null),
                    next.finalizedThrough().orElse(null)));

            return cassandra.execute(batch.build()).replaceWithVoid();
        });
    }

    @Override
    public Uni<List<LateUsageRecord>> findLateRecords(LocalDate from, LocalDate to) {
        final var reads = from.datesUntil(to.plusDays(1))
                .map(date -> cassandra.executeAll(selectLateStmt.bind(date)))
                .toList();
        if (reads.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return Uni.combine().all().unis(reads).with(results -> {
            final var late = new ArrayList<LateUsageRecord>();
            for (var result : results) {
                for (var row : (List<?>) result) {
                    late.add(lateFromRow((Row) row));
                }
            }
            return List.copyOf(late);
        });
    }

    @Override
    public Uni<Boolean> tryAcquireLease(String owner, Duration ttl) {
        final var leaseSeconds = (int) Math.max(1, ttl.toSeconds());
        return cassandra.execute(acquireLeaseStmt.bind(LEASE_ID, owner, leaseSeconds)).flatMap(rs -> {
            if (rs.wasApplied()) {
                return Uni.createFrom().item(true);
            }
            final var holder = rs.one();
            if (holder == null || !owner.equals(holder.getString("owner"))) {
                return Uni.createFrom().item(false);
            }
            return cassandra
                    .execute(renewLeaseStmt.bind(leaseSeconds, owner, LEASE_ID, owner))
                    .map(renewed -> renewed.wasApplied());
        });
    }

    @Override
    public Uni<Void> releaseLease(String owner) {
        return cassandra.execute(releaseLeaseStmt.bind(LEASE_ID, owner)).replaceWithVoid();
    }

    @Override
    public Uni<Long> purgeBefore(LocalDate cutoff) {
        // Rows expire through their TTL
        return Uni.createFrom().item(-1L);
    }

    private static RollupCheckpoint checkpointFromRow(Row row) {
        final var recordedAt = row.getInstant("watermark_recorded_at");
        final var recordId = row.getString("watermark_record_id");
        final Optional<UsageWatermark> watermark = recordedAt != null && recordId != null
                ? Optional.of(new UsageWatermark(recordedAt, recordId))
                : Optional.empty();
        return new RollupCheckpoint(
                watermark, Optional.ofNullable(row.getLocalDate("finalized_through")), row.getLong("version"));
    }

    private static DailyAggregate aggregateFromRow(Row row) {
        return new DailyAggregate(
                row.getString("identity"),
                row.getLocalDate("usage_date"),
                row.getString("category"),
                row.getLong("request_count"),
                row.getLong("success_count"),
                row.getLong("error_count"),
                row.getLong("duration_total_ms"),
                row.getLong("tokens_in"),
                row.getLong("tokens_out"),
                row.getDouble("compute_units"),
                row.getLong("storage_bytes"),
                row.getInstant("updated_at"));
    }

    private static LateUsageRecord lateFromRow(Row row) {
        final var tierValue = row.getString("tier");
        final var record = new UsageRecord(
                row.getString("record_id"),
                row.getString("identity"),
                Tier.fromValue(tierValue)
                        .orElseThrow(() -> new IllegalStateException("Unknown tier in late record: " + tierValue)),
                row.getString("category"),
                row.getInstant("request_ts"),
                row.getLong("duration_ms"),
                row.getLong("tokens_in"),
                row.getLong("tokens_out"),
                row.getDouble("compute_units"),
                row.getLong("storage_bytes"),
                row.getBoolean("success"),
                row.getInstant("recorded_at"));
        return new LateUsageRecord(record, row.getLocalDate("finalized_through"), row.getInstant("detected_at"));
    }
}
