package tollgate.adapter.out.storage.cassandra;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.aggregate.UsageWatermark;
import tollgate.core.model.tier.Tier;
import tollgate.core.model.usage.UsagePersistenceException;
import tollgate.core.model.usage.UsageRecord;
import tollgate.core.port.out.UsageRecordRepository;

/**
 * Cassandra implementation of UsageRecordRepository.
 *
 * <p>Records are partitioned by the hour they were persisted and clustered by
 * watermark, so a rollup reads partitions in order. Duplicates are detected
 * with a lightweight transaction on {@code usage_records_by_id}. Retention is
 * enforced by row TTLs.
 *
 * <h2>Schema</h2>
 * <pre>
 * usage_records_by_id   (record_id PRIMARY KEY, recorded_at)
 * usage_records_by_hour ((hour_bucket), recorded_at, record_id, ...)
 * usage_record_hours    ((shard), hour_bucket)
 * </pre>
 */
public class CassandraUsageRecordRepository implements UsageRecordRepository {

    private static final Logger LOG = Logger.getLogger(CassandraUsageRecordRepository.class);
    private static final int HOURS_SHARD = 0;

    private final CassandraSupport cassandra;
    private final int ttlSeconds;
    private final PreparedStatement insertRecordStmt;
    private final PreparedStatement insertHourStmt;
    private final PreparedStatement claimIdStmt;
    private final PreparedStatement deleteRecordStmt;
    private final PreparedStatement selectHoursStmt;
    private final PreparedStatement selectBucketStmt;
    private final PreparedStatement selectBucketAfterStmt;

    CassandraUsageRecordRepository(CassandraSupport cassandra, Duration retention) {
        this.cassandra = cassandra;
        this.ttlSeconds = (int) Math.min(Integer.MAX_VALUE, retention.toSeconds());
        final var session = cassandra.session();
        this.insertRecordStmt = session.prepare(
                """
                INSERT INTO usage_records_by_hour (hour_bucket, recorded_at, record_id, identity, tier, category,
                    request_ts, duration_ms, tokens_in, tokens_out, compute_units, storage_bytes, success)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                USING TTL ?
                """);
        this.insertHourStmt =
                session.prepare("INSERT INTO usage_record_hours (shard, hour_bucket) VALUES (?, ?) USING TTL ?");
        this.claimIdStmt = session.prepare(
                "INSERT INTO usage_records_by_id (record_id, recorded_at) VALUES (?, ?) IF NOT EXISTS USING TTL ?");
        this.deleteRecordStmt = session.prepare(
                "DELETE FROM usage_records_by_hour WHERE hour_bucket = ? AND recorded_at = ? AND record_id = ?");
        this.selectHoursStmt = session.prepare(
                "SELECT hour_bucket FROM usage_record_hours WHERE shard = ? AND hour_bucket >= ? AND hour_bucket <= ?");
        this.selectBucketStmt = session.prepare(
                "SELECT * FROM usage_records_by_hour WHERE hour_bucket = ? AND recorded_at < ? LIMIT ?");
        this.selectBucketAfterStmt = session.prepare(
                """
                SELECT * FROM usage_records_by_hour
                WHERE hour_bucket = ? AND (recorded_at, record_id) > (?, ?) AND (recorded_at) < (?)
                LIMIT ?
                """);
    }

    /**
     * Write the record row first, then claim the id. When the id already
     * belongs to a record with a different stamp, the row just written is
     * removed again and the append reports a duplicate.
     *
     * <p>The stamp is compared at millisecond precision, the resolution of a
     * {@code timestamp} column; a retry of a stored record finds its own stamp.
     */
    @Override
    public Uni<Boolean> append(UsageRecord record) {
        final var recordedAt = record.watermark().recordedAt().truncatedTo(ChronoUnit.MILLIS);
        final var bucket = hourOf(recordedAt);
        return cassandra
                .execute(insertRecordStmt.bind(
                        bucket,
                        recordedAt,
                        record.recordId(),
                        record.identity(),
                        record.tier().value(),
                        record.category(),
                        record.timestamp(),
                        record.durationMillis(),
                        record.tokensIn(),
                        record.tokensOut(),
                        record.computeUnits(),
                        record.storageBytes(),
                        record.success(),
                        ttlSeconds))
                .flatMap(ignored -> cassandra.execute(insertHourStmt.bind(HOURS_SHARD, bucket, ttlSeconds)))
                .flatMap(ignored -> cassandra.execute(claimIdStmt.bind(record.recordId(), recordedAt, ttlSeconds)))
                .flatMap(rs -> {
                    if (rs.wasApplied()) {
                        return Uni.createFrom().item(true);
                    }
                    final var existing = rs.one();
                    final var existingStamp = existing != null ? existing.getInstant("recorded_at") : null;
                    if (recordedAt.equals(existingStamp)) {
                        return Uni.createFrom().item(false);
                    }
                    LOG.debugf("Usage record %s already stored, dropping duplicate", record.recordId());
                    return cassandra
                            .execute(deleteRecordStmt.bind(bucket, recordedAt, record.recordId()))
                            .replaceWith(false);
                })
                .onFailure(error -> !(error instanceof UsagePersistenceException))
                .transform(error ->
                        new UsagePersistenceException("Failed to append usage record " + record.recordId(), error));
    }

    @Override
    public Uni<List<UsageRecord>> findAfter(Optional<UsageWatermark> after, Instant upTo, int limit) {
        final var fromHour = after.map(w -> hourOf(w.recordedAt())).orElse(Instant.EPOCH);
        final var toHour = hourOf(upTo);
        return cassandra
                .executeAll(selectHoursStmt.bind(HOURS_SHARD, fromHour, toHour))
                .map(rows -> rows.stream().map(row -> row.getInstant("hour_bucket")).toList())
                .flatMap(buckets -> readBuckets(buckets, 0, after, upTo, limit, new ArrayList<>()));
    }

    @Override
    public Uni<Long> purgeRecordedBefore(Instant cutoff) {
        // Rows expire through their TTL
        return Uni.createFrom().item(-1L);
    }

    private Uni<List<UsageRecord>> readBuckets(
            List<Instant> buckets,
            int index,
            Optional<UsageWatermark> after,
            Instant upTo,
            int limit,
            List<UsageRecord> collected) {
        if (index >= buckets.size() || collected.size() >= limit) {
            return Uni.createFrom().item(List.copyOf(collected));
        }

        final var bucket = buckets.get(index);
        final var remaining = limit - collected.size();
        final var startsInBucket = after.filter(w -> hourOf(w.recordedAt()).equals(bucket));
        final var statement = startsInBucket
                .map(w -> selectBucketAfterStmt.bind(bucket, w.recordedAt(), w.recordId(), upTo, remaining))
                .orElseGet(() -> selectBucketStmt.bind(bucket, upTo, remaining));

        return cassandra.executeAll(statement).flatMap(rows -> {
            rows.forEach(row -> collected.add(fromRow(row)));
            return readBuckets(buckets, index + 1, after, upTo, limit, collected);
        });
    }

    private static Instant hourOf(Instant instant) {
        return instant.truncatedTo(ChronoUnit.HOURS);
    }

    private static UsageRecord fromRow(Row row) {
        final var tierValue = row.getString("tier");
        return new UsageRecord(
                row.getString("record_id"),
                row.getString("identity"),
                Tier.fromValue(tierValue)
                        .orElseThrow(() -> new IllegalStateException("Unknown tier in usage record: " + tierValue)),
                row.getString("category"),
                row.getInstant("request_ts"),
                row.getLong("duration_ms"),
                row.getLong("tokens_in"),
                row.getLong("tokens_out"),
                row.getDouble("compute_units"),
                row.getLong("storage_bytes"),
                row.getBoolean("success"),
                row.getInstant("recorded_at"));
    }
}
