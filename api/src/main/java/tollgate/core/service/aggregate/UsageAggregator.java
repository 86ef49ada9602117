package tollgate.core.service.aggregate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.AggregationConfig;
import tollgate.core.model.aggregate.AggregateKey;
import tollgate.core.model.aggregate.AggregationConflictException;
import tollgate.core.model.aggregate.DailyAggregate;
import tollgate.core.model.aggregate.LateUsageRecord;
import tollgate.core.model.aggregate.RollupCheckpoint;
import tollgate.core.model.aggregate.RollupCommit;
import tollgate.core.model.aggregate.RollupResult;
import tollgate.core.model.usage.UsageRecord;
import tollgate.core.port.in.UsageAggregation;
import tollgate.core.port.out.DailyAggregateRepository;
import tollgate.core.port.out.Metrics;
import tollgate.core.port.out.UsageRecordRepository;

/**
 * Rolls raw usage records into daily aggregates.
 *
 * <p>Each batch reads records after the checkpoint watermark, folds them into
 * the current totals, and commits the new totals together with the advanced
 * watermark, conditional on the checkpoint version it started from. A batch
 * that loses that race is recomputed from the fresh checkpoint. Since records
 * at or before the watermark are never read again, running rollup twice over
 * the same records changes nothing.
 *
 * <p>Records recorded within {@code settle-delay} of now are left for a later
 * run so that writes still being retried cannot land behind the watermark.
 * Records for finalized days are held as late records instead of being folded.
 */
@ApplicationScoped
public class UsageAggregator implements UsageAggregation {

    private static final Logger LOG = Logger.getLogger(UsageAggregator.class);
    private static final int MAX_LATE_RANGE_DAYS = 366;

    private final UsageRecordRepository records;
    private final DailyAggregateRepository aggregates;
    private final AggregationConfig config;
    private final Metrics metrics;
    private final Clock clock;
    private final String owner = "rollup-" + UUID.randomUUID();

    @Inject
    public UsageAggregator(
            UsageRecordRepository records,
            DailyAggregateRepository aggregates,
            AggregationConfig config,
            Metrics metrics,
            Clock clock) {
        this.records = records;
        this.aggregates = aggregates;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Scheduled(
            every = "${tollgate.aggregation.interval:5m}",
            delayed = "${tollgate.aggregation.interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> scheduledRollup() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return rollup()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Scheduled usage rollup failed");
                    return null;
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<RollupResult> rollup() {
        final var started = System.currentTimeMillis();
        return aggregates.tryAcquireLease(owner, config.leaseTtl()).flatMap(acquired -> {
            if (!acquired) {
                LOG.debug("Rollup lease held elsewhere, skipping run");
                return Uni.createFrom().item(RollupResult.skippedRun());
            }
            return runBatches(null)
                    .flatMap(result -> autoFinalize().map(checkpoint -> new RollupResult(
                            result.recordsProcessed(),
                            result.updatedAggregates(),
                            result.lateRecords(),
                            checkpoint.watermark(),
                            checkpoint.finalizedThrough(),
                            false)))
                    .invoke(result -> {
                        final var duration = System.currentTimeMillis() - started;
                        metrics.recordRollup(
                                result.recordsProcessed(), result.updatedAggregates(), result.lateRecords(), duration);
                        if (result.recordsProcessed() > 0) {
                            LOG.infov(
                                    "Rolled up {0} usage record(s) into {1} aggregate(s), {2} late, in {3}ms",
                                    result.recordsProcessed(),
                                    result.updatedAggregates(),
                                    result.lateRecords(),
                                    duration);
                        }
                    })
                    .eventually(() -> aggregates.releaseLease(owner));
        });
    }

    @Override
    public Uni<RollupCheckpoint> finalizeThrough(LocalDate date) {
        return finalizeThrough(date, 0);
    }

    @Override
    public Uni<List<LateUsageRecord>> lateRecords(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("Both from and to are required"));
        }
        if (from.isAfter(to)) {
            return Uni.createFrom().failure(new IllegalArgumentException("from must not be after to"));
        }
        if (ChronoUnit.DAYS.between(from, to) + 1 > MAX_LATE_RANGE_DAYS) {
            return Uni.createFrom()
                    .failure(new IllegalArgumentException(
                            "Date range cannot exceed " + MAX_LATE_RANGE_DAYS + " days"));
        }
        return aggregates.findLateRecords(from, to);
    }

    @Override
    public Uni<RollupCheckpoint> checkpoint() {
        return aggregates.checkpoint();
    }

    private Uni<RollupResult> runBatches(RollupResult accumulated) {
        final var upTo = clock.instant().minus(config.settleDelay());
        return processBatch(upTo, 0).flatMap(batch -> {
            final var total = accumulated == null ? batch : accumulated.plus(batch);
            if (batch.recordsProcessed() < config.batchSize()) {
                return Uni.createFrom().item(total);
            }
            return runBatches(total);
        });
    }

    private Uni<RollupResult> processBatch(Instant upTo, int attempt) {
        return aggregates
                .checkpoint()
                .flatMap(checkpoint -> records.findAfter(checkpoint.watermark(), upTo, config.batchSize())
                        .flatMap(batch -> fold(checkpoint, batch)))
                .onFailure(AggregationConflictException.class)
                .recoverWithUni(error -> {
                    metrics.recordRollupConflict();
                    if (attempt >= config.maxConflictRetries()) {
                        return Uni.createFrom().failure(error);
                    }
                    LOG.warnv("Rollup checkpoint conflict, retrying batch (attempt {0})", attempt + 1);
                    return processBatch(upTo, attempt + 1);
                });
    }

    private Uni<RollupResult> fold(RollupCheckpoint checkpoint, List<UsageRecord> batch) {
        if (batch.isEmpty()) {
            return Uni.createFrom().item(RollupResult.nothingFrom(checkpoint));
        }

        final var now = clock.instant();
        final var deltas = new LinkedHashMap<AggregateKey, DailyAggregate>();
        final var late = new ArrayList<LateUsageRecord>();
        for (var record : batch) {
            final var date = record.usageDate();
            if (checkpoint.isFinalized(date)) {
                late.add(new LateUsageRecord(record, checkpoint.finalizedThrough().orElseThrow(), now));
                continue;
            }
            final var key = new AggregateKey(record.identity(), date, record.category());
            deltas.merge(key, DailyAggregate.empty(key).plus(record, now), (current, added) -> current.plus(added, now));
        }

        final var next = checkpoint.advance(batch.get(batch.size() - 1).watermark());
        if (!late.isEmpty()) {
            LOG.warnv(
                    "{0} usage record(s) arrived for finalized days (through {1}), held for reconciliation",
                    late.size(), checkpoint.finalizedThrough().orElseThrow());
        }

        return aggregates.findByKeys(deltas.keySet()).flatMap(existing -> {
            final var totals = new LinkedHashMap<AggregateKey, DailyAggregate>(deltas);
            for (var current : existing) {
                totals.computeIfPresent(current.key(), (key, delta) -> current.plus(delta, now));
            }
            final var commit = new RollupCommit(checkpoint, next, List.copyOf(totals.values()), late);
            return aggregates
                    .commit(commit)
                    .replaceWith(new RollupResult(
                            batch.size(),
                            totals.size(),
                            late.size(),
                            next.watermark(),
                            next.finalizedThrough(),
                            false));
        });
    }

    private Uni<RollupCheckpoint> autoFinalize() {
        final var boundary = clock.instant().minus(config.finalizationLag());
        final var through = LocalDate.ofInstant(boundary, ZoneOffset.UTC).minusDays(1);
        return aggregates.checkpoint().flatMap(checkpoint -> {
            if (checkpoint.isFinalized(through)) {
                return Uni.createFrom().item(checkpoint);
            }
            return finalizeThrough(through, 0);
        });
    }

    private Uni<RollupCheckpoint> finalizeThrough(LocalDate date, int attempt) {
        return aggregates
                .checkpoint()
                .flatMap(checkpoint -> {
                    if (checkpoint.isFinalized(date)) {
                        return Uni.createFrom().item(checkpoint);
                    }
                    final var next = checkpoint.finalizeThrough(date);
                    return aggregates
                            .commit(new RollupCommit(checkpoint, next, List.of(), List.of()))
                            .invoke(() -> LOG.infov("Finalized usage through {0}", date))
                            .replaceWith(next);
                })
                .onFailure(AggregationConflictException.class)
                .recoverWithUni(error -> {
                    metrics.recordRollupConflict();
                    if (attempt >= config.maxConflictRetries()) {
                        return Uni.createFrom().failure(error);
                    }
                    return finalizeThrough(date, attempt + 1);
                });
    }
}
