package tollgate.core.service.aggregate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.UsageConfig;
import tollgate.core.port.out.DailyAggregateRepository;
import tollgate.core.port.out.Metrics;
import tollgate.core.port.out.UsageRecordRepository;

/**
 * Purges raw usage records and daily aggregates past their retention.
 */
@ApplicationScoped
public class RetentionService {

    private static final Logger LOG = Logger.getLogger(RetentionService.class);

    private final UsageRecordRepository records;
    private final DailyAggregateRepository aggregates;
    private final UsageConfig config;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public RetentionService(
            UsageRecordRepository records,
            DailyAggregateRepository aggregates,
            UsageConfig config,
            Metrics metrics,
            Clock clock) {
        this.records = records;
        this.aggregates = aggregates;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Scheduled(
            every = "${tollgate.usage.retention.interval:24h}",
            delayed = "1m",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> scheduledPurge() {
        return purge()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Usage retention purge failed");
                    return null;
                })
                .replaceWithVoid();
    }

    /**
     * Remove expired records and aggregates.
     *
     * @return Uni completing when both purges have run
     */
    public Uni<Void> purge() {
        final var now = clock.instant();
        final var recordCutoff = now.minus(config.retention().records());
        final var aggregateCutoff =
                LocalDate.ofInstant(now.minus(config.retention().aggregates()), ZoneOffset.UTC);

        return records.purgeRecordedBefore(recordCutoff)
                .invoke(removed -> report("records", removed, recordCutoff))
                .flatMap(ignored -> aggregates.purgeBefore(aggregateCutoff))
                .invoke(removed -> report("aggregates", removed, aggregateCutoff))
                .replaceWithVoid();
    }

    private void report(String target, long removed, Object cutoff) {
        if (removed < 0) {
            LOG.debugf("Usage %s expire in the store, nothing purged before %s", target, cutoff);
            return;
        }
        metrics.recordRetentionPurge(target, removed);
        if (removed > 0) {
            LOG.infov("Purged {0} usage {1} older than {2}", removed, target, cutoff);
        }
    }
}
