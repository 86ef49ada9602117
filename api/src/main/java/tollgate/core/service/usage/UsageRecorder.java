package tollgate.core.service.usage;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.core.config.UsageConfig;
import tollgate.core.model.tier.Tier;
import tollgate.core.model.usage.DeadLetterEntry;
import tollgate.core.model.usage.DeadLetterReason;
import tollgate.core.model.usage.RequestMetrics;
import tollgate.core.model.usage.UsagePipelineStatus;
import tollgate.core.model.usage.UsageRecord;
import tollgate.core.port.in.UsageRecording;
import tollgate.core.port.out.DeadLetterSink;
import tollgate.core.port.out.Metrics;
import tollgate.core.port.out.UsageRecordRepository;

/**
 * Captures usage off the request path.
 *
 * <p>Records go into a bounded queue drained by a small pool of daemon writer
 * threads. Each write is retried with exponential backoff. A record is never
 * silently dropped:
 * <ul>
 *   <li>writes that keep failing go to the dead-letter sink ({@code PERSISTENCE_FAILED})</li>
 *   <li>records offered to a full queue go there directly ({@code QUEUE_FULL})</li>
 *   <li>records still queued when the shutdown deadline passes go there too ({@code SHUTDOWN_DEADLINE})</li>
 * </ul>
 *
 * <p>{@code recordedAt} is stamped once, at millisecond precision, when a writer
 * first picks the record up. Retries reuse the stamp; replayed dead letters are
 * stamped again.
 */
@ApplicationScoped
public class UsageRecorder implements UsageRecording {

    private static final Logger LOG = Logger.getLogger(UsageRecorder.class);
    private static final long POLL_INTERVAL_MS = 100;
    private static final long FLUSH_POLL_MS = 10;

    private final UsageRecordRepository repository;
    private final DeadLetterSink deadLetterSink;
    private final UsageCostFunction costFunction;
    private final Metrics metrics;
    private final Clock clock;
    private final Settings settings;
    private final BlockingQueue<UsageRecord> queue;

    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    // Submitters share the read side; shutdown takes the write side to stop intake
    private final ReadWriteLock intake = new ReentrantReadWriteLock();

    private volatile boolean accepting;
    private volatile boolean running;
    private ExecutorService workers;

    @Inject
    public UsageRecorder(
            UsageRecordRepository repository,
            DeadLetterSink deadLetterSink,
            UsageCostFunction costFunction,
            Metrics metrics,
            Clock clock,
            UsageConfig config) {
        this(repository, deadLetterSink, costFunction, metrics, clock, Settings.from(config));
    }

    public UsageRecorder(
            UsageRecordRepository repository,
            DeadLetterSink deadLetterSink,
            UsageCostFunction costFunction,
            Metrics metrics,
            Clock clock,
            Settings settings) {
        this.repository = repository;
        this.deadLetterSink = deadLetterSink;
        this.costFunction = costFunction;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
        this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    }

    @PostConstruct
    public void start() {
        if (!settings.enabled()) {
            LOG.info("Usage recording is disabled");
            return;
        }
        if (workers != null) {
            return;
        }

        final var threadIds = new AtomicInteger();
        workers = Executors.newFixedThreadPool(settings.workers(), r -> {
            final var thread = new Thread(r, "tollgate-usage-writer-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        accepting = true;
        for (var i = 0; i < settings.workers(); i++) {
            workers.submit(this::drainLoop);
        }
        metrics.registerUsageQueueGauge(queue::size);
        LOG.infov(
                "Usage recorder started with {0} writer(s), queue capacity {1}",
                settings.workers(), settings.queueCapacity());
    }

    /**
     * Stop accepting records and drain the queue until the shutdown deadline.
     * Whatever is left goes to the dead-letter sink. Once intake is closed no
     * submitter can reach the queue, so the final drain sees every record.
     */
    @PreDestroy
    public void shutdown() {
        if (workers == null) {
            return;
        }
        intake.writeLock().lock();
        try {
            accepting = false;
        } finally {
            intake.writeLock().unlock();
        }
        running = false;
        workers.shutdown();

        try {
            if (!workers.awaitTermination(settings.shutdownDeadline().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnv(
                        "Usage queue not drained within {0}, dead-lettering {1} remaining record(s)",
                        settings.shutdownDeadline(), queue.size());
                workers.shutdownNow();
                workers.awaitTermination(1, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }

        final var leftovers = new ArrayList<UsageRecord>();
        queue.drainTo(leftovers);
        for (var record : leftovers) {
            deadLetter(record, DeadLetterReason.SHUTDOWN_DEADLINE, "shutdown deadline exceeded");
            pending.decrementAndGet();
        }
        workers = null;
        LOG.infov(
                "Usage recorder stopped: {0} persisted, {1} dead-lettered", persisted.get(), deadLettered.get());
    }

    @Override
    public UsageRecord record(String identity, Tier tier, String category, RequestMetrics requestMetrics) {
        final var quantities = costFunction.quantify(category, requestMetrics);
        final var record = new UsageRecord(
                requestMetrics.usageId(),
                identity,
                tier,
                category,
                requestMetrics.startedAt(),
                requestMetrics.duration().toMillis(),
                quantities.tokensIn(),
                quantities.tokensOut(),
                quantities.computeUnits(),
                quantities.storageBytes(),
                requestMetrics.success(),
                null);

        if (settings.enabled()) {
            submit(record);
        }
        return record;
    }

    @Override
    public int replayDeadLetters() {
        final var entries = deadLetterSink.drain();
        var requeued = 0;
        for (var entry : entries) {
            if (submit(entry.record().withRecordedAt(null))) {
                requeued++;
            }
        }
        LOG.infov("Replayed {0} of {1} dead-lettered usage record(s)", requeued, entries.size());
        return requeued;
    }

    @Override
    public boolean flush(Duration timeout) {
        final var deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(FLUSH_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    @Override
    public UsagePipelineStatus status() {
        return new UsagePipelineStatus(
                accepting,
                queue.size(),
                settings.queueCapacity(),
                inFlight.get(),
                persisted.get(),
                deadLettered.get(),
                deadLetterSink.count());
    }

    private boolean submit(UsageRecord record) {
        final DeadLetterReason rejected;
        intake.readLock().lock();
        try {
            if (!accepting) {
                rejected = DeadLetterReason.RECORDER_STOPPED;
            } else {
                pending.incrementAndGet();
                if (queue.offer(record)) {
                    rejected = null;
                } else {
                    pending.decrementAndGet();
                    rejected = DeadLetterReason.QUEUE_FULL;
                }
            }
        } finally {
            intake.readLock().unlock();
        }

        if (rejected == DeadLetterReason.RECORDER_STOPPED) {
            deadLetter(record, rejected, "usage recorder is not accepting records");
            return false;
        }
        if (rejected == DeadLetterReason.QUEUE_FULL) {
            deadLetter(record, rejected, "usage queue full");
            return false;
        }
        metrics.recordUsageEnqueued(record.category());
        return true;
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            final UsageRecord record;
            try {
                record = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (record == null) {
                continue;
            }

            inFlight.incrementAndGet();
            try {
                persist(record);
            } finally {
                inFlight.decrementAndGet();
                pending.decrementAndGet();
            }
        }
    }

    private void persist(UsageRecord record) {
        final var stamped =
                record.isStamped() ? record : record.withRecordedAt(clock.instant().truncatedTo(ChronoUnit.MILLIS));
        var backoff = settings.retryBackoff();
        RuntimeException lastError = null;

        for (var attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            try {
                final var inserted = repository.append(stamped).await().atMost(settings.writeTimeout());
                persisted.incrementAndGet();
                metrics.recordUsagePersisted(!Boolean.TRUE.equals(inserted));
                return;
            } catch (RuntimeException e) {
                lastError = e;
                if (Thread.currentThread().isInterrupted()) {
                    deadLetter(stamped, DeadLetterReason.SHUTDOWN_DEADLINE, "interrupted while writing");
                    return;
                }
                if (attempt < settings.maxAttempts()) {
                    metrics.recordUsageWriteRetry();
                    LOG.debugf(
                            "Usage write for %s failed (attempt %d/%d), retrying in %s: %s",
                            stamped.recordId(), attempt, settings.maxAttempts(), backoff, e.getMessage());
                    if (!sleep(backoff)) {
                        deadLetter(stamped, DeadLetterReason.SHUTDOWN_DEADLINE, "interrupted while retrying");
                        return;
                    }
                    backoff = backoff.multipliedBy(2);
                }
            }
        }

        LOG.errorv(
                lastError,
                "Usage record {0} for {1} failed after {2} attempt(s), moving to dead-letter sink",
                stamped.recordId(), stamped.identity(), settings.maxAttempts());
        deadLetter(stamped, DeadLetterReason.PERSISTENCE_FAILED, lastError != null ? lastError.getMessage() : null);
    }

    private void deadLetter(UsageRecord record, DeadLetterReason reason, String error) {
        try {
            deadLetterSink.write(new DeadLetterEntry(record, reason, error, clock.instant()));
            deadLettered.incrementAndGet();
            metrics.recordUsageDeadLettered(reason);
            if (reason == DeadLetterReason.QUEUE_FULL || reason == DeadLetterReason.RECORDER_STOPPED) {
                LOG.warnv("Usage record {0} dead-lettered: {1}", record.recordId(), reason);
            }
        } catch (RuntimeException e) {
            LOG.errorv(e, "Dead-letter sink rejected usage record, record lost: {0}", record);
        }
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Recorder tuning, usually taken from {@link UsageConfig}.
     */
    public record Settings(
            boolean enabled,
            int queueCapacity,
            int workers,
            int maxAttempts,
            Duration retryBackoff,
            Duration writeTimeout,
            Duration shutdownDeadline) {

        public Settings {
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("queueCapacity must be at least 1");
            }
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be at least 1");
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
        }

        public static Settings from(UsageConfig config) {
            return new Settings(
                    config.enabled(),
                    config.queueCapacity(),
                    config.workers(),
                    config.maxAttempts(),
                    config.retryBackoff(),
                    config.writeTimeout(),
                    config.shutdownDeadline());
        }
    }
}
