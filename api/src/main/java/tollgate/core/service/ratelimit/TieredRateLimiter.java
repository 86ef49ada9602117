package tollgate.core.service.ratelimit;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.RateLimitingConfig;
import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.ratelimit.AdmissionOutcome;
import tollgate.core.model.ratelimit.CounterKey;
import tollgate.core.model.ratelimit.CounterStoreState;
import tollgate.core.model.ratelimit.CounterStoreUnavailableException;
import tollgate.core.model.ratelimit.FailurePolicy;
import tollgate.core.model.ratelimit.RateLimitStatus;
import tollgate.core.model.ratelimit.WindowStatus;
import tollgate.core.model.tier.ResolvedPolicy;
import tollgate.core.model.window.RateWindow;
import tollgate.core.port.in.AdmissionControl;
import tollgate.core.port.in.TierPolicyManagement;
import tollgate.core.port.out.CounterStore;
import tollgate.core.port.out.Metrics;

/**
 * Multi-window fixed-window rate limiter backed by a shared counter store.
 *
 * <p>Every check increments the minute, hour, and day counters of the identity,
 * concurrently and even when one of them is already over its limit. This
 * over-counts rejected requests, which keeps retries after a rejection from
 * sneaking through on the other windows. Unlimited windows are counted but
 * never compared.
 *
 * <p>When the store fails or does not answer within
 * {@code tollgate.rate-limiting.store-timeout}:
 * <ul>
 *   <li>{@link FailurePolicy#FAIL_OPEN}: the request is admitted and flagged degraded.
 *       If the local fallback is enabled, per-instance shares of the limits still apply.</li>
 *   <li>{@link FailurePolicy#FAIL_CLOSED}: the request is refused with
 *       {@link AdmissionOutcome#UNAVAILABLE}, distinct from a rate limit rejection.</li>
 * </ul>
 */
@ApplicationScoped
public class TieredRateLimiter implements AdmissionControl {

    private static final Logger LOG = Logger.getLogger(TieredRateLimiter.class);

    private final TierPolicyManagement policies;
    private final CounterStore counterStore;
    private final WindowClock windowClock;
    private final LocalFallbackLimiter fallbackLimiter;
    private final RateLimitingConfig config;
    private final Metrics metrics;
    private final Clock clock;
    private final AtomicReference<CounterStoreState> storeState;

    @Inject
    public TieredRateLimiter(
            TierPolicyManagement policies,
            CounterStore counterStore,
            WindowClock windowClock,
            LocalFallbackLimiter fallbackLimiter,
            RateLimitingConfig config,
            Metrics metrics,
            Clock clock) {
        this.policies = policies;
        this.counterStore = counterStore;
        this.windowClock = windowClock;
        this.fallbackLimiter = fallbackLimiter;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.storeState = new AtomicReference<>(CounterStoreState.healthy(counterStore.name()));
    }

    @Override
    public Uni<AdmissionDecision> check(String identity, String tierValue) {
        final var usageId = UUID.randomUUID().toString();
        final var resolved = policies.resolve(tierValue);

        if (!config.enabled()) {
            return Uni.createFrom()
                    .item(AdmissionDecision.unmetered(identity, resolved.tier(), resolved.fallback(), usageId));
        }

        final var startNanos = System.nanoTime();
        final var now = clock.instant();
        final var windows = windowClock.windowsAt(now);
        final var increments = windows.stream()
                .map(window -> counterStore.incrementAndGet(
                        keyFor(identity, window), window.size().plus(config.windowGrace())))
                .toList();

        return withStoreTimeout(Uni.combine().all().unis(increments).with(TieredRateLimiter::toCounts))
                .map(counts -> {
                    markHealthy();
                    return evaluate(identity, resolved, windows, counts, now, false, usageId);
                })
                .onFailure()
                .recoverWithItem(error -> degrade(identity, resolved, windows, now, usageId, error))
                .invoke(decision -> recordDecision(decision, startNanos));
    }

    @Override
    public Uni<RateLimitStatus> status(String identity, String tierValue) {
        final var resolved = policies.resolve(tierValue);
        final var now = clock.instant();
        final var windows = windowClock.windowsAt(now);
        final var reads = windows.stream()
                .map(window -> counterStore.get(keyFor(identity, window)))
                .toList();

        return withStoreTimeout(Uni.combine().all().unis(reads).with(TieredRateLimiter::toCounts))
                .map(counts -> new RateLimitStatus(
                        identity, resolved.tier(), statuses(resolved, windows, counts, now, false), false))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Could not read rate limit status for {0}: {1}", identity, error.getMessage());
                    return new RateLimitStatus(identity, resolved.tier(), List.of(), true);
                });
    }

    @Override
    public Uni<Void> reset(String identity) {
        final var keys = windowClock.windowsAt(clock.instant()).stream()
                .map(window -> keyFor(identity, window))
                .toList();
        LOG.infov("Resetting rate limit counters for {0}", identity);
        return counterStore.delete(keys);
    }

    @Override
    public CounterStoreState counterStoreState() {
        return storeState.get();
    }

    private <T> Uni<T> withStoreTimeout(Uni<T> operation) {
        final var timeout = config.storeTimeout();
        return operation.ifNoItem().after(timeout).failWith(() -> {
            metrics.recordCounterStoreFailure(counterStore.name(), "timeout");
            return new StoreTimeoutException(
                    "Counter store %s did not answer within %s".formatted(counterStore.name(), timeout));
        });
    }

    private AdmissionDecision degrade(
            String identity,
            ResolvedPolicy resolved,
            List<RateWindow> windows,
            Instant now,
            String usageId,
            Throwable error) {
        if (!(error instanceof StoreTimeoutException)) {
            metrics.recordCounterStoreFailure(counterStore.name(), "error");
        }
        markDegraded(now, error);

        if (config.failurePolicy() == FailurePolicy.FAIL_CLOSED) {
            final var retryAfter = Math.max(1, config.unavailableRetryAfter().toSeconds());
            return AdmissionDecision.unavailable(identity, resolved.tier(), retryAfter, resolved.fallback(), usageId);
        }

        if (!config.fallback().enabled()) {
            return AdmissionDecision.degradedAllow(identity, resolved.tier(), resolved.fallback(), usageId);
        }

        final var counts = windows.stream()
                .map(window -> fallbackLimiter.incrementAndGet(identity, window))
                .toList();
        return evaluate(identity, resolved, windows, counts, now, true, usageId);
    }

    private AdmissionDecision evaluate(
            String identity,
            ResolvedPolicy resolved,
            List<RateWindow> windows,
            List<Long> counts,
            Instant now,
            boolean degraded,
            String usageId) {
        return AdmissionDecision.fromWindows(
                identity,
                resolved.tier(),
                statuses(resolved, windows, counts, now, degraded),
                degraded,
                resolved.fallback(),
                usageId);
    }

    private List<WindowStatus> statuses(
            ResolvedPolicy resolved, List<RateWindow> windows, List<Long> counts, Instant now, boolean local) {
        final var statuses = new ArrayList<WindowStatus>(windows.size());
        for (var i = 0; i < windows.size(); i++) {
            final var window = windows.get(i);
            final var configured = resolved.policy().limitFor(window.kind());
            final var limit = local ? fallbackLimiter.localLimit(configured) : configured;
            statuses.add(WindowStatus.evaluate(window.kind(), limit, counts.get(i), window.secondsUntilReset(now)));
        }
        return statuses;
    }

    private void recordDecision(AdmissionDecision decision, long startNanos) {
        final var tier = decision.tier().value();
        metrics.recordAdmission(tier, decision.outcome(), decision.degraded(), System.nanoTime() - startNanos);

        if (decision.outcome() == AdmissionOutcome.RATE_LIMITED) {
            metrics.recordRateLimitExceeded(tier, decision.bindingWindow());
            LOG.debugf(
                    "Rate limited %s (%s) on %s window, retry after %ds",
                    decision.identity(), tier, decision.bindingWindow().value(), decision.retryAfterSeconds());
        }
    }

    private void markHealthy() {
        final var previous = storeState.getAndUpdate(CounterStoreState::recovered);
        if (previous.degraded()) {
            LOG.infov("Counter store {0} recovered, leaving degraded mode", previous.store());
            fallbackLimiter.clear();
        }
    }

    private void markDegraded(Instant now, Throwable error) {
        final var previous = storeState.getAndUpdate(state -> state.failed(now, error.getMessage()));
        if (!previous.degraded()) {
            LOG.warnv(
                    error,
                    "Counter store {0} unavailable, entering degraded mode with policy {1}",
                    previous.store(), config.failurePolicy());
        } else {
            LOG.debugf("Counter store %s still unavailable: %s", previous.store(), error.getMessage());
        }
    }

    private String keyFor(String identity, RateWindow window) {
        return CounterKey.of(identity, window).render(config.counterStore().keyPrefix());
    }

    private static List<Long> toCounts(List<?> results) {
        final var counts = new ArrayList<Long>(results.size());
        for (var result : results) {
            counts.add(result instanceof Number n ? n.longValue() : 0L);
        }
        return counts;
    }

    private static final class StoreTimeoutException extends CounterStoreUnavailableException {

        StoreTimeoutException(String message) {
            super(message);
        }
    }
}
