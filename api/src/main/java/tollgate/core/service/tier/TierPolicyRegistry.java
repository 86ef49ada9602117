package tollgate.core.service.tier;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.core.model.tier.PolicyNotFoundException;
import tollgate.core.model.tier.ResolvedPolicy;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.tier.TierPolicyTable;
import tollgate.core.port.in.TierPolicyManagement;
import tollgate.core.port.out.Metrics;
import tollgate.core.port.out.TierPolicySource;

/**
 * Holds the active tier policy table and swaps it atomically.
 *
 * <p>The table is loaded when the registry is created, so invalid startup
 * configuration fails the application. Later replacements are validated
 * completely before the reference is swapped; a rejected table leaves the
 * previous one active.
 */
@ApplicationScoped
public class TierPolicyRegistry implements TierPolicyManagement {

    private static final Logger LOG = Logger.getLogger(TierPolicyRegistry.class);

    private final TierPolicySource source;
    private final Metrics metrics;
    private final Clock clock;
    private final AtomicLong versions = new AtomicLong();
    private final AtomicReference<TierPolicyTable> table;

    @Inject
    public TierPolicyRegistry(TierPolicySource source, Metrics metrics, Clock clock) {
        this.source = source;
        this.metrics = metrics;
        this.clock = clock;
        this.table = new AtomicReference<>(build(source.load()));
        LOG.infov(
                "Loaded {0} tier policies from {1}",
                table.get().size(), source.describe());
    }

    @Override
    public TierPolicyTable current() {
        return table.get();
    }

    @Override
    public ResolvedPolicy resolve(String tierValue) {
        final var snapshot = table.get();
        try {
            return ResolvedPolicy.exact(snapshot.require(tierValue), tierValue);
        } catch (PolicyNotFoundException e) {
            final var fallback = snapshot.mostRestrictive();
            LOG.warnv(
                    "Unknown tier {0}, evaluating under most restrictive tier {1}",
                    e.tierValue(), fallback.tier().value());
            metrics.recordPolicyFallback(tierValue == null ? "missing" : tierValue);
            return ResolvedPolicy.fallback(fallback, tierValue);
        }
    }

    @Override
    public TierPolicyTable replace(List<TierPolicy> policies) {
        final var next = build(policies);
        table.set(next);
        LOG.infov("Installed tier policy table version {0} with {1} tiers", next.version(), next.size());
        return next;
    }

    @Override
    public TierPolicyTable reload() {
        LOG.infov("Reloading tier policies from {0}", source.describe());
        return replace(source.load());
    }

    private TierPolicyTable build(List<TierPolicy> policies) {
        return TierPolicyTable.of(versions.incrementAndGet(), clock.instant(), policies);
    }
}
