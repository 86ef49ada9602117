package tollgate.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.adapter.out.counter.memory.InMemoryCounterStore;
import tollgate.core.config.RateLimitingConfig;
import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.ratelimit.AdmissionOutcome;
import tollgate.core.model.ratelimit.CounterStoreUnavailableException;
import tollgate.core.model.ratelimit.FailurePolicy;
import tollgate.core.model.tier.Tier;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.window.WindowKind;
import tollgate.core.port.out.CounterStore;
import tollgate.core.port.out.Metrics;
import tollgate.core.service.tier.TierPolicyRegistry;
import tollgate.mock.MutableClock;
import tollgate.mock.TestConfigs;
import tollgate.mock.TestPolicies;

@DisplayName("TieredRateLimiter")
class TieredRateLimiterTest {

    private MutableClock clock;
    private Metrics metrics;
    private TierPolicyRegistry registry;
    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-14T12:00:30Z");
        metrics = mock(Metrics.class);
        registry = new TierPolicyRegistry(TestPolicies.source(TestPolicies.standard()), metrics, clock);
        store = new InMemoryCounterStore(clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private TieredRateLimiter limiter(CounterStore counterStore, RateLimitingConfig config) {
        return new TieredRateLimiter(
                registry,
                counterStore,
                WindowClock.standard(),
                new LocalFallbackLimiter(config.fallback().instanceCount()),
                config,
                metrics,
                clock);
    }

    private TieredRateLimiter limiter() {
        return limiter(store, TestConfigs.rateLimiting());
    }

    private static AdmissionDecision check(TieredRateLimiter limiter, String identity, String tier) {
        return limiter.check(identity, tier).await().indefinitely();
    }

    private static CounterStore failingStore() {
        var failing = mock(CounterStore.class);
        when(failing.name()).thenReturn("failing");
        when(failing.incrementAndGet(anyString(), any()))
                .thenReturn(Uni.createFrom().failure(new CounterStoreUnavailableException("connection refused")));
        when(failing.get(anyString()))
                .thenReturn(Uni.createFrom().failure(new CounterStoreUnavailableException("connection refused")));
        return failing;
    }

    @Nested
    @DisplayName("admission")
    class Admission {

        @Test
        @DisplayName("allows up to the minute limit and rejects the next request")
        void rejectsOverMinuteLimit() {
            var limiter = limiter();

            for (var i = 1; i <= 100; i++) {
                var decision = check(limiter, "alice", "basic");
                assertTrue(decision.allowed(), "request " + i + " should be allowed");
                assertEquals(100 - i, decision.remaining());
            }

            var rejected = check(limiter, "alice", "basic");

            assertEquals(AdmissionOutcome.RATE_LIMITED, rejected.outcome());
            assertEquals(WindowKind.MINUTE, rejected.bindingWindow());
            assertEquals(100, rejected.limit());
            assertEquals(0, rejected.remaining());
            assertEquals(30, rejected.retryAfterSeconds());
        }

        @Test
        @DisplayName("identities are limited independently")
        void identitiesIndependent() {
            var limiter = limiter();
            for (var i = 0; i < 21; i++) {
                check(limiter, "alice", "free");
            }

            assertFalse(check(limiter, "alice", "free").allowed());
            assertTrue(check(limiter, "bob", "free").allowed());
        }

        @Test
        @DisplayName("a new minute window admits again")
        void rollover() {
            var limiter = limiter();
            for (var i = 0; i < 21; i++) {
                check(limiter, "alice", "free");
            }
            assertFalse(check(limiter, "alice", "free").allowed());

            clock.advance(Duration.ofSeconds(30));

            var decision = check(limiter, "alice", "free");
            assertTrue(decision.allowed());
            assertEquals(19, decision.remaining());
        }

        @Test
        @DisplayName("the exceeded window with the longest reset binds")
        void longestResetBinds() {
            registry.replace(List.of(TierPolicy.builder(Tier.BASIC).limits(5, 5, 1000).build()));
            var limiter = limiter();
            for (var i = 0; i < 5; i++) {
                assertTrue(check(limiter, "alice", "basic").allowed());
            }

            var rejected = check(limiter, "alice", "basic");

            assertEquals(WindowKind.HOUR, rejected.bindingWindow());
            assertEquals(3570, rejected.retryAfterSeconds());
        }

        @Test
        @DisplayName("rejected requests are still counted")
        void rejectedRequestsCounted() {
            var limiter = limiter();
            for (var i = 0; i < 25; i++) {
                check(limiter, "alice", "free");
            }

            var status = limiter.status("alice", "free").await().indefinitely();

            assertEquals(25, status.window(WindowKind.MINUTE).orElseThrow().count());
            assertEquals(25, status.window(WindowKind.DAY).orElseThrow().count());
        }

        @Test
        @DisplayName("unlimited windows are counted but never reject")
        void unlimitedWindows() {
            registry.replace(List.of(TierPolicy.builder(Tier.ENTERPRISE).limitPerMinute(3).build()));
            var limiter = limiter();

            var decision = check(limiter, "alice", "enterprise");

            var day = decision.window(WindowKind.DAY).orElseThrow();
            assertTrue(day.unlimited());
            assertEquals(1, day.count());
            assertEquals(TierPolicy.UNLIMITED, day.remaining());
        }

        @Test
        @DisplayName("unknown tiers are limited under the most restrictive policy")
        void unknownTier() {
            var decision = check(limiter(), "alice", "platinum");

            assertTrue(decision.allowed());
            assertTrue(decision.policyFallback());
            assertEquals(Tier.FREE, decision.tier());
            assertEquals(20, decision.limit());
        }

        @Test
        @DisplayName("every decision carries a distinct usage id")
        void distinctUsageIds() {
            var limiter = limiter();

            var first = check(limiter, "alice", "basic");
            var second = check(limiter, "alice", "basic");

            assertNotNull(first.usageId());
            assertNotEquals(first.usageId(), second.usageId());
        }

        @Test
        @DisplayName("counters are created with the window size plus grace as time to live")
        void counterTtl() {
            var counting = mock(CounterStore.class);
            when(counting.name()).thenReturn("mock");
            when(counting.incrementAndGet(anyString(), any())).thenReturn(Uni.createFrom().item(1L));

            check(limiter(counting, TestConfigs.rateLimiting()), "alice", "basic");

            verify(counting).incrementAndGet(eq("test:rl:alice:minute:1773489600"), eq(Duration.ofSeconds(70)));
            verify(counting).incrementAndGet(eq("test:rl:alice:hour:1773489600"), eq(Duration.ofSeconds(3610)));
            verify(counting).incrementAndGet(eq("test:rl:alice:day:1773446400"), eq(Duration.ofSeconds(86410)));
        }

        @Test
        @DisplayName("admits everything without counting when disabled")
        void disabled() {
            var config = TestConfigs.rateLimiting();
            when(config.enabled()).thenReturn(false);
            var limiter = limiter(store, config);

            for (var i = 0; i < 30; i++) {
                assertTrue(check(limiter, "alice", "free").allowed());
            }
            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("admits exactly the limit under concurrent checks")
        void exactUnderContention() throws Exception {
            registry.replace(List.of(TierPolicy.builder(Tier.BASIC).limits(50, 1000, 10000).build()));
            var limiter = limiter();
            var executor = Executors.newFixedThreadPool(16);
            var start = new CountDownLatch(1);

            try {
                var tasks = new ArrayList<Callable<Boolean>>();
                for (var i = 0; i < 200; i++) {
                    tasks.add(() -> {
                        start.await();
                        return check(limiter, "alice", "basic").allowed();
                    });
                }
                var futures = new ArrayList<Future<Boolean>>();
                for (var task : tasks) {
                    futures.add(executor.submit(task));
                }
                start.countDown();

                var allowed = 0;
                for (var future : futures) {
                    if (future.get(10, TimeUnit.SECONDS)) {
                        allowed++;
                    }
                }

                assertEquals(50, allowed);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("counter store failures")
    class StoreFailures {

        @Test
        @DisplayName("fail-open with fallback enforces the local share of the limits")
        void failOpenWithFallback() {
            var limiter = limiter(failingStore(), TestConfigs.rateLimiting(FailurePolicy.FAIL_OPEN, true));

            for (var i = 0; i < 20; i++) {
                var decision = check(limiter, "alice", "free");
                assertTrue(decision.allowed());
                assertTrue(decision.degraded());
            }
            var rejected = check(limiter, "alice", "free");

            assertEquals(AdmissionOutcome.RATE_LIMITED, rejected.outcome());
            assertTrue(rejected.degraded());
            assertTrue(limiter.counterStoreState().degraded());
            verify(metrics, atLeastOnce()).recordCounterStoreFailure("failing", "error");
        }

        @Test
        @DisplayName("fail-open without fallback admits without counts")
        void failOpenWithoutFallback() {
            var limiter = limiter(failingStore(), TestConfigs.rateLimiting(FailurePolicy.FAIL_OPEN, false));

            for (var i = 0; i < 50; i++) {
                var decision = check(limiter, "alice", "free");
                assertTrue(decision.allowed());
                assertTrue(decision.degraded());
                assertTrue(decision.windows().isEmpty());
            }
        }

        @Test
        @DisplayName("fail-closed refuses with unavailable, not rate limited")
        void failClosed() {
            var limiter = limiter(failingStore(), TestConfigs.rateLimiting(FailurePolicy.FAIL_CLOSED, true));

            var decision = check(limiter, "alice", "basic");

            assertEquals(AdmissionOutcome.UNAVAILABLE, decision.outcome());
            assertFalse(decision.allowed());
            assertTrue(decision.degraded());
            assertEquals(1, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("a store that does not answer in time is treated as unavailable")
        void timeout() {
            var silent = mock(CounterStore.class);
            when(silent.name()).thenReturn("silent");
            when(silent.incrementAndGet(anyString(), any())).thenReturn(Uni.createFrom().nothing());
            var limiter = limiter(silent, TestConfigs.rateLimiting(FailurePolicy.FAIL_CLOSED, false));

            var decision = check(limiter, "alice", "basic");

            assertEquals(AdmissionOutcome.UNAVAILABLE, decision.outcome());
            verify(metrics).recordCounterStoreFailure("silent", "timeout");
        }

        @Test
        @DisplayName("leaves degraded mode once the store answers again")
        void recovers() {
            var flaky = mock(CounterStore.class);
            when(flaky.name()).thenReturn("flaky");
            when(flaky.incrementAndGet(anyString(), any()))
                    .thenReturn(Uni.createFrom().failure(new CounterStoreUnavailableException("down")))
                    .thenReturn(Uni.createFrom().item(1L));
            var limiter = limiter(flaky, TestConfigs.rateLimiting(FailurePolicy.FAIL_OPEN, true));

            assertTrue(check(limiter, "alice", "basic").degraded());
            assertTrue(limiter.counterStoreState().degraded());

            var recovered = check(limiter, "alice", "basic");

            assertFalse(recovered.degraded());
            assertFalse(limiter.counterStoreState().degraded());
            assertTrue(limiter.counterStoreState().lastFailureAt().isPresent());
        }

        @Test
        @DisplayName("status reports degraded when the store cannot be read")
        void statusDegraded() {
            var limiter = limiter(failingStore(), TestConfigs.rateLimiting());

            var status = limiter.status("alice", "basic").await().indefinitely();

            assertTrue(status.degraded());
            assertTrue(status.windows().isEmpty());
        }
    }

    @Nested
    @DisplayName("status and reset")
    class StatusAndReset {

        @Test
        @DisplayName("status reads counts without incrementing them")
        void statusDoesNotCount() {
            var limiter = limiter();
            check(limiter, "alice", "basic");
            check(limiter, "alice", "basic");

            var first = limiter.status("alice", "basic").await().indefinitely();
            var second = limiter.status("alice", "basic").await().indefinitely();

            assertEquals(2, first.window(WindowKind.MINUTE).orElseThrow().count());
            assertEquals(2, second.window(WindowKind.MINUTE).orElseThrow().count());
            assertEquals(98, second.window(WindowKind.MINUTE).orElseThrow().remaining());
        }

        @Test
        @DisplayName("reset clears the current windows of an identity")
        void reset() {
            var limiter = limiter();
            for (var i = 0; i < 21; i++) {
                check(limiter, "alice", "free");
            }
            assertFalse(check(limiter, "alice", "free").allowed());

            limiter.reset("alice").await().indefinitely();

            assertTrue(check(limiter, "alice", "free").allowed());
        }
    }
}
