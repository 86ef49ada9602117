package tollgate.core.service.tier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.port.out.Metrics;
import tollgate.core.port.out.TierPolicySource;
import tollgate.mock.TestPolicies;

@DisplayName("TierPolicyRegistry")
class TierPolicyRegistryTest {

    private TierPolicySource source;
    private Metrics metrics;
    private TierPolicyRegistry registry;

    @BeforeEach
    void setUp() {
        source = mock(TierPolicySource.class);
        metrics = mock(Metrics.class);
        when(source.load()).thenReturn(TestPolicies.standard());
        when(source.describe()).thenReturn("mock");
        registry = new TierPolicyRegistry(
                source, metrics, Clock.fixed(Instant.parse("2026-03-14T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("fails at startup when the source yields no policies")
    void failsOnEmptySource() {
        var empty = mock(TierPolicySource.class);
        when(empty.load()).thenReturn(List.of());

        assertThrows(IllegalArgumentException.class, () -> new TierPolicyRegistry(empty, metrics, Clock.systemUTC()));
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("returns the exact policy for a known tier")
        void knownTier() {
            var resolved = registry.resolve("basic");

            assertEquals(Tier.BASIC, resolved.tier());
            assertFalse(resolved.fallback());
            verify(metrics, never()).recordPolicyFallback("basic");
        }

        @Test
        @DisplayName("falls back to the most restrictive policy for an unknown tier")
        void unknownTier() {
            var resolved = registry.resolve("platinum");

            assertEquals(Tier.FREE, resolved.tier());
            assertTrue(resolved.fallback());
            assertEquals("platinum", resolved.requestedTier());
            verify(metrics).recordPolicyFallback("platinum");
        }

        @Test
        @DisplayName("falls back when the tier is missing")
        void missingTier() {
            var resolved = registry.resolve(null);

            assertTrue(resolved.fallback());
            verify(metrics).recordPolicyFallback("missing");
        }
    }

    @Nested
    @DisplayName("replace")
    class Replace {

        @Test
        @DisplayName("installs a new table with a higher version")
        void installsNewTable() {
            var before = registry.current();
            var updated = TierPolicy.builder(Tier.BASIC).limits(5, 50, 500).build();

            var installed = registry.replace(List.of(TestPolicies.free(), updated));

            assertTrue(installed.version() > before.version());
            assertSame(installed, registry.current());
            assertEquals(5, registry.resolve("basic").policy().limitPerMinute());
            assertTrue(registry.resolve("pro").fallback());
        }

        @Test
        @DisplayName("keeps the previous table when the new one is invalid")
        void rejectsInvalidTable() {
            var before = registry.current();

            assertThrows(
                    IllegalArgumentException.class,
                    () -> registry.replace(List.of(TestPolicies.basic(), TestPolicies.basic())));

            assertSame(before, registry.current());
        }

        @Test
        @DisplayName("reload reads the source again")
        void reload() {
            when(source.load()).thenReturn(List.of(TestPolicies.enterprise()));

            var reloaded = registry.reload();

            assertEquals(1, reloaded.size());
            assertEquals(Tier.ENTERPRISE, registry.current().mostRestrictive().tier());
        }
    }
}
