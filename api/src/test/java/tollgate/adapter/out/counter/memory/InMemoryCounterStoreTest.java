package tollgate.adapter.out.counter.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.mock.MutableClock;

@DisplayName("InMemoryCounterStore")
class InMemoryCounterStoreTest {

    private static final Duration TTL = Duration.ofSeconds(70);

    private MutableClock clock;
    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-14T12:00:00Z");
        store = new InMemoryCounterStore(clock, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private long increment(String key) {
        return store.incrementAndGet(key, TTL).await().indefinitely();
    }

    @Test
    @DisplayName("increments from one")
    void increments() {
        assertEquals(1, increment("k"));
        assertEquals(2, increment("k"));
        assertEquals(2, store.get("k").await().indefinitely());
    }

    @Test
    @DisplayName("an expired counter starts again at one")
    void expires() {
        increment("k");
        increment("k");

        clock.advance(TTL);

        assertEquals(0, store.get("k").await().indefinitely());
        assertEquals(1, increment("k"));
    }

    @Test
    @DisplayName("the expiry is set once and never extended")
    void expiryNotExtended() {
        increment("k");
        clock.advance(Duration.ofSeconds(60));
        increment("k");

        clock.advance(Duration.ofSeconds(10));

        assertEquals(0, store.get("k").await().indefinitely());
    }

    @Test
    @DisplayName("cleanup drops expired counters")
    void cleanup() {
        increment("a");
        clock.advance(Duration.ofSeconds(30));
        increment("b");
        clock.advance(Duration.ofSeconds(45));

        store.cleanupExpired();

        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("delete removes counters and ignores missing keys")
    void delete() {
        increment("a");
        increment("b");

        store.delete(List.of("a", "missing")).await().indefinitely();

        assertEquals(0, store.get("a").await().indefinitely());
        assertEquals(1, store.get("b").await().indefinitely());
    }
}
