package tollgate.mock;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Replaces the system clock in {@code @QuarkusTest} runs so window arithmetic is deterministic.
 */
@ApplicationScoped
public class TestClockProducer {

    /** Thirty seconds into a minute, well away from any window boundary. */
    public static final Instant START = Instant.parse("2026-03-14T12:00:30Z");

    @Produces
    @Singleton
    public MutableClock clock() {
        return new MutableClock(START);
    }
}
