package tollgate.core.model.window;

import java.time.Duration;
import java.time.Instant;

/**
 * A single fixed window instance, e.g. the minute starting at 12:03:00Z.
 *
 * <p>Windows are never stored. Only the counter key derived from
 * {@code (identity, kind, start)} is persisted.
 *
 * @param kind  the window kind
 * @param start inclusive start, aligned to a multiple of {@code size} since the epoch
 * @param size  the window length
 */
public record RateWindow(WindowKind kind, Instant start, Duration size) {

    public RateWindow {
        if (kind == null) {
            throw new IllegalArgumentException("Window kind cannot be null");
        }
        if (start == null) {
            throw new IllegalArgumentException("Window start cannot be null");
        }
        if (size == null || size.isZero() || size.isNegative()) {
            throw new IllegalArgumentException("Window size must be positive");
        }
    }

    /**
     * Exclusive end of the window.
     */
    public Instant end() {
        return start.plus(size);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end());
    }

    /**
     * Whole seconds until the window closes, rounded up and never less than one.
     *
     * @param now the current instant
     * @return seconds until reset
     */
    public long secondsUntilReset(Instant now) {
        final var millis = Duration.between(now, end()).toMillis();
        if (millis <= 0) {
            return 1;
        }
        return Math.max(1, (millis + 999) / 1000);
    }

    public long startEpochSecond() {
        return start.getEpochSecond();
    }
}
