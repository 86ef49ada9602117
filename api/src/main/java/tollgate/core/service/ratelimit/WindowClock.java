package tollgate.core.service.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import tollgate.core.config.RateLimitingConfig;
import tollgate.core.model.window.RateWindow;
import tollgate.core.model.window.WindowKind;

/**
 * Maps instants to fixed windows.
 *
 * <p>A window of size {@code s} containing epoch second {@code t} starts at
 * {@code floor(t / s) * s}. Every instance computes the same boundaries without
 * coordination, provided clocks agree to within the counter grace period.
 */
@ApplicationScoped
public class WindowClock {

    private final Map<WindowKind, Duration> sizes;

    @Inject
    public WindowClock(RateLimitingConfig config) {
        this(Map.of(
                WindowKind.MINUTE, config.windows().minute(),
                WindowKind.HOUR, config.windows().hour(),
                WindowKind.DAY, config.windows().day()));
    }

    /**
     * Create a clock with explicit sizes. Kinds missing from the map use their default size.
     *
     * @param sizes window sizes, each a positive whole number of seconds
     */
    public WindowClock(Map<WindowKind, Duration> sizes) {
        final var resolved = new EnumMap<WindowKind, Duration>(WindowKind.class);
        for (var kind : WindowKind.values()) {
            final var size = sizes.getOrDefault(kind, kind.defaultSize());
            if (size == null || size.getSeconds() <= 0 || size.getNano() != 0) {
                throw new IllegalArgumentException(
                        "Window size for %s must be a positive whole number of seconds, got %s"
                                .formatted(kind.value(), size));
            }
            resolved.put(kind, size);
        }
        this.sizes = resolved;
    }

    public static WindowClock standard() {
        return new WindowClock(Map.of());
    }

    /**
     * The window of the given kind containing {@code instant}.
     */
    public RateWindow windowAt(WindowKind kind, Instant instant) {
        final var size = sizes.get(kind);
        final var sizeSeconds = size.getSeconds();
        final var start = Math.floorDiv(instant.getEpochSecond(), sizeSeconds) * sizeSeconds;
        return new RateWindow(kind, Instant.ofEpochSecond(start), size);
    }

    /**
     * All windows containing {@code instant}, in kind order.
     */
    public List<RateWindow> windowsAt(Instant instant) {
        return List.of(
                windowAt(WindowKind.MINUTE, instant),
                windowAt(WindowKind.HOUR, instant),
                windowAt(WindowKind.DAY, instant));
    }

    public Duration sizeOf(WindowKind kind) {
        return sizes.get(kind);
    }
}
